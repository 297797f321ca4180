package org.smileyface.leaguecrawler.service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Immutable outcome of one crawl run.
 */
public final class CrawlSummary {
    private final CrawlState state;
    private final int countries;
    private final int countriesWithoutLeagues;
    private final int leaguesFetched;
    private final int leaguesCached;
    private final int teams;
    private final List<String> pendingLeagues;
    private final Path checkpointFile;
    private final Path finalFile;
    private final Instant startedAt;
    private final Instant finishedAt;

    public CrawlSummary(CrawlState state, int countries, int countriesWithoutLeagues, int leaguesFetched,
                        int leaguesCached, int teams, List<String> pendingLeagues, Path checkpointFile,
                        Path finalFile, Instant startedAt, Instant finishedAt) {
        this.state = state;
        this.countries = countries;
        this.countriesWithoutLeagues = countriesWithoutLeagues;
        this.leaguesFetched = leaguesFetched;
        this.leaguesCached = leaguesCached;
        this.teams = teams;
        this.pendingLeagues = pendingLeagues != null ? List.copyOf(pendingLeagues) : List.of();
        this.checkpointFile = checkpointFile;
        this.finalFile = finalFile;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public CrawlState getState() { return state; }
    public int getCountries() { return countries; }
    public int getCountriesWithoutLeagues() { return countriesWithoutLeagues; }
    public int getLeaguesFetched() { return leaguesFetched; }
    public int getLeaguesCached() { return leaguesCached; }
    public int getTeams() { return teams; }
    /** "Country / League" labels of leagues that still have no team after this run. */
    public List<String> getPendingLeagues() { return pendingLeagues; }
    public Path getCheckpointFile() { return checkpointFile; }
    /** Null unless the run completed. */
    public Path getFinalFile() { return finalFile; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    public Duration getDuration() {
        if (startedAt == null || finishedAt == null) return Duration.ZERO;
        return Duration.between(startedAt, finishedAt);
    }
}
