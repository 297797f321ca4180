package org.smileyface.leaguecrawler.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.leaguecrawler.checkpoint.CheckpointFiles;
import org.smileyface.leaguecrawler.checkpoint.CheckpointStore;
import org.smileyface.leaguecrawler.checkpoint.CountryProgress;
import org.smileyface.leaguecrawler.checkpoint.LeagueProgress;
import org.smileyface.leaguecrawler.checkpoint.ProgressSnapshot;
import org.smileyface.leaguecrawler.crawler.CrawlerProperties;
import org.smileyface.leaguecrawler.crawler.RateLimiter;
import org.smileyface.leaguecrawler.crawler.RetryPolicy;
import org.smileyface.leaguecrawler.extractor.CountryExtractor;
import org.smileyface.leaguecrawler.extractor.LeagueExtractor;
import org.smileyface.leaguecrawler.fetcher.FetchException;
import org.smileyface.leaguecrawler.fetcher.FetchRequest;
import org.smileyface.leaguecrawler.fetcher.PageFetcher;
import org.smileyface.leaguecrawler.model.Country;
import org.smileyface.leaguecrawler.model.League;
import org.smileyface.leaguecrawler.model.LeagueStatus;
import org.smileyface.leaguecrawler.model.Team;
import org.smileyface.leaguecrawler.util.CrawlerUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Walks countries → leagues → teams and keeps the progress snapshot on disk so that a killed run
 * can be restarted without fetching finished leagues again.
 *
 * <p>A league counts as finished once its snapshot entry holds at least one team. The checkpoint
 * is rewritten after every league fetch, so a crash loses at most the league in flight. The final
 * file is written only when every discovered country has been walked.</p>
 *
 * <p>Failure handling by level:</p>
 * <ul>
 *   <li>countries: discovered once; failure aborts the run, since nothing is left to crawl</li>
 *   <li>leagues of one country: failure skips the country for this run, its entry stays</li>
 *   <li>teams of one league: retried by {@link RetryPolicy}, never fails the run</li>
 * </ul>
 */
public class CrawlOrchestrator {

    private static final Logger log = LogManager.getLogger();

    private final CrawlerProperties properties;
    private final PageFetcher fetcher;
    private final CheckpointStore checkpointStore;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final Clock clock;
    private final CountryExtractor countryExtractor;

    private volatile CrawlState state = CrawlState.NEW;

    public CrawlOrchestrator(CrawlerProperties properties,
                             PageFetcher fetcher,
                             CheckpointStore checkpointStore,
                             RetryPolicy retryPolicy,
                             RateLimiter rateLimiter,
                             Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.countryExtractor = new CountryExtractor(properties.getSelectors());
    }

    public CrawlState getState() {
        return state;
    }

    /**
     * Runs one crawl from the given entry page.
     *
     * @param entryUrl page holding the country menu
     * @return the final snapshot and a summary of the run
     * @throws CrawlAbortedException when the checkpoint cannot be read, the fetcher cannot be
     *                               opened, countries cannot be discovered or the final file
     *                               cannot be written
     */
    public synchronized CrawlResult run(String entryUrl) {
        Objects.requireNonNull(entryUrl, "entryUrl");
        Run run = new Run(CheckpointFiles.forToday(
                Path.of(properties.getOutput().getDirectory()), properties.getOutput().getPrefix(), clock));
        transitionTo(CrawlState.RUNNING, run, null);

        ProgressSnapshot snapshot;
        boolean interrupted = false;
        try {
            snapshot = loadSnapshot(run.files);
            openFetcher();
            List<Country> countries = discoverCountries(entryUrl);
            run.countries = countries.size();
            for (Country country : countries) {
                if (stopRequested()) {
                    interrupted = true;
                    break;
                }
                crawlCountry(snapshot, entryUrl, country, run);
            }
            interrupted = interrupted || stopRequested();
        } catch (RuntimeException e) {
            transitionTo(CrawlState.ABORTED, run, e);
            throw e;
        } finally {
            fetcher.close();
        }

        if (interrupted) {
            transitionTo(CrawlState.INTERRUPTED, run, null);
            return new CrawlResult(snapshot, summary(run, snapshot, null));
        }

        Path finalFile = run.files.finalPath();
        try {
            checkpointStore.save(snapshot, finalFile);
        } catch (IOException e) {
            CrawlAbortedException ex = new CrawlAbortedException("Failed to write final snapshot " + finalFile, e);
            transitionTo(CrawlState.ABORTED, run, ex);
            throw ex;
        }
        transitionTo(CrawlState.COMPLETED, run, null);
        CrawlSummary summary = summary(run, snapshot, finalFile);
        logSummary(summary);
        return new CrawlResult(snapshot, summary);
    }

    private ProgressSnapshot loadSnapshot(CheckpointFiles files) {
        Path checkpoint = files.checkpointPath();
        if (!Files.exists(checkpoint)) {
            try {
                List<Path> earlier = files.earlierCheckpoints();
                if (!earlier.isEmpty()) {
                    log.info("Checkpoints from earlier runs found: {}. Copy one to {} to resume it.", earlier, checkpoint);
                }
            } catch (UncheckedIOException e) {
                log.debug("Could not look for earlier checkpoints: {}", e.getMessage());
            }
        }
        try {
            return checkpointStore.load(checkpoint);
        } catch (UncheckedIOException e) {
            throw new CrawlAbortedException("Cannot read checkpoint " + checkpoint, e);
        }
    }

    private void openFetcher() {
        try {
            fetcher.open();
        } catch (FetchException e) {
            throw new CrawlAbortedException("Cannot open page fetcher: " + e.getMessage(), e);
        }
    }

    private List<Country> discoverCountries(String entryUrl) {
        CrawlerProperties.Selectors selectors = properties.getSelectors();
        FetchRequest request = new FetchRequest(entryUrl,
                List.of(selectors.getCountryMenuToggle()),
                selectors.getCountryItems(),
                properties.getDiscoveryTimeoutMs(),
                properties.getNavigationTimeoutMs());
        Map<String, Country> countries;
        try {
            countries = countryExtractor.extract(fetcher.fetch(request));
        } catch (FetchException e) {
            throw new CrawlAbortedException("Country discovery failed: " + e.getMessage(), e);
        }
        if (countries.isEmpty()) {
            throw new CrawlAbortedException("Country discovery found no countries on " + entryUrl);
        }
        log.info("Found {} countries", countries.size());
        return new ArrayList<>(countries.values());
    }

    private List<League> discoverLeagues(String entryUrl, Country country) {
        CrawlerProperties.Selectors selectors = properties.getSelectors();
        try {
            LeagueExtractor extractor = new LeagueExtractor(selectors, country.id());
            FetchRequest request = new FetchRequest(entryUrl,
                    List.of(selectors.getCountryMenuToggle(), "#" + country.id()),
                    extractor.getLinkSelector(),
                    properties.getDiscoveryTimeoutMs(),
                    properties.getNavigationTimeoutMs());
            List<League> leagues = new ArrayList<>(extractor.extract(fetcher.fetch(request)).values());
            log.debug("Found {} leagues for {}", leagues.size(), country.name());
            return leagues;
        } catch (FetchException | RuntimeException e) {
            log.warn("League discovery failed for {}: {}", country.name(), e.getMessage());
            return List.of();
        }
    }

    private void crawlCountry(ProgressSnapshot snapshot, String entryUrl, Country country, Run run) {
        log.info("---- COUNTRY: {}", country.name());
        CountryProgress entry = snapshot.ensureCountry(country.name(),
                CrawlerUtils.slug(country.url()), country.url(), mirrorUrl(country.url()));
        if (!Objects.equals(entry.getUrl(), country.url())) {
            log.warn("Country name '{}' is shared by {} and {}; their leagues share one entry",
                    country.name(), entry.getUrl(), country.url());
        }

        List<League> leagues = discoverLeagues(entryUrl, country);
        if (leagues.isEmpty()) {
            run.countriesWithoutLeagues++;
            log.warn("No leagues for {}; skipping it for this run", country.name());
            return;
        }

        int totalTeams = 0;
        for (League league : leagues) {
            if (stopRequested()) return;

            if (snapshot.isLeagueComplete(country.name(), league.name())) {
                int cached = snapshot.league(country.name(), league.name())
                        .map(l -> l.getTeams().size()).orElse(0);
                log.debug("Skip league (cached): {}", league.name());
                totalTeams += cached;
                run.leaguesCached++;
                continue;
            }

            log.debug(" -> LEAGUE: {}", league.name());
            List<Team> teams = retryPolicy.fetchTeams(league);
            boolean cup = league.cup() || teams.stream().anyMatch(Team::isCupSentinel);
            LeagueProgress progress = new LeagueProgress(CrawlerUtils.slug(league.url()), league.url(),
                    mirrorUrl(league.url()), cup, teams);
            snapshot.putLeague(country.name(), league.name(), progress).ifPresent(previous -> {
                if (!Objects.equals(previous.getUrl(), league.url())) {
                    log.warn("League name '{}' in {} is shared by {} and {}; keeping the latter",
                            league.name(), country.name(), previous.getUrl(), league.url());
                }
            });
            totalTeams += teams.size();
            run.leaguesFetched++;
            if (progress.getStatus() == LeagueStatus.PENDING) {
                log.debug("League {} stays pending", league.name());
            }

            flush(snapshot, run.files.checkpointPath());
            rateLimiter.pause();
        }

        log.info("{}: {} teams across {} leagues", country.name(), totalTeams, entry.getLeagues().size());
    }

    private void flush(ProgressSnapshot snapshot, Path checkpoint) {
        try {
            checkpointStore.save(snapshot, checkpoint);
        } catch (IOException e) {
            // the next flush rewrites the whole snapshot
            log.error("Failed to write checkpoint {}: {}", checkpoint, e.getMessage(), e);
        }
    }

    private String mirrorUrl(String url) {
        CrawlerProperties.Mirror mirror = properties.getMirror();
        return CrawlerUtils.mirrorUrl(url, mirror.getSourceHost(), mirror.getTargetHost());
    }

    private static boolean stopRequested() {
        return Thread.currentThread().isInterrupted();
    }

    private CrawlSummary summary(Run run, ProgressSnapshot snapshot, Path finalFile) {
        return new CrawlSummary(state, run.countries, run.countriesWithoutLeagues, run.leaguesFetched,
                run.leaguesCached, snapshot.teamCount(), snapshot.pendingLeagues(),
                run.files.checkpointPath(), finalFile, run.startedAt, run.finishedAt);
    }

    private void logSummary(CrawlSummary summary) {
        log.info("DONE in {}s -> {} ({} countries, {} leagues fetched, {} cached, {} teams)",
                String.format("%.1f", summary.getDuration().toMillis() / 1000.0), summary.getFinalFile(),
                summary.getCountries(), summary.getLeaguesFetched(), summary.getLeaguesCached(), summary.getTeams());
        if (summary.getCountriesWithoutLeagues() > 0) {
            log.warn("{} countries had no leagues this run and will be retried next run",
                    summary.getCountriesWithoutLeagues());
        }
        List<String> pending = summary.getPendingLeagues();
        if (!pending.isEmpty()) {
            log.warn("{} leagues still without teams: {}", pending.size(), pending);
        }
    }

    /**
     * Centralized state transition with structured logging, durations included for terminal states.
     */
    private void transitionTo(CrawlState newState, Run run, Throwable error) {
        CrawlState old = this.state;
        this.state = newState;
        if (newState == CrawlState.RUNNING) {
            run.startedAt = clock.instant();
            log.info("Crawl state {} -> RUNNING (checkpoint={})", old, run.files.checkpointPath());
            return;
        }
        run.finishedAt = clock.instant();
        long dur = Duration.between(run.startedAt, run.finishedAt).toMillis();
        switch (newState) {
            case COMPLETED -> log.info("Crawl state {} -> COMPLETED after {} ms (fetched={}, cached={})",
                    old, dur, run.leaguesFetched, run.leaguesCached);
            case INTERRUPTED -> log.warn("Crawl state {} -> INTERRUPTED after {} ms; resume from {}",
                    old, dur, run.files.checkpointPath());
            case ABORTED -> log.error("Crawl state {} -> ABORTED after {} ms (fetched={}, error={})",
                    old, dur, run.leaguesFetched, error != null ? error.getMessage() : null, error);
            default -> log.info("Crawl state {} -> {}", old, newState);
        }
    }

    // Per-run counters; the snapshot itself is the only durable state.
    private static final class Run {
        final CheckpointFiles files;
        Instant startedAt;
        Instant finishedAt;
        int countries;
        int countriesWithoutLeagues;
        int leaguesFetched;
        int leaguesCached;

        Run(CheckpointFiles files) {
            this.files = files;
        }
    }
}
