package org.smileyface.leaguecrawler.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.smileyface.leaguecrawler.model.LeagueStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The crawl's single source of truth: country name → league name → teams. Serialised as a
 * plain JSON object keyed by country name.
 *
 * <p>Not thread-safe. The crawl has exactly one writer, the orchestrator's control flow.</p>
 */
public class ProgressSnapshot {

    private final Map<String, CountryProgress> countries;

    public ProgressSnapshot() {
        this.countries = new LinkedHashMap<>();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ProgressSnapshot(Map<String, CountryProgress> countries) {
        this.countries = new LinkedHashMap<>();
        if (countries != null) {
            countries.forEach((name, country) -> {
                if (country != null) this.countries.put(name, country);
            });
        }
    }

    @JsonValue
    public Map<String, CountryProgress> getCountries() {
        return Collections.unmodifiableMap(countries);
    }

    public boolean isEmpty() {
        return countries.isEmpty();
    }

    public Optional<CountryProgress> country(String countryName) {
        return Optional.ofNullable(countries.get(countryName));
    }

    /**
     * Returns the entry for the country, creating it when absent. An existing entry is returned
     * untouched so that previously crawled leagues survive a restart.
     */
    public CountryProgress ensureCountry(String countryName, String slug, String url, String urlUSA) {
        return countries.computeIfAbsent(countryName, n -> new CountryProgress(slug, url, urlUSA));
    }

    public Optional<LeagueProgress> league(String countryName, String leagueName) {
        CountryProgress country = countries.get(countryName);
        if (country == null) return Optional.empty();
        return Optional.ofNullable(country.getLeagues().get(leagueName));
    }

    public boolean isLeagueComplete(String countryName, String leagueName) {
        return league(countryName, leagueName).map(LeagueProgress::isComplete).orElse(false);
    }

    /**
     * Stores the league under its display name, replacing any previous entry.
     *
     * @return the replaced entry, if any
     * @throws IllegalStateException when the country has no entry yet
     */
    public Optional<LeagueProgress> putLeague(String countryName, String leagueName, LeagueProgress league) {
        CountryProgress country = countries.get(countryName);
        if (country == null) {
            throw new IllegalStateException("No snapshot entry for country " + countryName);
        }
        return Optional.ofNullable(country.getLeagues().put(leagueName, Objects.requireNonNull(league, "league")));
    }

    public int leagueCount() {
        int total = 0;
        for (CountryProgress c : countries.values()) {
            total += c.getLeagues().size();
        }
        return total;
    }

    public int teamCount() {
        int total = 0;
        for (CountryProgress c : countries.values()) {
            total += c.teamCount();
        }
        return total;
    }

    /**
     * @return "Country / League" labels of every league still {@link LeagueStatus#PENDING}, in
     * snapshot order
     */
    public List<String> pendingLeagues() {
        List<String> out = new ArrayList<>();
        countries.forEach((countryName, country) ->
                country.getLeagues().forEach((leagueName, league) -> {
                    if (league.getStatus() == LeagueStatus.PENDING) {
                        out.add(countryName + " / " + leagueName);
                    }
                }));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return countries.equals(((ProgressSnapshot) o).countries);
    }

    @Override
    public int hashCode() {
        return countries.hashCode();
    }

    @Override
    public String toString() {
        return "ProgressSnapshot{countries=" + countries.size() + ", leagues=" + leagueCount()
                + ", teams=" + teamCount() + '}';
    }
}
