package org.smileyface.leaguecrawler.checkpoint;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Checkpointed state of one country: its leagues keyed by display name.
 */
@JsonPropertyOrder({"slug", "url", "urlUSA", "leagues"})
public class CountryProgress {

    private String slug;
    private String url;
    private String urlUSA;
    private Map<String, LeagueProgress> leagues = new LinkedHashMap<>();

    public CountryProgress() {
        // for JSON mapping
    }

    public CountryProgress(String slug, String url, String urlUSA) {
        this.slug = slug;
        this.url = url;
        this.urlUSA = urlUSA;
    }

    public String getSlug() { return slug; }
    public void setSlug(String slug) { this.slug = slug; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    @JsonProperty("urlUSA")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getUrlUSA() { return urlUSA; }

    @JsonProperty("urlUSA")
    public void setUrlUSA(String urlUSA) { this.urlUSA = urlUSA; }

    public Map<String, LeagueProgress> getLeagues() { return leagues; }
    public void setLeagues(Map<String, LeagueProgress> leagues) {
        this.leagues = new LinkedHashMap<>();
        if (leagues != null) {
            leagues.forEach((name, league) -> {
                if (league != null) this.leagues.put(name, league);
            });
        }
    }

    public int teamCount() {
        int total = 0;
        for (LeagueProgress league : leagues.values()) {
            total += league.getTeams().size();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CountryProgress that = (CountryProgress) o;
        return Objects.equals(slug, that.slug)
                && Objects.equals(url, that.url)
                && Objects.equals(urlUSA, that.urlUSA)
                && Objects.equals(leagues, that.leagues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slug, url, urlUSA, leagues);
    }

    @Override
    public String toString() {
        return "CountryProgress{slug='" + slug + "', url='" + url + "', leagues=" + leagues.size() + '}';
    }
}
