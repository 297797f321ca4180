package org.smileyface.leaguecrawler.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.smileyface.leaguecrawler.model.LeagueStatus;
import org.smileyface.leaguecrawler.model.Team;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checkpointed state of one league: where it lives and the teams extracted so far.
 */
@JsonPropertyOrder({"slug", "url", "urlUSA", "isCup", "status", "teams"})
public class LeagueProgress {

    private String slug;
    private String url;
    private String urlUSA;
    private boolean cup;
    private LeagueStatus status;   // null in checkpoints written before the field existed
    private List<Team> teams = new ArrayList<>();

    public LeagueProgress() {
        // for JSON mapping
    }

    public LeagueProgress(String slug, String url, String urlUSA, boolean cup, List<Team> teams) {
        this.slug = slug;
        this.url = url;
        this.urlUSA = urlUSA;
        this.cup = cup;
        this.teams = withoutNulls(teams);
        this.status = deriveStatus(this.teams);
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

    @JsonProperty("isCup")
    public boolean isCup() { return cup; }

    @JsonProperty("isCup")
    public void setCup(boolean cup) { this.cup = cup; }

    /**
     * Stored status, or the status implied by {@link #getTeams()} when none was stored. A league
     * without teams is pending whatever status was stored.
     */
    public LeagueStatus getStatus() {
        if (status == null || !isComplete()) return deriveStatus(teams);
        return status;
    }

    public void setStatus(LeagueStatus status) { this.status = status; }

    public List<Team> getTeams() { return teams; }
    public void setTeams(List<Team> teams) {
        this.teams = withoutNulls(teams);
    }

    /**
     * A league is complete once it holds at least one team record, the cup sentinel included.
     * Empty leagues are fetched again on the next run.
     */
    @JsonIgnore
    public boolean isComplete() {
        return teams != null && !teams.isEmpty();
    }

    static LeagueStatus deriveStatus(List<Team> teams) {
        if (teams == null || teams.isEmpty()) return LeagueStatus.PENDING;
        if (teams.size() == 1 && teams.get(0) != null && teams.get(0).isCupSentinel()) {
            return LeagueStatus.CONFIRMED_EMPTY;
        }
        return LeagueStatus.COMPLETE;
    }

    // null entries in a hand-edited or truncated file would otherwise count as teams
    private static List<Team> withoutNulls(List<Team> teams) {
        List<Team> out = new ArrayList<>();
        if (teams != null) {
            for (Team team : teams) {
                if (team != null) out.add(team);
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LeagueProgress that = (LeagueProgress) o;
        return cup == that.cup
                && Objects.equals(slug, that.slug)
                && Objects.equals(url, that.url)
                && Objects.equals(urlUSA, that.urlUSA)
                && getStatus() == that.getStatus()
                && Objects.equals(teams, that.teams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slug, url, urlUSA, cup, getStatus(), teams);
    }

    @Override
    public String toString() {
        return "LeagueProgress{" +
                "slug='" + slug + '\'' +
                ", url='" + url + '\'' +
                ", isCup=" + cup +
                ", status=" + getStatus() +
                ", teams=" + (teams != null ? teams.size() : 0) +
                '}';
    }
}
