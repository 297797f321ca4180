package org.smileyface.leaguecrawler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Crawl outcome recorded on every league entry of the progress snapshot.
 */
public enum LeagueStatus {
    /** No team has been extracted yet; the league is re-attempted on the next run. */
    @JsonProperty("pending")
    PENDING,

    /** At least one real team was extracted from the standings page. */
    @JsonProperty("complete")
    COMPLETE,

    /** Cup/knockout competition without a standings table; holds only the sentinel team. */
    @JsonProperty("confirmed-empty")
    CONFIRMED_EMPTY
}
