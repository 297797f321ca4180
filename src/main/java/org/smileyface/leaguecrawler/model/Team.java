package org.smileyface.leaguecrawler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A team extracted from a league's standings page. The id is the site's own identifier
 * (last path segment of the team link).
 */
@JsonPropertyOrder({"id", "name", "url"})
public record Team(String id, String name, String url) {

    /** Id and name of the placeholder team stored for cup competitions without standings. */
    public static final String CUP_SENTINEL_ID = "isCup";

    public static Team cupSentinel() {
        return new Team(CUP_SENTINEL_ID, CUP_SENTINEL_ID, null);
    }

    @JsonIgnore
    public boolean isCupSentinel() {
        return CUP_SENTINEL_ID.equals(id) && url == null;
    }
}
