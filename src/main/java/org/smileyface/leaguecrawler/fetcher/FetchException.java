package org.smileyface.leaguecrawler.fetcher;

/**
 * Raised when a page cannot be rendered or its readiness selector does not appear in time.
 */
public class FetchException extends Exception {

    private final String url;

    public FetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
