package org.smileyface.leaguecrawler.fetcher;

/**
 * HTML of a page after rendering, together with the URL the browser finally landed on
 * (redirects included). Extractors resolve relative links against {@code url}.
 */
public record RenderedPage(String url, String html) {
}
