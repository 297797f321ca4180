package org.smileyface.leaguecrawler.fetcher;

import java.util.List;
import java.util.Objects;

/**
 * What to render and when the page counts as ready.
 *
 * @param url                 page to navigate to
 * @param clickSelectors      elements clicked in order after navigation (menu expansion), each
 *                            awaited with {@code readyTimeoutMs} first
 * @param readySelector       the page is ready once this selector matches
 * @param readyTimeoutMs      how long to wait for each click target and for the ready selector
 * @param navigationTimeoutMs navigation timeout
 */
public record FetchRequest(String url,
                           List<String> clickSelectors,
                           String readySelector,
                           int readyTimeoutMs,
                           int navigationTimeoutMs) {

    public FetchRequest {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(readySelector, "readySelector");
        clickSelectors = clickSelectors == null ? List.of() : List.copyOf(clickSelectors);
    }

    public static FetchRequest waitFor(String url, String readySelector, int readyTimeoutMs, int navigationTimeoutMs) {
        return new FetchRequest(url, List.of(), readySelector, readyTimeoutMs, navigationTimeoutMs);
    }
}
