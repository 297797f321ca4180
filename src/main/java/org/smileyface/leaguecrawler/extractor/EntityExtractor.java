package org.smileyface.leaguecrawler.extractor;

import org.smileyface.leaguecrawler.fetcher.RenderedPage;

import java.util.Map;

/**
 * Maps a rendered page to the records of one entity type (countries, leagues or teams).
 * Implementations are pure: the same HTML always gives the same result.
 *
 * @param <T> record type
 */
@FunctionalInterface
public interface EntityExtractor<T> {

    /**
     * Extracts records keyed by their site id, in document order. When two elements carry the
     * same id the first one wins.
     *
     * @param page rendered page (non-null)
     * @return insertion-ordered id → record map, possibly empty, never null
     */
    Map<String, T> extract(RenderedPage page);
}
