package org.smileyface.leaguecrawler.fetcher;

/**
 * Renders pages for the crawl. One instance serves a whole run: it is opened once before
 * the first fetch and closed after the traversal.
 */
public interface PageFetcher extends AutoCloseable {

    /**
     * Acquire the rendering capability (e.g. launch the browser). Calling it twice is a no-op.
     *
     * @throws FetchException when the capability cannot be acquired; the crawl cannot proceed
     */
    void open() throws FetchException;

    /**
     * Navigate to the request URL, perform its clicks and wait for its readiness selector.
     *
     * @return the rendered page, never null
     * @throws FetchException on navigation failure or when the page is not ready in time
     */
    RenderedPage fetch(FetchRequest request) throws FetchException;

    /**
     * Release browser resources. Safe to call more than once.
     */
    @Override
    void close();
}
