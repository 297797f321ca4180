package org.smileyface.leaguecrawler.service;

/**
 * Lifecycle state of a crawl run.
 */
public enum CrawlState {
    NEW,
    RUNNING,
    COMPLETED,
    INTERRUPTED,
    ABORTED
}
