package org.smileyface.leaguecrawler.service;

import org.smileyface.leaguecrawler.checkpoint.ProgressSnapshot;

/**
 * Snapshot as it stood at the end of a run, plus what the run did.
 */
public record CrawlResult(ProgressSnapshot snapshot, CrawlSummary summary) {
}
