package org.smileyface.leaguecrawler.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.leaguecrawler.extractor.EntityExtractor;
import org.smileyface.leaguecrawler.extractor.TeamExtractor;
import org.smileyface.leaguecrawler.fetcher.FetchException;
import org.smileyface.leaguecrawler.fetcher.FetchRequest;
import org.smileyface.leaguecrawler.fetcher.PageFetcher;
import org.smileyface.leaguecrawler.fetcher.RenderedPage;
import org.smileyface.leaguecrawler.model.League;
import org.smileyface.leaguecrawler.model.Team;
import org.smileyface.leaguecrawler.util.CrawlerUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * Fetches the teams of one league with a bounded number of attempts. Every attempt renders the
 * standings page again and extracts into a fresh map; nothing carries over between attempts.
 *
 * <p>{@link #fetchTeams(League)} never throws for fetch or extraction failures: they end the
 * attempt, and an exhausted league yields an empty list, or the cup sentinel for a cup
 * classified league.</p>
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final PageFetcher fetcher;
    private final EntityExtractor<Team> extractor;
    private final int maxAttempts;
    private final ToIntFunction<League> timeoutSelector;
    private final String readySelector;
    private final int navigationTimeoutMs;

    public RetryPolicy(PageFetcher fetcher,
                       EntityExtractor<Team> extractor,
                       int maxAttempts,
                       ToIntFunction<League> timeoutSelector,
                       String readySelector,
                       int navigationTimeoutMs) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.timeoutSelector = Objects.requireNonNull(timeoutSelector, "timeoutSelector");
        this.readySelector = Objects.requireNonNull(readySelector, "readySelector");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.navigationTimeoutMs = navigationTimeoutMs;
    }

    public static RetryPolicy fromProperties(PageFetcher fetcher, CrawlerProperties properties) {
        CrawlerProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(
                fetcher,
                new TeamExtractor(properties.getSelectors()),
                retry.getMaxAttempts(),
                cupAwareTimeouts(retry.getDefaultTimeoutMs(), retry.getCupTimeoutMs()),
                properties.getSelectors().getTeamLinks(),
                properties.getNavigationTimeoutMs());
    }

    /**
     * Cup/knockout pages usually render a bracket without standings, so waiting the full time for
     * team links there only burns crawl time.
     */
    public static ToIntFunction<League> cupAwareTimeouts(int defaultTimeoutMs, int cupTimeoutMs) {
        return league -> isCupClassified(league) ? cupTimeoutMs : defaultTimeoutMs;
    }

    public static boolean isCupClassified(League league) {
        return league.cup() || CrawlerUtils.isCup(league.url());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public List<Team> fetchTeams(League league) {
        String standingsUrl = CrawlerUtils.standingsUrl(league.url());
        int timeoutMs = timeoutSelector.applyAsInt(league);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Map<String, Team> teams = attempt(standingsUrl, timeoutMs, attempt);
            if (!teams.isEmpty()) {
                log.debug("Found {} teams for {} (attempt {})", teams.size(), league.name(), attempt);
                return new ArrayList<>(teams.values());
            }
            if (attempt < maxAttempts) {
                log.debug("Retry league {} #{}", league.name(), attempt);
            }
        }

        if (isCupClassified(league)) {
            log.info("No standings for cup competition {} after {} attempts; storing cup marker",
                    league.name(), maxAttempts);
            return List.of(Team.cupSentinel());
        }
        log.warn("No teams for {} after {} attempts ({})", league.name(), maxAttempts, standingsUrl);
        return List.of();
    }

    private Map<String, Team> attempt(String standingsUrl, int timeoutMs, int attempt) {
        try {
            RenderedPage page = fetcher.fetch(FetchRequest.waitFor(standingsUrl, readySelector, timeoutMs, navigationTimeoutMs));
            return extractor.extract(page);
        } catch (FetchException e) {
            log.debug("Attempt {} for {} failed: {}", attempt, standingsUrl, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Attempt {} for {} failed unexpectedly", attempt, standingsUrl, e);
        }
        return Map.of();
    }
}
