package org.smileyface.leaguecrawler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.smileyface.leaguecrawler.checkpoint.CheckpointStore;
import org.smileyface.leaguecrawler.crawler.CrawlerProperties;
import org.smileyface.leaguecrawler.crawler.FixedDelayRateLimiter;
import org.smileyface.leaguecrawler.crawler.RateLimiter;
import org.smileyface.leaguecrawler.crawler.RetryPolicy;
import org.smileyface.leaguecrawler.fetcher.JsoupPageFetcher;
import org.smileyface.leaguecrawler.fetcher.PageFetcher;
import org.smileyface.leaguecrawler.fetcher.PlaywrightPageFetcher;
import org.smileyface.leaguecrawler.service.CrawlOrchestrator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the crawl pipeline. The page fetcher is chosen by {@code crawler.fetcher.type}:
 * - "playwright" (default): headless Chromium, needed for the JavaScript rendered menus
 * - "jsoup": plain HTTP, for server rendered pages and tests
 */
@Configuration
public class BeanConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PageFetcher pageFetcher(CrawlerProperties properties) {
        String kind = properties.getFetcher().getType();
        kind = kind == null ? "playwright" : kind.trim().toLowerCase();
        if ("jsoup".equals(kind)) {
            return new JsoupPageFetcher(properties);
        }
        return new PlaywrightPageFetcher(properties);
    }

    @Bean
    public CheckpointStore checkpointStore(ObjectProvider<ObjectMapper> mapperProvider) {
        ObjectMapper mapper = mapperProvider.getIfAvailable();
        return mapper != null ? new CheckpointStore(mapper) : new CheckpointStore();
    }

    @Bean
    public RateLimiter rateLimiter(CrawlerProperties properties) {
        return new FixedDelayRateLimiter(properties.getRateLimit().getDelay());
    }

    @Bean
    public RetryPolicy retryPolicy(PageFetcher pageFetcher, CrawlerProperties properties) {
        return RetryPolicy.fromProperties(pageFetcher, properties);
    }

    @Bean
    public CrawlOrchestrator crawlOrchestrator(CrawlerProperties properties,
                                               PageFetcher pageFetcher,
                                               CheckpointStore checkpointStore,
                                               RetryPolicy retryPolicy,
                                               RateLimiter rateLimiter,
                                               Clock clock) {
        return new CrawlOrchestrator(properties, pageFetcher, checkpointStore, retryPolicy, rateLimiter, clock);
    }
}
