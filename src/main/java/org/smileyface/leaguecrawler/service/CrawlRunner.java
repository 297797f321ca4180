package org.smileyface.leaguecrawler.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.leaguecrawler.crawler.CrawlerProperties;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts the crawl once the context is up. A first non-option argument overrides
 * {@code crawler.entry-url}. Disable with {@code crawler.run-on-startup=false}.
 *
 * <p>An interrupted run leaves no final file, so it reports {@link #INTERRUPTED_EXIT_CODE}
 * through {@code SpringApplication.exit}.</p>
 */
@Component
@ConditionalOnProperty(prefix = "crawler", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class CrawlRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int INTERRUPTED_EXIT_CODE = 3;

    private static final Logger log = LogManager.getLogger();

    private final CrawlOrchestrator orchestrator;
    private final CrawlerProperties properties;

    private volatile CrawlState finalState;

    public CrawlRunner(CrawlOrchestrator orchestrator, CrawlerProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        String entryUrl = args.getNonOptionArgs().stream()
                .filter(a -> !a.isBlank())
                .findFirst()
                .orElse(properties.getEntryUrl());
        log.info("Starting crawl from {}", entryUrl);
        CrawlResult result = orchestrator.run(entryUrl);
        finalState = result.summary().getState();
        log.info("Crawl finished in state {}", finalState);
    }

    @Override
    public int getExitCode() {
        return finalState == CrawlState.INTERRUPTED ? INTERRUPTED_EXIT_CODE : 0;
    }
}
