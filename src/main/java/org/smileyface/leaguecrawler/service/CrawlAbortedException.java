package org.smileyface.leaguecrawler.service;

import org.springframework.boot.ExitCodeGenerator;

/**
 * A failure that ends the whole run: the fetcher cannot be opened, countries cannot be
 * discovered, or the checkpoint/final file cannot be read or written.
 */
public class CrawlAbortedException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 2;

    public CrawlAbortedException(String message) {
        super(message);
    }

    public CrawlAbortedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
