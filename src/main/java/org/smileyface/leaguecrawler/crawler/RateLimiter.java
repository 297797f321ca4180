package org.smileyface.leaguecrawler.crawler;

/**
 * Bounds the request rate towards the target host.
 */
@FunctionalInterface
public interface RateLimiter {

    /**
     * Blocks until the next fetch may start. Called once after every league fetch, whatever its
     * outcome. An interrupt ends the wait early and leaves the thread's interrupt flag set.
     */
    void pause();
}
