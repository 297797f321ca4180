package org.smileyface.leaguecrawler.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Sleeps for a fixed delay. Not adaptive: the delay does not grow when the site starts failing.
 */
public class FixedDelayRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(FixedDelayRateLimiter.class);

    private final Duration delay;

    public FixedDelayRateLimiter(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        this.delay = delay;
    }

    public Duration getDelay() {
        return delay;
    }

    // TODO: back off when several leagues in a row come back empty, which is how throttling shows up
    @Override
    public void pause() {
        if (delay.isZero()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Rate limiter pause interrupted");
        }
    }
}
