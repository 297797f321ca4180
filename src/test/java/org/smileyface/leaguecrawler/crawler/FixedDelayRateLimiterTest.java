package org.smileyface.leaguecrawler.crawler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixedDelayRateLimiterTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void pause_waitsAtLeastTheDelay() {
        FixedDelayRateLimiter limiter = new FixedDelayRateLimiter(Duration.ofMillis(50));

        long start = System.nanoTime();
        limiter.pause();
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(elapsedMs).isGreaterThanOrEqualTo(45);
    }

    @Test
    void pause_zeroDelayReturnsImmediately() {
        FixedDelayRateLimiter limiter = new FixedDelayRateLimiter(Duration.ZERO);

        long start = System.nanoTime();
        limiter.pause();

        assertThat(Duration.ofNanos(System.nanoTime() - start).toMillis()).isLessThan(50);
    }

    @Test
    void pause_interruptedKeepsInterruptFlag() {
        FixedDelayRateLimiter limiter = new FixedDelayRateLimiter(Duration.ofSeconds(10));
        Thread.currentThread().interrupt();

        long start = System.nanoTime();
        limiter.pause();

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - start).toMillis()).isLessThan(5000);
    }

    @Test
    void constructor_rejectsNegativeDelay() {
        assertThatThrownBy(() -> new FixedDelayRateLimiter(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultDelayMatchesConfiguredPause() {
        assertThat(new CrawlerProperties().getRateLimit().getDelay()).isEqualTo(Duration.ofMillis(1500));
    }
}
