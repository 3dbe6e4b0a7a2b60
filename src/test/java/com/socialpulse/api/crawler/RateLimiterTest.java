package com.socialpulse.api.crawler;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    private static final Duration DELAY = Duration.ofMillis(500);

    @Test
    void secondAcquireWaitsAtLeastDelay() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(DELAY);

        long t0 = System.nanoTime();
        limiter.acquire();
        limiter.acquire();
        long elapsed = System.nanoTime() - t0;

        assertThat(elapsed).isGreaterThanOrEqualTo(DELAY.toNanos());
    }

    @Test
    void freshInstanceDoesNotWait() throws InterruptedException {
        RateLimiter first = new RateLimiter(DELAY);
        first.acquire();

        RateLimiter second = new RateLimiter(DELAY);
        long t0 = System.nanoTime();
        second.acquire();
        long elapsed = System.nanoTime() - t0;

        assertThat(elapsed).isLessThan(DELAY.toNanos() / 2);
    }

    @Test
    void concurrentCallersAreSpacedOut() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(200));
        long[] releases = new long[2];

        Thread a = new Thread(() -> releases[0] = acquireAt(limiter));
        Thread b = new Thread(() -> releases[1] = acquireAt(limiter));
        a.start();
        b.start();
        a.join();
        b.join();

        // 기록 시점은 release 직후라 약간의 오차 허용
        assertThat(Math.abs(releases[0] - releases[1])).isGreaterThanOrEqualTo(Duration.ofMillis(150).toNanos());
    }

    @Test
    void negativeDelayIsTreatedAsZero() {
        assertThat(new RateLimiter(Duration.ofSeconds(-1)).delay()).isEqualTo(Duration.ZERO);
        assertThat(new RateLimiter(null).delay()).isEqualTo(Duration.ZERO);
    }

    private static long acquireAt(RateLimiter limiter) {
        try {
            limiter.acquire();
            return System.nanoTime();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -1;
        }
    }
}
