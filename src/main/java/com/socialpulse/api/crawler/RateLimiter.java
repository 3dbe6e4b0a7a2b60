package com.socialpulse.api.crawler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Minimum-interval gate between outbound requests of one source.
 * Sources never share an instance.
 */
public class RateLimiter {

    private final long delayNanos;
    private final ReentrantLock lock = new ReentrantLock();

    private boolean released;
    private long lastReleaseNanos;

    public RateLimiter(Duration delay) {
        this.delayNanos = (delay == null || delay.isNegative()) ? 0L : delay.toNanos();
    }

    /**
     * Blocks until at least {@code delay} has passed since the previous release of this
     * limiter, then records a new release. The lock is held while sleeping so callers
     * are released one at a time.
     */
    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (released) {
                long remaining;
                while ((remaining = delayNanos - (System.nanoTime() - lastReleaseNanos)) > 0) {
                    TimeUnit.NANOSECONDS.sleep(remaining);
                }
            }
            lastReleaseNanos = System.nanoTime();
            released = true;
        } finally {
            lock.unlock();
        }
    }

    public Duration delay() {
        return Duration.ofNanos(delayNanos);
    }
}
