package com.rolesync.verifier.reconcile.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Blocking request limiter holding {@code capacity} tokens. A spent token returns to the bucket
 * exactly one window after it was taken, so no rolling window of that length ever sees more than
 * {@code capacity} requests. Callers with no token available sleep until the oldest one returns.
 */
public class TokenBucketRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final String name;
    private final int capacity;
    private final long windowMs;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Long> spentAt = new ArrayDeque<>();
    private long pausedUntilMs;

    public TokenBucketRateLimiter(String name, int capacity, Duration window, Clock clock, Sleeper sleeper) {
        this.name = name;
        this.capacity = Math.max(1, capacity);
        this.windowMs = Math.max(1, window.toMillis());
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public void acquire() throws InterruptedException {
        while (true) {
            long waitMs;
            synchronized (this) {
                long now = clock.millis();
                if (pausedUntilMs > now) {
                    waitMs = pausedUntilMs - now;
                } else {
                    expire(now);
                    if (spentAt.size() < capacity) {
                        spentAt.addLast(now);
                        return;
                    }
                    waitMs = spentAt.peekFirst() + windowMs - now;
                    log.debug("{} limiter spent {} tokens in {}ms, waiting {}ms", name, capacity, windowMs, waitMs);
                }
            }
            sleeper.sleep(Duration.ofMillis(Math.max(1, waitMs)));
        }
    }

    /**
     * Holds every caller until {@code duration} has passed, used when the remote side reports
     * a limit shared by all requests.
     */
    public synchronized void pauseFor(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return;
        }
        long candidate = clock.millis() + duration.toMillis();
        if (candidate > pausedUntilMs) {
            pausedUntilMs = candidate;
        }
    }

    public synchronized int availableTokens() {
        long now = clock.millis();
        if (pausedUntilMs > now) {
            return 0;
        }
        expire(now);
        return capacity - spentAt.size();
    }

    private void expire(long now) {
        long windowStart = now - windowMs;
        while (!spentAt.isEmpty() && spentAt.peekFirst() <= windowStart) {
            spentAt.pollFirst();
        }
    }
}
