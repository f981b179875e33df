package com.rolesync.verifier.reconcile.http;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock and sleeper pair where sleeping advances the clock instead of blocking.
 */
class SimulatedTime {
    private final AtomicLong millis;
    private final List<Duration> sleeps = new ArrayList<>();

    SimulatedTime(Instant start) {
        this.millis = new AtomicLong(start.toEpochMilli());
    }

    long millis() {
        return millis.get();
    }

    void advance(Duration duration) {
        millis.addAndGet(duration.toMillis());
    }

    synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    Sleeper sleeper() {
        return duration -> {
            synchronized (this) {
                sleeps.add(duration);
            }
            advance(duration);
        };
    }

    Clock clock() {
        return new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return Instant.ofEpochMilli(millis.get());
            }
        };
    }
}
