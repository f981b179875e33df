package com.rolesync.verifier.reconcile.http;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            long millis = duration == null ? 0 : duration.toMillis();
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
