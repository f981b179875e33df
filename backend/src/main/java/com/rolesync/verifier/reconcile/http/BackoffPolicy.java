package com.rolesync.verifier.reconcile.http;

import com.rolesync.verifier.config.VerifierProperties;

import java.time.Duration;

/**
 * Exponential backoff shared by the verification and Discord clients. Attempts are 1-based:
 * after attempt {@code n} fails the caller waits {@code baseDelay * multiplier^(n-1)}, capped at
 * {@code maxDelay}, and gives up once {@code maxAttempts} attempts have been made.
 */
public record BackoffPolicy(
    Duration baseDelay,
    double multiplier,
    Duration maxDelay,
    int maxAttempts
) {
    public BackoffPolicy {
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
        multiplier = Math.max(1.0, multiplier);
        maxAttempts = Math.max(1, maxAttempts);
    }

    public static BackoffPolicy from(VerifierProperties.Retry retry) {
        return new BackoffPolicy(
            Duration.ofMillis(retry.getBaseDelayMs()),
            retry.getMultiplier(),
            Duration.ofMillis(retry.getMaxDelayMs()),
            retry.getMaxAttempts()
        );
    }

    public boolean canRetryAfter(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    public Duration delayAfter(int failedAttempt) {
        long base = baseDelay.toMillis();
        if (base <= 0) {
            return Duration.ZERO;
        }
        double delay = base * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        long capMs = maxDelay.toMillis();
        if (capMs > 0 && delay > capMs) {
            delay = capMs;
        }
        return Duration.ofMillis((long) delay);
    }
}
