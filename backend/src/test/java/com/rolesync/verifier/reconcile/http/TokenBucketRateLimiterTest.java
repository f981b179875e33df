package com.rolesync.verifier.reconcile.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenBucketRateLimiterTest {
    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void neverIssuesMoreThanQuotaWithinAnyRollingWindow() throws Exception {
        SimulatedTime time = new SimulatedTime(START);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("test", 5, Duration.ofSeconds(1), time.clock(), time.sleeper());

        List<Long> issuedAt = new ArrayList<>();
        for (int i = 0; i < 23; i++) {
            limiter.acquire();
            issuedAt.add(time.millis());
            time.advance(Duration.ofMillis(37));
        }

        for (int i = 0; i + 5 < issuedAt.size(); i++) {
            assertThat(issuedAt.get(i + 5) - issuedAt.get(i))
                .as("requests %d and %d", i, i + 5)
                .isGreaterThanOrEqualTo(1000);
        }
    }

    @Test
    void burstUpToCapacityIsImmediateThenCallerWaitsForOldestToken() throws Exception {
        SimulatedTime time = new SimulatedTime(START);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("test", 3, Duration.ofMillis(500), time.clock(), time.sleeper());

        limiter.acquire();
        limiter.acquire();
        limiter.acquire();
        assertThat(time.sleeps()).isEmpty();
        assertThat(limiter.availableTokens()).isZero();

        limiter.acquire();

        assertThat(time.millis() - START.toEpochMilli()).isEqualTo(500);
        assertThat(time.sleeps()).containsExactly(Duration.ofMillis(500));
    }

    @Test
    void pauseHoldsCallersEvenWithTokensLeft() throws Exception {
        SimulatedTime time = new SimulatedTime(START);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("test", 10, Duration.ofSeconds(1), time.clock(), time.sleeper());

        limiter.pauseFor(Duration.ofSeconds(3));
        assertThat(limiter.availableTokens()).isZero();

        limiter.acquire();

        assertThat(time.millis() - START.toEpochMilli()).isGreaterThanOrEqualTo(3000);
        assertThat(limiter.availableTokens()).isEqualTo(9);
    }
}
