package com.rolesync.verifier.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class VerifierPropertiesGuardrailTest {

    @Test
    void batchConcurrencyStaysBelowSmallestQuota() {
        VerifierProperties properties = new VerifierProperties();
        properties.getVerification().setRequestsPerWindow(5);
        properties.getDiscord().setRequestsPerWindow(50);
        properties.getReconcile().setBatchConcurrency(32);

        assertEquals(4, properties.effectiveBatchConcurrency());
    }

    @Test
    void batchConcurrencyIsAtLeastOne() {
        VerifierProperties properties = new VerifierProperties();
        properties.getVerification().setRequestsPerWindow(1);
        properties.getReconcile().setBatchConcurrency(0);

        assertEquals(1, properties.effectiveBatchConcurrency());
    }

    @Test
    void invalidValuesAreClamped() {
        VerifierProperties properties = new VerifierProperties();
        properties.getDiscord().setMemberPageSize(5000);
        properties.getDiscord().setMaxRateLimitRetries(-2);
        properties.getRetry().setMaxAttempts(0);
        properties.getRetry().setMultiplier(0.5);

        assertEquals(1000, properties.getDiscord().getMemberPageSize());
        assertEquals(0, properties.getDiscord().getMaxRateLimitRetries());
        assertEquals(1, properties.getRetry().getMaxAttempts());
        assertEquals(1.0, properties.getRetry().getMultiplier());
    }

    @Test
    void baseUrlsLoseTrailingSlashes() {
        assertEquals("https://verify.example.org", VerifierProperties.normalizeBaseUrl(" https://verify.example.org// "));
        assertEquals("", VerifierProperties.normalizeBaseUrl(null));
    }
}
