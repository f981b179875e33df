package com.rolesync.verifier.reconcile.http;

import com.rolesync.verifier.config.VerifierProperties;
import com.rolesync.verifier.reconcile.model.HttpCallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ExecutorService;

/**
 * Authenticated GET access to the verification service. Every attempt waits for a token from the
 * verification limiter; timeouts, connection errors and 5xx are retried under the shared
 * {@link BackoffPolicy}. Every 4xx is returned as is.
 */
@Component
public class VerificationApiTransport {
    private static final Logger log = LoggerFactory.getLogger(VerificationApiTransport.class);

    private final VerifierProperties.Verification properties;
    private final HttpCallExecutor http;
    private final TokenBucketRateLimiter rateLimiter;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;

    public VerificationApiTransport(
        VerifierProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        @Qualifier("verificationRateLimiter") TokenBucketRateLimiter rateLimiter,
        BackoffPolicy backoffPolicy,
        Sleeper sleeper
    ) {
        this.properties = properties.getVerification();
        this.http = new HttpCallExecutor(httpExecutor, this.properties.getRequestTimeoutSeconds());
        this.rateLimiter = rateLimiter;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
    }

    public HttpCallResult get(String path, Map<String, String> queryParams) {
        String url = properties.getBaseUrl() + path + queryString(queryParams);
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("Authorization", properties.getApiKey())
                .header("Accept", "application/json")
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            return HttpCallExecutor.invalidUrl("GET", url, e.getMessage());
        }

        HttpCallResult result = null;
        for (int attempt = 1; attempt <= backoffPolicy.maxAttempts(); attempt++) {
            try {
                rateLimiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return HttpCallExecutor.interrupted("GET", url);
            }
            result = http.execute(request);
            if (!HttpCallExecutor.isNetworkOrServerFailure(result) || !backoffPolicy.canRetryAfter(attempt)) {
                return result;
            }
            Duration delay = backoffPolicy.delayAfter(attempt);
            log.debug("Verification API {} attempt {} failed ({}), retrying in {}ms", path, attempt, result.describe(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return result;
            }
        }
        return result;
    }

    private String queryString(Map<String, String> queryParams) {
        if (queryParams == null || queryParams.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        for (Map.Entry<String, String> entry : queryParams.entrySet()) {
            joiner.add(
                URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(entry.getValue() == null ? "" : entry.getValue(), StandardCharsets.UTF_8)
            );
        }
        return joiner.toString();
    }
}
