package com.rolesync.verifier.reconcile.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolesync.verifier.config.VerifierProperties;
import com.rolesync.verifier.reconcile.model.HttpCallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Bot-authenticated access to the Discord REST API. A 429 is waited out for the duration Discord
 * asks for, at most {@code maxRateLimitRetries} times; network errors and 5xx follow the shared
 * {@link BackoffPolicy}. The last response is returned when either budget runs out.
 */
@Component
public class DiscordRestTransport {
    private static final Logger log = LoggerFactory.getLogger(DiscordRestTransport.class);
    private static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(1);
    static final int UNKNOWN_MEMBER_CODE = 10007;
    static final int UNKNOWN_ROLE_CODE = 10011;

    private final VerifierProperties.Discord properties;
    private final HttpCallExecutor http;
    private final TokenBucketRateLimiter rateLimiter;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;

    public DiscordRestTransport(
        VerifierProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        @Qualifier("discordRateLimiter") TokenBucketRateLimiter rateLimiter,
        BackoffPolicy backoffPolicy,
        Sleeper sleeper,
        ObjectMapper objectMapper
    ) {
        this.properties = properties.getDiscord();
        this.http = new HttpCallExecutor(httpExecutor, this.properties.getRequestTimeoutSeconds());
        this.rateLimiter = rateLimiter;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
        this.objectMapper = objectMapper;
    }

    public HttpCallResult get(String path) {
        return send("GET", path, null);
    }

    public HttpCallResult put(String path, String auditReason) {
        return send("PUT", path, auditReason);
    }

    public HttpCallResult delete(String path, String auditReason) {
        return send("DELETE", path, auditReason);
    }

    private HttpCallResult send(String method, String path, String auditReason) {
        String url = properties.getBaseUrl() + path;
        HttpRequest request;
        try {
            request = buildRequest(method, url, auditReason);
        } catch (IllegalArgumentException e) {
            return HttpCallExecutor.invalidUrl(method, url, e.getMessage());
        }

        int rateLimitRetries = 0;
        int failedAttempts = 0;
        while (true) {
            try {
                rateLimiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return HttpCallExecutor.interrupted(method, url);
            }
            HttpCallResult result = http.execute(request);
            Duration wait;
            if (result.statusCode() == 429) {
                if (rateLimitRetries >= properties.getMaxRateLimitRetries()) {
                    log.warn("Discord {} {} still rate limited after {} retries", method, path, rateLimitRetries);
                    return result;
                }
                rateLimitRetries++;
                wait = retryAfter(result);
                log.debug("Discord {} {} rate limited, waiting {}ms (retry {})", method, path, wait.toMillis(), rateLimitRetries);
            } else if (HttpCallExecutor.isTransient(result)) {
                failedAttempts++;
                if (!backoffPolicy.canRetryAfter(failedAttempts)) {
                    log.warn("Discord {} {} failed after {} attempts: {}", method, path, failedAttempts, result.describe());
                    return result;
                }
                wait = backoffPolicy.delayAfter(failedAttempts);
                log.debug("Discord {} {} attempt {} failed ({}), retrying in {}ms", method, path, failedAttempts, result.describe(), wait.toMillis());
            } else {
                return result;
            }
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return result;
            }
        }
    }

    private HttpRequest buildRequest(String method, String url, String auditReason) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("Authorization", "Bot " + properties.getBotToken())
            .header("Accept", "application/json");
        if (auditReason != null && !auditReason.isBlank()) {
            builder.header("X-Audit-Log-Reason", URLEncoder.encode(auditReason, StandardCharsets.UTF_8));
        }
        if ("PUT".equals(method)) {
            builder.PUT(HttpRequest.BodyPublishers.noBody());
        } else if ("DELETE".equals(method)) {
            builder.DELETE();
        } else {
            builder.GET();
        }
        return builder.build();
    }

    /**
     * Discord's JSON error code from a failed response, or 0 when the body carries none.
     */
    int errorCode(HttpCallResult result) {
        String body = result.body();
        if (body == null || body.isBlank()) {
            return 0;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            return root == null ? 0 : root.path("code").asInt(0);
        } catch (IOException e) {
            log.debug("Could not parse Discord error body: {}", e.getMessage());
            return 0;
        }
    }

    /**
     * Wait requested by a 429: {@code retry_after} in the JSON body (fractional seconds), else the
     * {@code Retry-After} header. A global limit also pauses every other caller of this limiter.
     */
    Duration retryAfter(HttpCallResult result) {
        Duration wait = null;
        boolean global = false;
        try {
            JsonNode root = result.body() == null ? null : objectMapper.readTree(result.body());
            if (root != null && root.hasNonNull("retry_after")) {
                wait = Duration.ofMillis(Math.round(root.get("retry_after").asDouble() * 1000));
                global = root.path("global").asBoolean(false);
            }
        } catch (Exception e) {
            log.debug("Could not parse Discord 429 body: {}", e.getMessage());
        }
        if (wait == null && result.retryAfterHeader() != null) {
            try {
                wait = Duration.ofMillis(Math.round(Double.parseDouble(result.retryAfterHeader().trim()) * 1000));
            } catch (NumberFormatException e) {
                log.debug("Could not parse Retry-After header '{}'", result.retryAfterHeader());
            }
        }
        if (wait == null || wait.isNegative()) {
            wait = DEFAULT_RETRY_AFTER;
        }
        if (global) {
            rateLimiter.pauseFor(wait);
        }
        return wait;
    }
}
