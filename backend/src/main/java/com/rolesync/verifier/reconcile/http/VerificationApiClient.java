package com.rolesync.verifier.reconcile.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolesync.verifier.config.VerifierProperties;
import com.rolesync.verifier.reconcile.model.HttpCallResult;
import com.rolesync.verifier.reconcile.model.LookupFailureReason;
import com.rolesync.verifier.reconcile.model.Member;
import com.rolesync.verifier.reconcile.model.VerificationStatus;
import com.rolesync.verifier.reconcile.service.VerificationLookupClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class VerificationApiClient implements VerificationLookupClient {
    private static final Logger log = LoggerFactory.getLogger(VerificationApiClient.class);
    static final String VERIFIED_PATH = "/api/v1/verified";

    private final VerificationApiTransport transport;
    private final ObjectMapper objectMapper;
    private final int slowLookupWarnMs;

    public VerificationApiClient(VerificationApiTransport transport, ObjectMapper objectMapper, VerifierProperties properties) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.slowLookupWarnMs = properties.getVerification().getSlowLookupWarnMs();
    }

    @Override
    public VerificationStatus lookup(Member member) {
        long startedAt = System.nanoTime();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("userId", member.userId());
        params.put("guildId", member.guildId());
        HttpCallResult result = transport.get(VERIFIED_PATH, params);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        if (slowLookupWarnMs > 0 && elapsed.toMillis() > slowLookupWarnMs) {
            log.warn("Took {}ms to check if user {} in guild {} is verified", elapsed.toMillis(), member.userId(), member.guildId());
        }
        return toStatus(member, result);
    }

    private VerificationStatus toStatus(Member member, HttpCallResult result) {
        if (result.isTransportError()) {
            if ("invalid_url".equals(result.errorCode())) {
                return VerificationStatus.lookupFailed(LookupFailureReason.BAD_REQUEST, result.describe());
            }
            log.warn("Verification lookup for user {} in guild {} gave up: {}", member.userId(), member.guildId(), result.describe());
            return VerificationStatus.lookupFailed(LookupFailureReason.TIMEOUT, result.describe());
        }
        int status = result.statusCode();
        if (status >= 200 && status < 300) {
            return parseVerified(member, result.body());
        }
        if (status == 404) {
            return VerificationStatus.NOT_VERIFIED;
        }
        if (HttpCallExecutor.isNetworkOrServerFailure(result)) {
            log.warn("Verification lookup for user {} in guild {} gave up: {}", member.userId(), member.guildId(), result.describe());
            return VerificationStatus.lookupFailed(LookupFailureReason.TIMEOUT, result.describe());
        }
        if (status == 401) {
            log.warn("Verification service rejected the API key (401)");
        }
        return VerificationStatus.lookupFailed(LookupFailureReason.BAD_REQUEST, result.describe());
    }

    private VerificationStatus parseVerified(Member member, String body) {
        try {
            JsonNode root = objectMapper.readTree(body == null ? "" : body);
            JsonNode verified = root == null ? null : root.get("verified");
            if (verified == null || !verified.isBoolean()) {
                return VerificationStatus.lookupFailed(LookupFailureReason.BAD_REQUEST, "missing_verified_field");
            }
            return verified.booleanValue() ? VerificationStatus.VERIFIED : VerificationStatus.NOT_VERIFIED;
        } catch (Exception e) {
            log.warn("Unparseable verification response for user {}: {}", member.userId(), e.getMessage());
            return VerificationStatus.lookupFailed(LookupFailureReason.BAD_REQUEST, "invalid_json");
        }
    }
}
