package com.rolesync.verifier.reconcile.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolesync.verifier.reconcile.model.GuildConfig;
import com.rolesync.verifier.reconcile.model.HttpCallResult;
import com.rolesync.verifier.reconcile.service.GuildConfigStore;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the verified role of a guild from the verification service. Not cached: a role changed
 * or removed there is picked up on the next call.
 */
@Service
public class VerificationApiGuildConfigStore implements GuildConfigStore {
    static final String GUILD_PATH = "/api/v1/guild";

    private final VerificationApiTransport transport;
    private final ObjectMapper objectMapper;

    public VerificationApiGuildConfigStore(VerificationApiTransport transport, ObjectMapper objectMapper) {
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<GuildConfig> find(String guildId) {
        HttpCallResult result = transport.get(GUILD_PATH, Map.of("guildId", guildId));
        if (result.statusCode() == 404) {
            return Optional.empty();
        }
        if (!result.isSuccessful()) {
            throw new VerificationApiException("Guild config lookup for " + guildId + " failed: " + result.describe());
        }
        try {
            JsonNode root = objectMapper.readTree(result.body() == null ? "" : result.body());
            if (root == null || !root.hasNonNull("roleId")) {
                return Optional.empty();
            }
            String roleId = root.get("roleId").asText();
            boolean approved = root.path("approved").asBoolean(false);
            return Optional.of(new GuildConfig(guildId, roleId, approved));
        } catch (IOException e) {
            throw new VerificationApiException("Guild config for " + guildId + " is not valid JSON", e);
        }
    }
}
