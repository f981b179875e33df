package com.rolesync.verifier.reconcile.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolesync.verifier.config.VerifierProperties;
import com.rolesync.verifier.reconcile.model.GuildMember;
import com.rolesync.verifier.reconcile.model.HttpCallResult;
import com.rolesync.verifier.reconcile.model.Member;
import com.rolesync.verifier.reconcile.service.MemberDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Service
public class DiscordMemberDirectory implements MemberDirectory {
    private static final Logger log = LoggerFactory.getLogger(DiscordMemberDirectory.class);

    private final DiscordRestTransport transport;
    private final ObjectMapper objectMapper;
    private final int pageSize;

    public DiscordMemberDirectory(DiscordRestTransport transport, ObjectMapper objectMapper, VerifierProperties properties) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.pageSize = properties.getDiscord().getMemberPageSize();
    }

    @Override
    public List<GuildMember> listMembers(String guildId) {
        Map<String, GuildMember> members = new LinkedHashMap<>();
        String after = "0";
        int pages = 0;
        int bots = 0;
        while (true) {
            String path = "/guilds/" + guildId + "/members?limit=" + pageSize + "&after=" + after;
            JsonNode page = readArray(transport.get(path), "member list for guild " + guildId);
            pages++;
            String lastUserId = null;
            for (JsonNode node : page) {
                JsonNode user = node.path("user");
                String userId = user.path("id").asText(null);
                if (userId == null || userId.isBlank()) {
                    continue;
                }
                lastUserId = userId;
                if (user.path("bot").asBoolean(false)) {
                    bots++;
                    continue;
                }
                members.putIfAbsent(userId, toGuildMember(guildId, userId, node));
            }
            if (page.size() < pageSize || lastUserId == null) {
                break;
            }
            after = lastUserId;
        }
        log.info("Listed {} members of guild {} in {} pages (skipped {} bots)", members.size(), guildId, pages, bots);
        return new ArrayList<>(members.values());
    }

    @Override
    public Optional<GuildMember> findMember(Member member) {
        HttpCallResult result = transport.get("/guilds/" + member.guildId() + "/members/" + member.userId());
        if (result.statusCode() == 404 && transport.errorCode(result) == DiscordRestTransport.UNKNOWN_MEMBER_CODE) {
            return Optional.empty();
        }
        JsonNode node = readJson(result, "member " + member.userId() + " of guild " + member.guildId());
        return Optional.of(toGuildMember(member.guildId(), member.userId(), node));
    }

    @Override
    public boolean roleExists(String guildId, String roleId) {
        JsonNode roles = readArray(transport.get("/guilds/" + guildId + "/roles"), "roles of guild " + guildId);
        for (JsonNode role : roles) {
            if (roleId.equals(role.path("id").asText(null))) {
                return true;
            }
        }
        return false;
    }

    private GuildMember toGuildMember(String guildId, String userId, JsonNode node) {
        Set<String> roles = new LinkedHashSet<>();
        for (JsonNode role : node.path("roles")) {
            roles.add(role.asText());
        }
        return new GuildMember(new Member(guildId, userId), roles);
    }

    private JsonNode readArray(HttpCallResult result, String what) {
        JsonNode node = readJson(result, what);
        if (!node.isArray()) {
            throw new DiscordApiException("Expected a JSON array for " + what, result.statusCode());
        }
        return node;
    }

    private JsonNode readJson(HttpCallResult result, String what) {
        if (!result.isSuccessful()) {
            throw new DiscordApiException("Failed to read " + what + ": " + result.describe(), result.statusCode());
        }
        try {
            return objectMapper.readTree(result.body() == null ? "" : result.body());
        } catch (IOException e) {
            throw new DiscordApiException("Invalid JSON for " + what, e);
        }
    }
}
