package com.rolesync.verifier.reconcile.http;

import com.rolesync.verifier.config.VerifierProperties;
import com.rolesync.verifier.reconcile.model.ActionError;
import com.rolesync.verifier.reconcile.model.HttpCallResult;
import com.rolesync.verifier.reconcile.model.Member;
import com.rolesync.verifier.reconcile.model.RoleActionResult;
import com.rolesync.verifier.reconcile.service.RoleActionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DiscordRoleActionClient implements RoleActionClient {
    private static final Logger log = LoggerFactory.getLogger(DiscordRoleActionClient.class);

    private final DiscordRestTransport transport;
    private final String auditLogReason;

    public DiscordRoleActionClient(DiscordRestTransport transport, VerifierProperties properties) {
        this.transport = transport;
        this.auditLogReason = properties.getDiscord().getAuditLogReason();
    }

    @Override
    public RoleActionResult grant(Member member, String roleId) {
        HttpCallResult result = transport.put(rolePath(member, roleId), auditLogReason);
        return toResult("grant", member, roleId, result);
    }

    @Override
    public RoleActionResult revoke(Member member, String roleId) {
        HttpCallResult result = transport.delete(rolePath(member, roleId), auditLogReason);
        return toResult("revoke", member, roleId, result);
    }

    private RoleActionResult toResult(String action, Member member, String roleId, HttpCallResult result) {
        if (result.isSuccessful()) {
            log.debug("Role {} of {} for user {} in guild {} succeeded", action, roleId, member.userId(), member.guildId());
            return RoleActionResult.ok();
        }
        ActionError error = classify(result);
        log.warn(
            "Role {} of {} for user {} in guild {} failed: {} ({})",
            action,
            roleId,
            member.userId(),
            member.guildId(),
            error.kind(),
            error.reason()
        );
        return RoleActionResult.failed(error);
    }

    private ActionError classify(HttpCallResult result) {
        if (result.isTransportError()) {
            return HttpCallExecutor.isTransient(result)
                ? ActionError.transientFailure(result.errorCode())
                : ActionError.permanent(result.errorCode());
        }
        int status = result.statusCode();
        if (status == 429) {
            return ActionError.rateLimitExceeded();
        }
        if (status == 403) {
            return ActionError.permanent(ActionError.MISSING_PERMISSIONS);
        }
        if (status == 404) {
            int code = transport.errorCode(result);
            if (code == DiscordRestTransport.UNKNOWN_ROLE_CODE) {
                return ActionError.permanent(ActionError.UNKNOWN_ROLE);
            }
            if (code == DiscordRestTransport.UNKNOWN_MEMBER_CODE) {
                return ActionError.permanent(ActionError.UNKNOWN_MEMBER);
            }
            return ActionError.permanent("not_found");
        }
        if (HttpCallExecutor.isTransient(result)) {
            return ActionError.transientFailure(result.describe());
        }
        return ActionError.permanent(result.describe());
    }

    static String rolePath(Member member, String roleId) {
        return "/guilds/" + member.guildId() + "/members/" + member.userId() + "/roles/" + roleId;
    }
}
