package com.rolesync.verifier.reconcile.model;

import java.util.Set;

/**
 * A member together with the roles Discord reported for it when it was read.
 */
public record GuildMember(Member member, Set<String> roleIds) {
    public GuildMember {
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
    }

    public boolean hasRole(String roleId) {
        return roleId != null && roleIds.contains(roleId);
    }
}
