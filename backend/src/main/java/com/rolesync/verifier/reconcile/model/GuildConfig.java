package com.rolesync.verifier.reconcile.model;

public record GuildConfig(String guildId, String verifiedRoleId, boolean approved) {
    public boolean isUsable() {
        return approved && verifiedRoleId != null && !verifiedRoleId.isBlank();
    }
}
