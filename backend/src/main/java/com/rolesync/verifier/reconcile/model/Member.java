package com.rolesync.verifier.reconcile.model;

import java.util.Objects;

public record Member(String guildId, String userId) {
    public Member {
        Objects.requireNonNull(guildId, "guildId");
        Objects.requireNonNull(userId, "userId");
    }
}
