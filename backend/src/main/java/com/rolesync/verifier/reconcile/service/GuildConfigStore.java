package com.rolesync.verifier.reconcile.service;

import com.rolesync.verifier.reconcile.model.GuildConfig;

import java.util.Optional;

public interface GuildConfigStore {
    Optional<GuildConfig> find(String guildId);
}
