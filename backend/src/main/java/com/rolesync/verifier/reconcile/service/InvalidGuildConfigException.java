package com.rolesync.verifier.reconcile.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class InvalidGuildConfigException extends RuntimeException {
    private final String guildId;

    public InvalidGuildConfigException(String guildId, String message) {
        super(message);
        this.guildId = guildId;
    }

    public String guildId() {
        return guildId;
    }
}
