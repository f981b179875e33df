package com.rolesync.verifier.reconcile.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class JobAlreadyRunningException extends RuntimeException {
    private final String guildId;
    private final String activeJobId;

    public JobAlreadyRunningException(String guildId, String activeJobId) {
        super("A verification job is already running for guild " + guildId + " (job=" + activeJobId + ")");
        this.guildId = guildId;
        this.activeJobId = activeJobId;
    }

    public String guildId() {
        return guildId;
    }

    public String activeJobId() {
        return activeJobId;
    }
}
