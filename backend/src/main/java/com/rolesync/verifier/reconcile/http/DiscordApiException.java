package com.rolesync.verifier.reconcile.http;

public class DiscordApiException extends RuntimeException {
    private final int statusCode;

    public DiscordApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public DiscordApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int statusCode() {
        return statusCode;
    }
}
