package com.rolesync.verifier.reconcile.model;

import java.time.Duration;
import java.time.Instant;

public record HttpCallResult(
    String method,
    String requestedUrl,
    int statusCode,
    String body,
    String retryAfterHeader,
    Instant completedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isTransportError() {
        return errorCode != null;
    }

    public String describe() {
        if (errorCode != null) {
            return errorMessage == null || errorMessage.isBlank() ? errorCode : errorCode + ": " + errorMessage;
        }
        return "http_" + statusCode;
    }
}
