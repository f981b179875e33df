package com.rolesync.verifier.reconcile.http;

public class VerificationApiException extends RuntimeException {
    public VerificationApiException(String message) {
        super(message);
    }

    public VerificationApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
