package com.rolesync.verifier.reconcile.model;

public enum ErrorKind {
    LOOKUP_FAILED,
    RATE_LIMIT_EXCEEDED,
    ACTION_FAILED,
    ACTION_TRANSIENT,
    MEMBER_UNAVAILABLE,
    ABORTED;

    public static ErrorKind of(ActionError error) {
        return switch (error.kind()) {
            case RATE_LIMIT_EXCEEDED -> RATE_LIMIT_EXCEEDED;
            case PERMANENT -> ACTION_FAILED;
            case TRANSIENT -> ACTION_TRANSIENT;
        };
    }
}
