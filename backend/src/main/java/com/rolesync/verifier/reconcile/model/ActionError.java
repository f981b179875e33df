package com.rolesync.verifier.reconcile.model;

public record ActionError(Kind kind, String reason) {
    public static final String UNKNOWN_ROLE = "unknown_role";
    public static final String UNKNOWN_MEMBER = "unknown_member";
    public static final String MISSING_PERMISSIONS = "missing_permissions";

    public enum Kind {
        RATE_LIMIT_EXCEEDED,
        PERMANENT,
        TRANSIENT
    }

    public static ActionError rateLimitExceeded() {
        return new ActionError(Kind.RATE_LIMIT_EXCEEDED, "rate_limit_exceeded");
    }

    public static ActionError permanent(String reason) {
        return new ActionError(Kind.PERMANENT, reason);
    }

    public static ActionError transientFailure(String reason) {
        return new ActionError(Kind.TRANSIENT, reason);
    }

    public boolean isUnknownRole() {
        return kind == Kind.PERMANENT && UNKNOWN_ROLE.equals(reason);
    }
}
