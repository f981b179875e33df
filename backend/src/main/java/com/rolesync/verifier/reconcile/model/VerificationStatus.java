package com.rolesync.verifier.reconcile.model;

public record VerificationStatus(Kind kind, LookupFailureReason failureReason, String detail) {
    public static final VerificationStatus VERIFIED = new VerificationStatus(Kind.VERIFIED, null, null);
    public static final VerificationStatus NOT_VERIFIED = new VerificationStatus(Kind.NOT_VERIFIED, null, null);

    public enum Kind {
        VERIFIED,
        NOT_VERIFIED,
        LOOKUP_FAILED
    }

    public static VerificationStatus lookupFailed(LookupFailureReason reason, String detail) {
        return new VerificationStatus(Kind.LOOKUP_FAILED, reason, detail);
    }

    public boolean isVerified() {
        return kind == Kind.VERIFIED;
    }

    public boolean isLookupFailed() {
        return kind == Kind.LOOKUP_FAILED;
    }

    @Override
    public String toString() {
        if (kind == Kind.LOOKUP_FAILED) {
            return "LOOKUP_FAILED(" + failureReason + ")";
        }
        return kind.name();
    }
}
