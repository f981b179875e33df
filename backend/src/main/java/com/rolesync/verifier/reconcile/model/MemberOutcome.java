package com.rolesync.verifier.reconcile.model;

/**
 * Final disposition of one member. {@code status} is the verification status the decision was
 * based on, or null when no lookup happened (aborted members).
 */
public record MemberOutcome(
    Member member,
    Disposition disposition,
    VerificationStatus status,
    ErrorKind errorKind,
    String detail
) {
    public static MemberOutcome granted(Member member) {
        return new MemberOutcome(member, Disposition.ROLE_GRANTED, VerificationStatus.VERIFIED, null, null);
    }

    public static MemberOutcome revoked(Member member) {
        return new MemberOutcome(member, Disposition.ROLE_REVOKED, VerificationStatus.NOT_VERIFIED, null, null);
    }

    public static MemberOutcome unchanged(Member member, VerificationStatus status) {
        return new MemberOutcome(member, Disposition.NO_CHANGE_NEEDED, status, null, null);
    }

    public static MemberOutcome error(Member member, VerificationStatus status, ErrorKind kind, String detail) {
        return new MemberOutcome(member, Disposition.ERROR, status, kind, detail);
    }

    public static MemberOutcome aborted(Member member, String reason) {
        return new MemberOutcome(member, Disposition.ERROR, null, ErrorKind.ABORTED, reason);
    }

    public boolean isError() {
        return disposition == Disposition.ERROR;
    }
}
