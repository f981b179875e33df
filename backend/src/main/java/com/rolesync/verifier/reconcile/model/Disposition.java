package com.rolesync.verifier.reconcile.model;

public enum Disposition {
    ROLE_GRANTED,
    ROLE_REVOKED,
    NO_CHANGE_NEEDED,
    ERROR
}
