package com.rolesync.verifier.reconcile.model;

public enum LookupFailureReason {
    TIMEOUT,
    BAD_REQUEST
}
