package com.rolesync.verifier.reconcile.model;

public record FailedMember(String userId, ErrorKind errorKind, String detail) {}
