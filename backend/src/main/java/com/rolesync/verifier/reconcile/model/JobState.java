package com.rolesync.verifier.reconcile.model;

public enum JobState {
    PENDING,
    RUNNING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }

    public boolean canMoveTo(JobState next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == ABORTED;
            case RUNNING -> next == COMPLETED || next == ABORTED;
            case COMPLETED, ABORTED -> false;
        };
    }
}
