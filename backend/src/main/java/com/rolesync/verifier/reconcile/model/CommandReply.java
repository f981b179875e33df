package com.rolesync.verifier.reconcile.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandReply(
    String message,
    boolean ephemeral,
    MemberOutcome outcome,
    BatchReport report
) {
    public static CommandReply ephemeral(String message, MemberOutcome outcome) {
        return new CommandReply(message, true, outcome, null);
    }

    public static CommandReply visible(String message) {
        return new CommandReply(message, false, null, null);
    }

    public static CommandReply withReport(String message, BatchReport report) {
        return new CommandReply(message, false, null, report);
    }
}
