package com.rolesync.verifier.reconcile.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record BatchReport(
    String jobId,
    String guildId,
    String initiator,
    JobState state,
    String abortReason,
    Instant startedAt,
    Instant finishedAt,
    int total,
    int granted,
    int revoked,
    int unchanged,
    int verified,
    int notVerified,
    int errors,
    Map<ErrorKind, Integer> errorsByKind,
    List<FailedMember> failures,
    int omittedFailures
) {}
