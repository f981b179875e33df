package com.rolesync.verifier.reconcile.model;

import java.time.Instant;

public record JobStatusResponse(
    String jobId,
    String guildId,
    String initiator,
    JobState state,
    boolean cancelRequested,
    int memberCount,
    int recordedCount,
    Instant createdAt,
    Instant startedAt
) {
    public static JobStatusResponse of(BatchJob job) {
        return new JobStatusResponse(
            job.jobId(),
            job.guildId(),
            job.initiator(),
            job.state(),
            job.isCancelRequested(),
            job.memberCount(),
            job.recordedCount(),
            job.createdAt(),
            job.startedAt()
        );
    }
}
