package com.rolesync.verifier.reconcile.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One reconciliation run over a guild. State changes follow {@link JobState#canMoveTo}; outcomes
 * are accepted only while running and at most once per user.
 */
public class BatchJob {
    private final String jobId;
    private final String guildId;
    private final String initiator;
    private final Instant createdAt;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final Map<String, MemberOutcome> outcomes = new LinkedHashMap<>();

    private JobState state = JobState.PENDING;
    private int memberCount;
    private Instant startedAt;
    private Instant finishedAt;
    private String abortReason;

    public BatchJob(String guildId, String initiator) {
        this(UUID.randomUUID().toString(), guildId, initiator, Instant.now());
    }

    public BatchJob(String jobId, String guildId, String initiator, Instant createdAt) {
        this.jobId = jobId;
        this.guildId = guildId;
        this.initiator = initiator;
        this.createdAt = createdAt;
    }

    public String jobId() {
        return jobId;
    }

    public String guildId() {
        return guildId;
    }

    public String initiator() {
        return initiator;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized JobState state() {
        return state;
    }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized String abortReason() {
        return abortReason;
    }

    public synchronized int memberCount() {
        return memberCount;
    }

    public synchronized int recordedCount() {
        return outcomes.size();
    }

    public synchronized List<MemberOutcome> outcomes() {
        return List.copyOf(new ArrayList<>(outcomes.values()));
    }

    public boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public synchronized void markRunning() {
        moveTo(JobState.RUNNING);
        startedAt = Instant.now();
    }

    public synchronized void expectMembers(int count) {
        requireState(JobState.RUNNING, "expect members");
        memberCount = Math.max(0, count);
    }

    public synchronized void record(MemberOutcome outcome) {
        requireState(JobState.RUNNING, "record an outcome");
        String userId = outcome.member().userId();
        if (outcomes.containsKey(userId)) {
            throw new IllegalStateException("Job " + jobId + " already has an outcome for user " + userId);
        }
        outcomes.put(userId, outcome);
    }

    public synchronized void complete() {
        moveTo(JobState.COMPLETED);
        finishedAt = Instant.now();
    }

    public synchronized void abort(String reason) {
        moveTo(JobState.ABORTED);
        abortReason = reason;
        finishedAt = Instant.now();
    }

    private void moveTo(JobState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Job " + jobId + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    private void requireState(JobState expected, String action) {
        if (state != expected) {
            throw new IllegalStateException("Job " + jobId + " cannot " + action + " while " + state);
        }
    }
}
