package com.rolesync.verifier.reconcile.service;

import com.rolesync.verifier.reconcile.model.BatchJob;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Active batch job per guild. The lock covers registration and removal only; jobs run outside it.
 */
@Component
public class JobRegistry {
    private final Object lock = new Object();
    private final Map<String, BatchJob> active = new HashMap<>();

    public BatchJob register(String guildId, String initiator) {
        synchronized (lock) {
            BatchJob existing = active.get(guildId);
            if (existing != null && !existing.isTerminal()) {
                throw new JobAlreadyRunningException(guildId, existing.jobId());
            }
            BatchJob job = new BatchJob(guildId, initiator);
            active.put(guildId, job);
            return job;
        }
    }

    public void remove(BatchJob job) {
        synchronized (lock) {
            active.remove(job.guildId(), job);
        }
    }

    public Optional<BatchJob> find(String guildId) {
        synchronized (lock) {
            return Optional.ofNullable(active.get(guildId));
        }
    }

    public boolean requestCancel(String guildId) {
        Optional<BatchJob> job = find(guildId);
        if (job.isEmpty() || job.get().isTerminal()) {
            return false;
        }
        job.get().requestCancel();
        return true;
    }

    public int activeCount() {
        synchronized (lock) {
            return active.size();
        }
    }
}
