package com.rolesync.verifier.reconcile.service;

import com.rolesync.verifier.reconcile.model.BatchJob;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRegistryTest {

    @Test
    void rejectsSecondJobForSameGuild() {
        JobRegistry registry = new JobRegistry();
        BatchJob first = registry.register("7", "alice");

        JobAlreadyRunningException ex = assertThrows(JobAlreadyRunningException.class, () -> registry.register("7", "bob"));

        assertEquals(first.jobId(), ex.activeJobId());
        assertEquals("7", ex.guildId());
        assertEquals(1, registry.activeCount());
    }

    @Test
    void guildsAreIndependent() {
        JobRegistry registry = new JobRegistry();
        registry.register("7", "alice");
        registry.register("8", "alice");

        assertEquals(2, registry.activeCount());
    }

    @Test
    void removalFreesTheGuild() {
        JobRegistry registry = new JobRegistry();
        BatchJob first = registry.register("7", "alice");
        first.markRunning();
        first.complete();
        registry.remove(first);

        BatchJob second = registry.register("7", "bob");

        assertSame(second, registry.find("7").orElseThrow());
    }

    @Test
    void staleRemovalKeepsNewerJob() {
        JobRegistry registry = new JobRegistry();
        BatchJob first = registry.register("7", "alice");
        first.abort("executor_rejected");
        BatchJob second = registry.register("7", "bob");

        registry.remove(first);

        assertSame(second, registry.find("7").orElseThrow());
    }

    @Test
    void cancelOnlyReachesRunningJobs() {
        JobRegistry registry = new JobRegistry();
        assertFalse(registry.requestCancel("7"));

        BatchJob job = registry.register("7", "alice");
        assertTrue(registry.requestCancel("7"));
        assertTrue(job.isCancelRequested());

        job.abort("cancelled");
        assertFalse(registry.requestCancel("7"));
    }
}
