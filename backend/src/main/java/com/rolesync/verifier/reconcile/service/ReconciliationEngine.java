package com.rolesync.verifier.reconcile.service;

import com.rolesync.verifier.config.VerifierProperties;
import com.rolesync.verifier.reconcile.http.DiscordApiException;
import com.rolesync.verifier.reconcile.http.VerificationApiException;
import com.rolesync.verifier.reconcile.model.ActionError;
import com.rolesync.verifier.reconcile.model.BatchJob;
import com.rolesync.verifier.reconcile.model.ErrorKind;
import com.rolesync.verifier.reconcile.model.GuildConfig;
import com.rolesync.verifier.reconcile.model.GuildMember;
import com.rolesync.verifier.reconcile.model.Member;
import com.rolesync.verifier.reconcile.model.MemberOutcome;
import com.rolesync.verifier.reconcile.model.RoleActionResult;
import com.rolesync.verifier.reconcile.model.VerificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Brings the verified role of members in line with the verification service, either for a
 * single member or for every member of a guild.
 *
 * <p>A batch runs its members through a bounded number of workers. Cancellation and configuration
 * validity are checked only when a worker slot frees up, before the next member is handed out;
 * members already handed out always finish with their real outcome.
 */
@Service
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    public static final String CANCELLED = "cancelled";
    public static final String INVALID_GUILD_CONFIG = "invalid_guild_config";
    public static final String MEMBER_LIST_FAILED = "member_list_failed";
    public static final String INTERRUPTED = "interrupted";
    public static final String EXECUTOR_REJECTED = "executor_rejected";
    public static final String JOB_FAILED = "job_failed";

    private enum Mode {
        FULL,
        GRANT_ONLY
    }

    private final VerificationLookupClient lookupClient;
    private final RoleActionClient roleActionClient;
    private final MemberDirectory memberDirectory;
    private final GuildConfigStore guildConfigStore;
    private final JobRegistry jobRegistry;
    private final ExecutorService workerExecutor;
    private final ExecutorService jobExecutor;
    private final int batchConcurrency;
    private final int configRecheckEvery;

    public ReconciliationEngine(
        VerificationLookupClient lookupClient,
        RoleActionClient roleActionClient,
        MemberDirectory memberDirectory,
        GuildConfigStore guildConfigStore,
        JobRegistry jobRegistry,
        @Qualifier("reconcileWorkerExecutor") ExecutorService workerExecutor,
        @Qualifier("reconcileJobExecutor") ExecutorService jobExecutor,
        VerifierProperties properties
    ) {
        this.lookupClient = lookupClient;
        this.roleActionClient = roleActionClient;
        this.memberDirectory = memberDirectory;
        this.guildConfigStore = guildConfigStore;
        this.jobRegistry = jobRegistry;
        this.workerExecutor = workerExecutor;
        this.jobExecutor = jobExecutor;
        this.batchConcurrency = properties.effectiveBatchConcurrency();
        this.configRecheckEvery = properties.getReconcile().getConfigRecheckEvery();
    }

    public MemberOutcome reconcileOne(Member member) {
        GuildConfig config = requireConfig(member.guildId());
        return reconcileLive(member, config, Mode.FULL);
    }

    /**
     * Reconciles a member that just joined. Only grants: a member that is not verified keeps
     * whatever roles it arrived with.
     */
    public MemberOutcome reconcileJoined(Member member) {
        GuildConfig config = requireConfig(member.guildId());
        return reconcileLive(member, config, Mode.GRANT_ONLY);
    }

    public BatchJob reconcileAll(String guildId, String initiator) {
        GuildConfig config = requireConfig(guildId);
        BatchJob job = jobRegistry.register(guildId, initiator);
        runJob(job, config);
        return job;
    }

    public BatchJob submitAll(String guildId, String initiator) {
        GuildConfig config = requireConfig(guildId);
        BatchJob job = jobRegistry.register(guildId, initiator);
        try {
            jobExecutor.submit(() -> runJob(job, config));
        } catch (RejectedExecutionException e) {
            job.abort(EXECUTOR_REJECTED);
            jobRegistry.remove(job);
            throw e;
        }
        return job;
    }

    public boolean cancel(String guildId) {
        boolean requested = jobRegistry.requestCancel(guildId);
        if (requested) {
            log.info("Cancellation requested for reconcile job in guild {}", guildId);
        }
        return requested;
    }

    public Optional<BatchJob> activeJob(String guildId) {
        return jobRegistry.find(guildId).filter(job -> !job.isTerminal());
    }

    private GuildConfig requireConfig(String guildId) {
        Optional<GuildConfig> config = guildConfigStore.find(guildId);
        if (config.isEmpty()) {
            throw new InvalidGuildConfigException(guildId, "Guild " + guildId + " has no verified role configured");
        }
        if (!config.get().isUsable()) {
            throw new InvalidGuildConfigException(guildId, "Guild " + guildId + " is not approved for verification");
        }
        return config.get();
    }

    private MemberOutcome reconcileLive(Member member, GuildConfig config, Mode mode) {
        VerificationStatus status = lookupClient.lookup(member);
        if (status.isLookupFailed()) {
            return lookupFailed(member, status);
        }
        if (mode == Mode.GRANT_ONLY && !status.isVerified()) {
            return MemberOutcome.unchanged(member, status);
        }
        Optional<GuildMember> current;
        try {
            current = memberDirectory.findMember(member);
        } catch (DiscordApiException e) {
            log.warn("Could not read roles of user {} in guild {}: {}", member.userId(), member.guildId(), e.getMessage());
            return MemberOutcome.error(member, status, ErrorKind.MEMBER_UNAVAILABLE, e.getMessage());
        }
        if (current.isEmpty()) {
            return MemberOutcome.error(member, status, ErrorKind.ACTION_FAILED, ActionError.UNKNOWN_MEMBER);
        }
        return apply(current.get(), status, config.verifiedRoleId(), mode);
    }

    private MemberOutcome reconcileSnapshot(GuildMember snapshot, GuildConfig config) {
        VerificationStatus status = lookupClient.lookup(snapshot.member());
        if (status.isLookupFailed()) {
            return lookupFailed(snapshot.member(), status);
        }
        return apply(snapshot, status, config.verifiedRoleId(), Mode.FULL);
    }

    private MemberOutcome apply(GuildMember current, VerificationStatus status, String roleId, Mode mode) {
        Member member = current.member();
        boolean holdsRole = current.hasRole(roleId);
        if (status.isVerified()) {
            if (holdsRole) {
                return MemberOutcome.unchanged(member, status);
            }
            RoleActionResult result = roleActionClient.grant(member, roleId);
            return result.isSuccess() ? MemberOutcome.granted(member) : actionFailed(member, status, result.error());
        }
        if (!holdsRole || mode == Mode.GRANT_ONLY) {
            return MemberOutcome.unchanged(member, status);
        }
        RoleActionResult result = roleActionClient.revoke(member, roleId);
        return result.isSuccess() ? MemberOutcome.revoked(member) : actionFailed(member, status, result.error());
    }

    private MemberOutcome lookupFailed(Member member, VerificationStatus status) {
        String detail = status.failureReason() == null ? null : status.failureReason().name().toLowerCase(Locale.ROOT);
        return MemberOutcome.error(member, status, ErrorKind.LOOKUP_FAILED, detail);
    }

    private MemberOutcome actionFailed(Member member, VerificationStatus status, ActionError error) {
        return MemberOutcome.error(member, status, ErrorKind.of(error), error.reason());
    }

    private void runJob(BatchJob job, GuildConfig config) {
        String guildId = job.guildId();
        try {
            job.markRunning();
            log.info("Reconcile job {} started for guild {} by {}", job.jobId(), guildId, job.initiator());
            List<GuildMember> members;
            try {
                members = distinctMembers(memberDirectory.listMembers(guildId));
            } catch (DiscordApiException e) {
                log.warn("Reconcile job {} could not list members of guild {}", job.jobId(), guildId, e);
                job.abort(MEMBER_LIST_FAILED);
                return;
            }
            job.expectMembers(members.size());
            dispatch(job, config, members);
        } catch (RuntimeException e) {
            log.warn("Reconcile job {} for guild {} failed", job.jobId(), guildId, e);
            if (!job.isTerminal()) {
                job.abort(JOB_FAILED);
            }
        } finally {
            jobRegistry.remove(job);
            log.info(
                "Reconcile job {} for guild {} finished with state {} ({} of {} members recorded{})",
                job.jobId(),
                guildId,
                job.state(),
                job.recordedCount(),
                job.memberCount(),
                job.abortReason() == null ? "" : ", reason=" + job.abortReason()
            );
        }
    }

    private void dispatch(BatchJob job, GuildConfig config, List<GuildMember> members) {
        Semaphore slots = new Semaphore(batchConcurrency);
        AtomicBoolean configInvalid = new AtomicBoolean(false);
        List<Future<?>> inFlight = new ArrayList<>();
        String abortReason = null;
        int next = 0;
        try {
            while (next < members.size()) {
                slots.acquire();
                abortReason = stopReason(job, config, next, configInvalid);
                if (abortReason != null) {
                    slots.release();
                    break;
                }
                GuildMember member = members.get(next);
                try {
                    inFlight.add(workerExecutor.submit(() -> reconcileInJob(job, member, config, configInvalid, slots)));
                } catch (RejectedExecutionException e) {
                    slots.release();
                    abortReason = EXECUTOR_REJECTED;
                    break;
                }
                next++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abortReason = INTERRUPTED;
        }

        awaitAll(job, inFlight);
        if (abortReason == null && configInvalid.get()) {
            abortReason = INVALID_GUILD_CONFIG;
        }
        if (abortReason == null) {
            job.complete();
            return;
        }
        for (int i = next; i < members.size(); i++) {
            job.record(MemberOutcome.aborted(members.get(i).member(), abortReason));
        }
        log.info("Reconcile job {} aborted ({}), {} members not dispatched", job.jobId(), abortReason, members.size() - next);
        job.abort(abortReason);
    }

    private String stopReason(BatchJob job, GuildConfig config, int dispatched, AtomicBoolean configInvalid) {
        if (job.isCancelRequested()) {
            return CANCELLED;
        }
        if (configRecheckEvery > 0 && dispatched > 0 && dispatched % configRecheckEvery == 0 && !configStillValid(config)) {
            configInvalid.set(true);
        }
        return configInvalid.get() ? INVALID_GUILD_CONFIG : null;
    }

    private void reconcileInJob(
        BatchJob job,
        GuildMember member,
        GuildConfig config,
        AtomicBoolean configInvalid,
        Semaphore slots
    ) {
        try {
            MemberOutcome outcome = reconcileIsolated(member, config);
            if (outcome.isError() && ActionError.UNKNOWN_ROLE.equals(outcome.detail())) {
                configInvalid.set(true);
            }
            job.record(outcome);
        } finally {
            slots.release();
        }
    }

    private MemberOutcome reconcileIsolated(GuildMember member, GuildConfig config) {
        try {
            return reconcileSnapshot(member, config);
        } catch (RuntimeException e) {
            log.warn("Unexpected failure reconciling user {} in guild {}", member.member().userId(), config.guildId(), e);
            return MemberOutcome.error(member.member(), null, ErrorKind.ACTION_TRANSIENT, "unexpected_error: " + e.getClass().getSimpleName());
        }
    }

    private boolean configStillValid(GuildConfig config) {
        String guildId = config.guildId();
        try {
            Optional<GuildConfig> current = guildConfigStore.find(guildId);
            if (current.isEmpty() || !current.get().isUsable() || !config.verifiedRoleId().equals(current.get().verifiedRoleId())) {
                log.warn("Verified role configuration of guild {} changed during reconcile", guildId);
                return false;
            }
            if (!memberDirectory.roleExists(guildId, config.verifiedRoleId())) {
                log.warn("Verified role {} no longer exists in guild {}", config.verifiedRoleId(), guildId);
                return false;
            }
            return true;
        } catch (VerificationApiException | DiscordApiException e) {
            log.warn("Could not re-check configuration of guild {}, continuing: {}", guildId, e.getMessage());
            return true;
        }
    }

    private void awaitAll(BatchJob job, List<Future<?>> futures) {
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    log.warn("Reconcile worker for job {} failed", job.jobId(), e.getCause());
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private List<GuildMember> distinctMembers(List<GuildMember> members) {
        Map<String, GuildMember> byUser = new LinkedHashMap<>();
        for (GuildMember member : members) {
            byUser.putIfAbsent(member.member().userId(), member);
        }
        return new ArrayList<>(byUser.values());
    }
}
