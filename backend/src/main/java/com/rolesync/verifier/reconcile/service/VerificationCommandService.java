package com.rolesync.verifier.reconcile.service;

import com.rolesync.verifier.config.VerifierProperties;
import com.rolesync.verifier.reconcile.http.DiscordApiException;
import com.rolesync.verifier.reconcile.http.VerificationApiException;
import com.rolesync.verifier.reconcile.model.BatchJob;
import com.rolesync.verifier.reconcile.model.BatchReport;
import com.rolesync.verifier.reconcile.model.CommandReply;
import com.rolesync.verifier.reconcile.model.JobStatusResponse;
import com.rolesync.verifier.reconcile.model.Member;
import com.rolesync.verifier.reconcile.model.MemberOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns the bot's commands into engine calls and user-facing replies.
 */
@Service
public class VerificationCommandService {
    private static final Logger log = LoggerFactory.getLogger(VerificationCommandService.class);

    static final String VERIFIED_MESSAGE = "You have now been verified!";
    static final String VERIFY_PROMPT = "Please verify yourself by going to ";
    static final String TRY_AGAIN_MESSAGE = "Something went wrong while verifying you, please try again.";
    static final String UNSUPPORTED_GUILD_MESSAGE =
        "It looks like your server doesn't support this bot, please contact the admins.";
    static final String JOB_RUNNING_MESSAGE = "A verification job is already running for this server.";
    static final String CANCELLING_MESSAGE = "Cancelling the running verification job.";
    static final String NO_JOB_MESSAGE = "No verification job is running for this server.";

    private final ReconciliationEngine engine;
    private final OutcomeReporter reporter;
    private final String verifyUrl;

    public VerificationCommandService(ReconciliationEngine engine, OutcomeReporter reporter, VerifierProperties properties) {
        this.engine = engine;
        this.reporter = reporter;
        this.verifyUrl = properties.getVerification().getBaseUrl();
    }

    public CommandReply verify(String guildId, String userId) {
        MemberOutcome outcome;
        try {
            outcome = engine.reconcileOne(new Member(guildId, userId));
        } catch (InvalidGuildConfigException e) {
            log.info("Verify requested in unsupported guild {}: {}", guildId, e.getMessage());
            return CommandReply.visible(UNSUPPORTED_GUILD_MESSAGE);
        } catch (VerificationApiException | DiscordApiException e) {
            log.warn("Verify of user {} in guild {} failed upstream: {}", userId, guildId, e.getMessage());
            return CommandReply.ephemeral(TRY_AGAIN_MESSAGE, null);
        }
        return CommandReply.ephemeral(messageFor(outcome), outcome);
    }

    public Optional<MemberOutcome> memberJoined(String guildId, String userId) {
        try {
            return Optional.of(engine.reconcileJoined(new Member(guildId, userId)));
        } catch (InvalidGuildConfigException e) {
            log.debug("Ignoring join of {} in unsupported guild {}", userId, guildId);
            return Optional.empty();
        }
    }

    public CommandReply reverify(String guildId, String initiator) {
        BatchJob job;
        try {
            job = engine.reconcileAll(guildId, initiator);
        } catch (InvalidGuildConfigException e) {
            return CommandReply.visible(UNSUPPORTED_GUILD_MESSAGE);
        } catch (JobAlreadyRunningException e) {
            return CommandReply.visible(JOB_RUNNING_MESSAGE);
        }
        BatchReport report = reporter.report(job);
        return CommandReply.withReport(reporter.render(report), report);
    }

    public JobStatusResponse startReverify(String guildId, String initiator) {
        return JobStatusResponse.of(engine.submitAll(guildId, initiator));
    }

    public CommandReply cancel(String guildId) {
        return CommandReply.visible(engine.cancel(guildId) ? CANCELLING_MESSAGE : NO_JOB_MESSAGE);
    }

    public Optional<JobStatusResponse> status(String guildId) {
        return engine.activeJob(guildId).map(JobStatusResponse::of);
    }

    String messageFor(MemberOutcome outcome) {
        switch (outcome.disposition()) {
            case ROLE_GRANTED:
                return VERIFIED_MESSAGE;
            case NO_CHANGE_NEEDED:
                return outcome.status() != null && outcome.status().isVerified()
                    ? VERIFIED_MESSAGE
                    : VERIFY_PROMPT + verifyUrl;
            case ROLE_REVOKED:
                return VERIFY_PROMPT + verifyUrl;
            default:
                return TRY_AGAIN_MESSAGE;
        }
    }
}
