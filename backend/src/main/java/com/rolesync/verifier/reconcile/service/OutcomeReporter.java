package com.rolesync.verifier.reconcile.service;

import com.rolesync.verifier.config.VerifierProperties;
import com.rolesync.verifier.reconcile.model.BatchJob;
import com.rolesync.verifier.reconcile.model.BatchReport;
import com.rolesync.verifier.reconcile.model.ErrorKind;
import com.rolesync.verifier.reconcile.model.FailedMember;
import com.rolesync.verifier.reconcile.model.JobState;
import com.rolesync.verifier.reconcile.model.MemberOutcome;
import com.rolesync.verifier.reconcile.model.VerificationStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Summarises a finished job. Successes are only counted; failing members are listed by id up to
 * the configured limit so the reply stays small on large guilds.
 */
@Component
public class OutcomeReporter {
    private final int maxFailures;

    public OutcomeReporter(VerifierProperties properties) {
        this.maxFailures = properties.getReconcile().getReportMaxFailures();
    }

    public BatchReport report(BatchJob job) {
        if (!job.isTerminal()) {
            throw new IllegalArgumentException("Job " + job.jobId() + " is still " + job.state());
        }
        int granted = 0;
        int revoked = 0;
        int unchanged = 0;
        int verified = 0;
        int notVerified = 0;
        int errors = 0;
        Map<ErrorKind, Integer> errorsByKind = new EnumMap<>(ErrorKind.class);
        List<FailedMember> failures = new ArrayList<>();

        List<MemberOutcome> outcomes = job.outcomes();
        for (MemberOutcome outcome : outcomes) {
            VerificationStatus status = outcome.status();
            if (status != null && status.isVerified()) {
                verified++;
            } else if (status != null && status.kind() == VerificationStatus.Kind.NOT_VERIFIED) {
                notVerified++;
            }
            switch (outcome.disposition()) {
                case ROLE_GRANTED -> granted++;
                case ROLE_REVOKED -> revoked++;
                case NO_CHANGE_NEEDED -> unchanged++;
                case ERROR -> {
                    errors++;
                    errorsByKind.merge(outcome.errorKind(), 1, Integer::sum);
                    if (failures.size() < maxFailures) {
                        failures.add(new FailedMember(outcome.member().userId(), outcome.errorKind(), outcome.detail()));
                    }
                }
            }
        }

        return new BatchReport(
            job.jobId(),
            job.guildId(),
            job.initiator(),
            job.state(),
            job.abortReason(),
            job.startedAt(),
            job.finishedAt(),
            outcomes.size(),
            granted,
            revoked,
            unchanged,
            verified,
            notVerified,
            errors,
            errorsByKind,
            List.copyOf(failures),
            errors - failures.size()
        );
    }

    public String render(BatchReport report) {
        StringBuilder text = new StringBuilder();
        if (report.state() == JobState.ABORTED) {
            text.append("Re-verification was stopped early (").append(describeAbort(report.abortReason())).append(").");
        } else {
            text.append("Successfully completed re-verifications.");
        }
        text.append('\n')
            .append("Checked ").append(report.total()).append(" members: ")
            .append(report.verified()).append(" verified, ")
            .append(report.notVerified()).append(" not verified, ")
            .append(report.errors()).append(" errored.");
        text.append('\n')
            .append("Roles granted: ").append(report.granted())
            .append(", revoked: ").append(report.revoked())
            .append(", unchanged: ").append(report.unchanged()).append('.');
        for (FailedMember failure : report.failures()) {
            text.append('\n').append("- <@").append(failure.userId()).append(">: ")
                .append(failure.errorKind().name().toLowerCase(Locale.ROOT));
            if (failure.detail() != null && !failure.detail().isBlank()) {
                text.append(" (").append(failure.detail()).append(')');
            }
        }
        if (report.omittedFailures() > 0) {
            text.append('\n').append("...and ").append(report.omittedFailures()).append(" more.");
        }
        return text.toString();
    }

    private String describeAbort(String reason) {
        if (reason == null) {
            return "unknown reason";
        }
        return switch (reason) {
            case ReconciliationEngine.CANCELLED -> "cancelled";
            case ReconciliationEngine.INVALID_GUILD_CONFIG -> "the verified role is no longer configured";
            case ReconciliationEngine.MEMBER_LIST_FAILED -> "the member list could not be loaded";
            default -> reason;
        };
    }
}
