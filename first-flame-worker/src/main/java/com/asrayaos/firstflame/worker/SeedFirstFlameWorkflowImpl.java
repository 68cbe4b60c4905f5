package com.asrayaos.firstflame.worker;

import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.failure.ActivityFailure;
import io.temporal.failure.ApplicationFailure;
import io.temporal.failure.TimeoutFailure;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.Duration;

/**
 * Implementation of the SeedFirstFlameWorkflow interface.
 * The activity is retried as a whole run; each run is idempotent, so re-invocation is safe.
 */
public class SeedFirstFlameWorkflowImpl implements SeedFirstFlameWorkflow {
    private static final Logger logger = Workflow.getLogger(SeedFirstFlameWorkflowImpl.class);

    static final Duration RUN_BUDGET = Duration.ofMinutes(10);
    static final int MAX_ATTEMPTS = 3;
    static final String TIMEOUT_REASON = "TIMEOUT";
    static final String UNKNOWN_REASON = "UNKNOWN";

    private final ActivityOptions activityOptions = ActivityOptions.newBuilder()
        .setStartToCloseTimeout(RUN_BUDGET)
        .setRetryOptions(RetryOptions.newBuilder()
            .setInitialInterval(Duration.ofSeconds(1))
            .setMaximumInterval(Duration.ofSeconds(10))
            .setMaximumAttempts(MAX_ATTEMPTS)
            .build())
        .build();

    private final SeedingActivities activities = Workflow.newActivityStub(SeedingActivities.class, activityOptions);

    private SeedingStatus status;

    @Override
    public SeedingReport seed(String userId) {
        status = new SeedingStatus(userId, SeedingStatus.RUNNING, null, Workflow.currentTimeMillis());

        SeedingReport report;
        try {
            report = activities.runSeeding(userId);
        } catch (ActivityFailure e) {
            report = reportFromFailure(userId, e);
        }

        if (report.isSuccess()) {
            status = new SeedingStatus(userId, SeedingStatus.DONE, null, Workflow.currentTimeMillis());
            logger.info("First-Flame seeding done for {} on attempt {}", userId, report.getAttempt());
        } else {
            status = new SeedingStatus(userId, SeedingStatus.FAILED, report.getFailureReason(),
                Workflow.currentTimeMillis());
            logger.warn("First-Flame seeding failed for {}: {} ({})", userId, report.getFailureReason(),
                report.getMessage());
        }
        return report;
    }

    @Override
    public SeedingStatus getStatus() {
        return status;
    }

    private static SeedingReport reportFromFailure(String userId, ActivityFailure failure) {
        Throwable cause = failure.getCause();
        if (cause instanceof ApplicationFailure) {
            ApplicationFailure applicationFailure = (ApplicationFailure) cause;
            if (applicationFailure.getDetails().getSize() > 0) {
                return applicationFailure.getDetails().get(0, SeedingReport.class);
            }
            return SeedingReport.failure(userId, applicationFailure.getType(), applicationFailure.getOriginalMessage());
        }
        if (cause instanceof TimeoutFailure) {
            return SeedingReport.failure(userId, TIMEOUT_REASON, "Seeding run exceeded its budget of " + RUN_BUDGET);
        }
        return SeedingReport.failure(userId, UNKNOWN_REASON, failure.getMessage());
    }
}
