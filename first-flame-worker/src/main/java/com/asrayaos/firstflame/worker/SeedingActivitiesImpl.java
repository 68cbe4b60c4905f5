package com.asrayaos.firstflame.worker;

import com.asrayaos.firstflame.seeding.FailureReason;
import com.asrayaos.firstflame.seeding.SeedingOutcome;
import com.asrayaos.firstflame.seeding.SeedingService;
import io.temporal.activity.Activity;
import io.temporal.failure.ApplicationFailure;

/**
 * Implementation of the SeedingActivities interface over a {@link SeedingService}.
 *
 * <p>A failed run is raised as an {@link ApplicationFailure} typed with the failure reason and
 * carrying the report as its detail. Reasons that another attempt cannot fix are non-retryable.
 */
public class SeedingActivitiesImpl implements SeedingActivities {

    private final SeedingService seedingService;

    public SeedingActivitiesImpl(SeedingService seedingService) {
        this.seedingService = seedingService;
    }

    @Override
    public SeedingReport runSeeding(String userId) {
        int attempt = Activity.getExecutionContext().getInfo().getAttempt();
        SeedingOutcome outcome = seedingService.runSeeding(userId);
        SeedingReport report = SeedingReport.fromOutcome(outcome, attempt);
        if (outcome.isDone()) {
            return report;
        }

        FailureReason reason = outcome.getReason();
        String message = "Seeding failed at " + reason.getStep() + ": " + outcome.getFailure().getMessage();
        if (reason.isRetryable()) {
            throw ApplicationFailure.newFailure(message, reason.name(), report);
        }
        throw ApplicationFailure.newNonRetryableFailure(message, reason.name(), report);
    }
}
