package com.asrayaos.firstflame.worker;

import io.temporal.workflow.QueryMethod;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * Workflow that seeds a user's First-Flame ritual state and reports the outcome.
 */
@WorkflowInterface
public interface SeedFirstFlameWorkflow {

    /**
     * Runs seeding for a user, re-invoking the whole run a bounded number of times
     * on retryable failures.
     *
     * @param userId the user to seed
     * @return the final report; seeding failures are reported, not thrown
     */
    @WorkflowMethod
    SeedingReport seed(String userId);

    /**
     * Query method to get the current phase of the workflow.
     *
     * @return current seeding status
     */
    @QueryMethod
    SeedingStatus getStatus();
}
