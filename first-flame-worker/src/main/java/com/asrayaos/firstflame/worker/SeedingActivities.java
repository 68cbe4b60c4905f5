package com.asrayaos.firstflame.worker;

import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

/**
 * Activity interface wrapping one seeding run.
 */
@ActivityInterface
public interface SeedingActivities {

    /**
     * Runs the seeding sequence once.
     *
     * @param userId the user to seed
     * @return the report of a successful run; failed runs raise an application failure
     *         whose type is the failure reason
     */
    @ActivityMethod
    SeedingReport runSeeding(String userId);
}
