package com.asrayaos.firstflame.participant;

import com.asrayaos.firstflame.seeding.StepResult;

/**
 * Ensures a user's membership and progress rows exist for a quest.
 * Implementations are idempotent: any number of calls converges to the same rows.
 */
public interface ParticipantSeeder {

    /**
     * @param questId the id returned by the quest registry
     * @param userId  the user being seeded
     * @return success, or a {@link com.asrayaos.firstflame.seeding.FailureReason#STATE_WRITE} failure
     */
    StepResult<Void> seed(String questId, String userId);
}
