package com.asrayaos.firstflame.participant;

import com.asrayaos.firstflame.model.ParticipantState;
import com.asrayaos.firstflame.seeding.FailureReason;
import com.asrayaos.firstflame.seeding.StepResult;
import com.asrayaos.firstflame.supabase.RitualStore;
import com.asrayaos.firstflame.supabase.SupabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seeds participant state with two client-side upserts keyed by {@code (quest_id, user_id)}.
 *
 * <p>Existing progress is left alone unless {@code resetProgress} is set, so a repair run
 * never moves a user who already advanced back to day 1.
 */
public class UpsertParticipantSeeder implements ParticipantSeeder {
    private static final Logger logger = LoggerFactory.getLogger(UpsertParticipantSeeder.class);

    private final RitualStore store;
    private final boolean resetProgress;

    public UpsertParticipantSeeder(RitualStore store, boolean resetProgress) {
        this.store = store;
        this.resetProgress = resetProgress;
    }

    @Override
    public StepResult<Void> seed(String questId, String userId) {
        StepResult<Void> participant = ensureParticipant(questId, userId);
        if (!participant.isSuccess()) {
            return participant;
        }
        return ensureProgress(questId, userId);
    }

    /**
     * Inserts the membership row if it is missing.
     *
     * @param questId the quest id
     * @param userId  the user id
     * @return success or a state write failure
     */
    public StepResult<Void> ensureParticipant(String questId, String userId) {
        try {
            store.upsertParticipant(ParticipantState.seed(questId, userId));
            logger.debug("Participant row ensured for user {} in quest {}", userId, questId);
            return StepResult.success(null);
        } catch (SupabaseException e) {
            logger.warn("Participant upsert rejected for user {}: {}", userId, e.getMessage());
            return StepResult.failure(FailureReason.STATE_WRITE,
                "Participant upsert failed: " + e.getMessage(), e);
        }
    }

    /**
     * Inserts the day-1 progress row if it is missing, or resets it when configured to.
     *
     * @param questId the quest id
     * @param userId  the user id
     * @return success or a state write failure
     */
    public StepResult<Void> ensureProgress(String questId, String userId) {
        try {
            store.upsertProgress(ParticipantState.seed(questId, userId), resetProgress);
            logger.debug("Progress row ensured for user {} in quest {} (reset={})", userId, questId, resetProgress);
            return StepResult.success(null);
        } catch (SupabaseException e) {
            logger.warn("Progress upsert rejected for user {}: {}", userId, e.getMessage());
            return StepResult.failure(FailureReason.STATE_WRITE,
                "Progress upsert failed: " + e.getMessage(), e);
        }
    }
}
