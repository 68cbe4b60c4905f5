package com.asrayaos.firstflame.participant;

import com.asrayaos.firstflame.seeding.FailureReason;
import com.asrayaos.firstflame.seeding.StepResult;
import com.asrayaos.firstflame.supabase.RitualStore;
import com.asrayaos.firstflame.supabase.SupabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seeds participant state with a single call to {@code ensure_first_flame}, which writes
 * membership and progress atomically on the server.
 */
public class RpcParticipantSeeder implements ParticipantSeeder {
    private static final Logger logger = LoggerFactory.getLogger(RpcParticipantSeeder.class);

    private final RitualStore store;

    public RpcParticipantSeeder(RitualStore store) {
        this.store = store;
    }

    @Override
    public StepResult<Void> seed(String questId, String userId) {
        try {
            String imprintId = store.ensureFirstFlame(questId, userId);
            logger.debug("ensure_first_flame for user {} returned imprint {}", userId, imprintId);
            return StepResult.success(null);
        } catch (SupabaseException e) {
            logger.warn("ensure_first_flame rejected for user {}: {}", userId, e.getMessage());
            return StepResult.failure(FailureReason.STATE_WRITE,
                "ensure_first_flame failed: " + e.getMessage(), e);
        }
    }
}
