package com.asrayaos.firstflame.quest;

import com.asrayaos.firstflame.config.SeedingConfig;
import com.asrayaos.firstflame.model.Quest;
import com.asrayaos.firstflame.seeding.FailureReason;
import com.asrayaos.firstflame.seeding.StepResult;
import com.asrayaos.firstflame.supabase.RitualStore;
import com.asrayaos.firstflame.supabase.SupabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes sure the singleton First-Flame quest exists and resolves its id.
 * One upsert on the slug per call, no retries.
 */
public class QuestRegistry {
    private static final Logger logger = LoggerFactory.getLogger(QuestRegistry.class);

    private final RitualStore store;
    private final Quest draft;

    public QuestRegistry(RitualStore store, SeedingConfig config) {
        this.store = store;
        this.draft = Quest.draft(
            config.getQuestSlug(),
            config.getQuestTitle(),
            config.getQuestType(),
            config.getQuestRealm(),
            config.isQuestPinned());
    }

    /**
     * Upserts the quest on its slug and returns the id of the row holding that slug.
     *
     * @return the quest id, or a {@link FailureReason#REGISTRY} failure
     */
    public StepResult<String> ensureQuest() {
        Quest stored;
        try {
            stored = store.upsertQuest(draft);
        } catch (SupabaseException e) {
            logger.warn("Quest upsert for slug '{}' rejected: {}", draft.getSlug(), e.getMessage());
            return StepResult.failure(FailureReason.REGISTRY,
                "Quest upsert for slug '" + draft.getSlug() + "' failed: " + e.getMessage(), e);
        }

        if (stored == null) {
            return StepResult.failure(FailureReason.REGISTRY,
                "Quest upsert for slug '" + draft.getSlug() + "' returned no row");
        }
        if (!draft.getSlug().equals(stored.getSlug())) {
            return StepResult.failure(FailureReason.REGISTRY,
                "Quest upsert returned a row for slug '" + stored.getSlug() + "', expected '" + draft.getSlug() + "'");
        }
        if (stored.getId() == null || stored.getId().isEmpty()) {
            return StepResult.failure(FailureReason.REGISTRY,
                "Quest row for slug '" + draft.getSlug() + "' has no id");
        }

        logger.debug("Quest '{}' resolved to id {}", stored.getSlug(), stored.getId());
        return StepResult.success(stored.getId());
    }

    public String getSlug() {
        return draft.getSlug();
    }
}
