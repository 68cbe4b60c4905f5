package com.asrayaos.firstflame.supabase;

import com.asrayaos.firstflame.model.ParticipantState;
import com.asrayaos.firstflame.model.Quest;

/**
 * Write intents against the ritual tables. Every method is a single atomic round trip and
 * relies on the store's unique constraints for conflict resolution.
 */
public interface RitualStore {

    /**
     * Upserts a quest on its slug and returns the stored row.
     *
     * @param quest the quest to write; its id is ignored
     * @return the row the store holds for the slug, or {@code null} if it returned nothing
     * @throws SupabaseException if the write is rejected
     */
    Quest upsertQuest(Quest quest) throws SupabaseException;

    /**
     * Inserts the membership row keyed by {@code (questId, userId)} unless it already exists.
     *
     * @param state the participant; only the key and role are written
     * @throws SupabaseException if the write is rejected
     */
    void upsertParticipant(ParticipantState state) throws SupabaseException;

    /**
     * Writes the progress row keyed by {@code (questId, userId)}.
     *
     * @param state             the progress values to write
     * @param overwriteExisting whether an existing row is overwritten or left untouched
     * @throws SupabaseException if the write is rejected
     */
    void upsertProgress(ParticipantState state, boolean overwriteExisting) throws SupabaseException;

    /**
     * Calls the server-side procedure that seeds participant and progress in one transaction.
     *
     * @param questId the quest id
     * @param userId  the user id
     * @return the imprint id returned by the procedure
     * @throws SupabaseException if the procedure fails
     */
    String ensureFirstFlame(String questId, String userId) throws SupabaseException;
}
