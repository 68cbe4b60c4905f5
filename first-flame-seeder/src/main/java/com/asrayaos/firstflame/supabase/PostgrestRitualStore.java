package com.asrayaos.firstflame.supabase;

import com.asrayaos.firstflame.model.ParticipantState;
import com.asrayaos.firstflame.model.Quest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * {@link RitualStore} backed by PostgREST upserts and RPCs.
 */
public class PostgrestRitualStore implements RitualStore {

    static final String QUESTS_TABLE = "quests";
    static final String PARTICIPANTS_TABLE = "quest_participants";
    static final String PROGRESS_TABLE = "flame_progress";
    static final String ENSURE_FIRST_FLAME_FN = "ensure_first_flame";

    private static final String QUEST_CONFLICT = "slug";
    private static final String PARTICIPANT_CONFLICT = "quest_id,user_id";

    private final SupabaseClient client;
    private final ObjectMapper objectMapper;

    public PostgrestRitualStore(SupabaseClient client) {
        this.client = client;
        this.objectMapper = client.getObjectMapper();
    }

    @Override
    public Quest upsertQuest(Quest quest) throws SupabaseException {
        ObjectNode payload = objectMapper.valueToTree(quest);
        payload.remove("id");

        JsonNode rows = client.upsert(QUESTS_TABLE, payload, QUEST_CONFLICT, Resolution.MERGE_DUPLICATES, true);
        JsonNode row = pickRow(rows, quest.getSlug());
        if (row == null) {
            return null;
        }
        try {
            return objectMapper.treeToValue(row, Quest.class);
        } catch (JsonProcessingException e) {
            throw new SupabaseException("Unexpected quest row: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void upsertParticipant(ParticipantState state) throws SupabaseException {
        ObjectNode payload = objectMapper.createObjectNode()
            .put("quest_id", state.getQuestId())
            .put("user_id", state.getUserId())
            .put("role", state.getRole());
        client.upsert(PARTICIPANTS_TABLE, payload, PARTICIPANT_CONFLICT, Resolution.IGNORE_DUPLICATES, false);
    }

    @Override
    public void upsertProgress(ParticipantState state, boolean overwriteExisting) throws SupabaseException {
        ObjectNode payload = objectMapper.createObjectNode()
            .put("quest_id", state.getQuestId())
            .put("user_id", state.getUserId())
            .put("current_day_target", state.getCurrentDayTarget())
            .put("is_quest_complete", state.isQuestComplete());
        Resolution resolution = overwriteExisting ? Resolution.MERGE_DUPLICATES : Resolution.IGNORE_DUPLICATES;
        client.upsert(PROGRESS_TABLE, payload, PARTICIPANT_CONFLICT, resolution, false);
    }

    @Override
    public String ensureFirstFlame(String questId, String userId) throws SupabaseException {
        ObjectNode args = objectMapper.createObjectNode()
            .put("_quest_id", questId)
            .put("_user_id", userId);
        JsonNode result = client.rpc(ENSURE_FIRST_FLAME_FN, args);
        if (result == null || result.isMissingNode() || result.isNull()) {
            return null;
        }
        return result.isTextual() ? result.textValue() : result.toString();
    }

    /**
     * PostgREST answers with an array; prefer the row that matches the slug we wrote.
     */
    private static JsonNode pickRow(JsonNode rows, String slug) {
        if (rows == null || rows.isMissingNode() || rows.isNull()) {
            return null;
        }
        if (rows.isObject()) {
            return rows;
        }
        if (!rows.isArray() || rows.isEmpty()) {
            return null;
        }
        for (JsonNode row : rows) {
            if (slug.equals(row.path("slug").asText(null))) {
                return row;
            }
        }
        return rows.get(0);
    }
}
