package com.asrayaos.firstflame.quest;

import com.asrayaos.firstflame.model.Quest;
import com.asrayaos.firstflame.seeding.FailureReason;
import com.asrayaos.firstflame.seeding.StepResult;
import com.asrayaos.firstflame.supabase.SupabaseException;
import com.asrayaos.firstflame.support.InMemoryRitualStore;
import com.asrayaos.firstflame.support.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuestRegistryTest {

    private InMemoryRitualStore store;
    private QuestRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryRitualStore();
        registry = new QuestRegistry(store, TestConfigs.defaults());
    }

    @Test
    void testCreatesQuestWithConfiguredAttributes() {
        StepResult<String> result = registry.ensureQuest();

        assertTrue(result.isSuccess());
        Quest quest = store.quest("first-flame-ritual");
        assertNotNull(quest, "Quest row should exist after the first call");
        assertEquals(result.getValue(), quest.getId());
        assertEquals("First Flame Ritual", quest.getTitle());
        assertEquals("ritual", quest.getType());
        assertEquals("first_flame", quest.getRealm());
        assertTrue(quest.isPinned());
    }

    @Test
    void testRepeatedCallsResolveTheSameId() {
        String first = registry.ensureQuest().getValue();
        String second = registry.ensureQuest().getValue();
        String third = new QuestRegistry(store, TestConfigs.defaults()).ensureQuest().getValue();

        assertEquals(first, second);
        assertEquals(first, third);
        assertEquals(1, store.quests().size(), "Only one quest row per slug");
    }

    @Test
    void testStoreErrorIsARegistryFailure() {
        store.failOn(InMemoryRitualStore.QUEST, new SupabaseException("upsert quests returned HTTP 503", 503, ""));

        StepResult<String> result = registry.ensureQuest();

        assertFalse(result.isSuccess());
        assertEquals(FailureReason.REGISTRY, result.getReason());
        assertTrue(result.getMessage().contains("first-flame-ritual"));
        assertTrue(store.quests().isEmpty());
    }

    @Test
    void testEmptyResponseIsARegistryFailure() {
        QuestRegistry registryOverEmptyStore = new QuestRegistry(new InMemoryRitualStore() {
            @Override
            public synchronized Quest upsertQuest(Quest quest) {
                return null;
            }
        }, TestConfigs.defaults());

        StepResult<String> result = registryOverEmptyStore.ensureQuest();

        assertEquals(FailureReason.REGISTRY, result.getReason());
    }

    @Test
    void testRowForAnotherSlugIsRejected() {
        QuestRegistry registryOverWrongStore = new QuestRegistry(new InMemoryRitualStore() {
            @Override
            public synchronized Quest upsertQuest(Quest quest) {
                return new Quest("4d3c2b1a-0000-4000-8000-000000000000", "other-quest", "Other", "ritual", "x", false);
            }
        }, TestConfigs.defaults());

        StepResult<String> result = registryOverWrongStore.ensureQuest();

        assertEquals(FailureReason.REGISTRY, result.getReason());
        assertTrue(result.getMessage().contains("other-quest"));
    }

    @Test
    void testRowWithoutIdIsRejected() {
        QuestRegistry registryWithoutId = new QuestRegistry(new InMemoryRitualStore() {
            @Override
            public synchronized Quest upsertQuest(Quest quest) {
                return quest;
            }
        }, TestConfigs.defaults());

        assertEquals(FailureReason.REGISTRY, registryWithoutId.ensureQuest().getReason());
    }

    @Test
    void testCustomSlug() {
        QuestRegistry staging = new QuestRegistry(store,
            TestConfigs.builder().setQuestSlug("first-flame-staging").build());

        String id = staging.ensureQuest().getValue();

        assertEquals("first-flame-staging", staging.getSlug());
        assertEquals(id, store.quest("first-flame-staging").getId());
    }
}
