package com.asrayaos.firstflame.seeding;

import com.asrayaos.firstflame.config.ParticipantMode;
import com.asrayaos.firstflame.config.SeedingConfig;
import com.asrayaos.firstflame.content.ContentValidator;
import com.asrayaos.firstflame.model.ParticipantState;
import com.asrayaos.firstflame.model.Quest;
import com.asrayaos.firstflame.notify.Notifier;
import com.asrayaos.firstflame.participant.ParticipantSeeders;
import com.asrayaos.firstflame.quest.QuestRegistry;
import com.asrayaos.firstflame.supabase.SupabaseException;
import com.asrayaos.firstflame.support.InMemoryContentStore;
import com.asrayaos.firstflame.support.InMemoryRitualStore;
import com.asrayaos.firstflame.support.RecordingBroadcastPublisher;
import com.asrayaos.firstflame.support.TestConfigs;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SeedingOrchestratorTest {

    private static final String DAY_1 = "5-day/day-1.json";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private List<String> calls;
    private InMemoryRitualStore store;
    private InMemoryContentStore content;
    private RecordingBroadcastPublisher publisher;

    @BeforeEach
    void setUp() {
        calls = Collections.synchronizedList(new ArrayList<>());
        store = new InMemoryRitualStore(calls);
        content = new InMemoryContentStore(calls).put(DAY_1, InMemoryContentStore.VALID_DAY_1);
        publisher = new RecordingBroadcastPublisher(calls);
    }

    private SeedingOrchestrator orchestrator(SeedingConfig config) {
        return new SeedingOrchestrator(
            new QuestRegistry(store, config),
            ParticipantSeeders.forConfig(config, store),
            new ContentValidator(content, objectMapper, config),
            new Notifier(publisher, objectMapper, config.getChannel()));
    }

    private SeedingOrchestrator orchestrator() {
        return orchestrator(TestConfigs.defaults());
    }

    @Test
    void testFreshUserIsSeeded() {
        SeedingOutcome outcome = orchestrator().runSeeding(TestConfigs.USER_1);

        assertTrue(outcome.isDone(), "Expected DONE but got " + outcome);
        assertEquals(SeedingState.DONE, outcome.getState());
        assertNull(outcome.getFailure());

        Quest quest = store.quest("first-flame-ritual");
        assertEquals(quest.getId(), outcome.getQuestId());
        assertEquals(ParticipantState.ROLE_PARTICIPANT, store.participantRole(quest.getId(), TestConfigs.USER_1));
        ParticipantState progress = store.progress(quest.getId(), TestConfigs.USER_1);
        assertEquals(1, progress.getCurrentDayTarget());
        assertFalse(progress.isQuestComplete());

        assertEquals(1, publisher.published().size());
        RecordingBroadcastPublisher.Published ready = publisher.published().get(0);
        assertEquals("flame_status", ready.getChannel());
        assertEquals("ready", ready.getEvent());
        assertEquals(TestConfigs.USER_1, ready.getPayload().path("user_id").asText());
    }

    @Test
    void testStepsRunInOrder() {
        orchestrator().runSeeding(TestConfigs.USER_1);

        assertEquals(Arrays.asList(
                InMemoryRitualStore.QUEST,
                InMemoryRitualStore.PARTICIPANT,
                InMemoryRitualStore.PROGRESS,
                "content:" + DAY_1,
                "notify:ready"),
            new ArrayList<>(calls));
    }

    @Test
    void testRepeatedRunsConverge() {
        SeedingOrchestrator orchestrator = orchestrator();
        SeedingOutcome first = orchestrator.runSeeding(TestConfigs.USER_1);
        SeedingOutcome second = orchestrator.runSeeding(TestConfigs.USER_1);
        SeedingOutcome third = orchestrator().runSeeding(TestConfigs.USER_1);

        assertTrue(first.isDone());
        assertTrue(second.isDone());
        assertTrue(third.isDone());
        assertEquals(first.getQuestId(), second.getQuestId());
        assertEquals(first.getQuestId(), third.getQuestId());
        assertEquals(1, store.quests().size());
        assertEquals(1, store.participantCount());
        assertEquals(1, store.progressCount());
        assertEquals(3, publisher.published().size(), "Each successful run announces readiness");
    }

    @Test
    void testConcurrentRunsConverge() throws Exception {
        SeedingOrchestrator orchestrator = orchestrator();
        int runs = 16;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SeedingOutcome>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < runs; i++) {
                String userId = i % 2 == 0 ? TestConfigs.USER_1 : TestConfigs.USER_2;
                futures.add(executor.submit(() -> {
                    start.await();
                    return orchestrator.runSeeding(userId);
                }));
            }
            start.countDown();

            String questId = null;
            for (Future<SeedingOutcome> future : futures) {
                SeedingOutcome outcome = future.get(10, TimeUnit.SECONDS);
                assertTrue(outcome.isDone(), "Concurrent run failed: " + outcome);
                if (questId == null) {
                    questId = outcome.getQuestId();
                }
                assertEquals(questId, outcome.getQuestId(), "All runs must resolve the same quest");
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, store.quests().size());
        assertEquals(2, store.participantCount());
        assertEquals(2, store.progressCount());
    }

    @Test
    void testRegistryFailureStopsTheRun() {
        store.failOn(InMemoryRitualStore.QUEST, new SupabaseException("upsert quests returned HTTP 503", 503, ""));

        SeedingOutcome outcome = orchestrator().runSeeding(TestConfigs.USER_1);

        assertFalse(outcome.isDone());
        assertEquals(SeedingState.FAILED, outcome.getState());
        assertEquals(FailureReason.REGISTRY, outcome.getReason());
        assertEquals(SeedingState.START, outcome.getFailure().getFailedIn());
        assertNull(outcome.getQuestId());
        assertEquals(Arrays.asList(InMemoryRitualStore.QUEST, "notify:error"), new ArrayList<>(calls));

        RecordingBroadcastPublisher.Published error = publisher.published().get(0);
        assertTrue(error.getPayload().path("detail").asText().startsWith("registry: "));
    }

    @Test
    void testStateWriteFailureSkipsContent() {
        store.failOn(InMemoryRitualStore.PROGRESS, new SupabaseException("upsert flame_progress returned HTTP 500", 500, "{}"));

        SeedingOutcome outcome = orchestrator().runSeeding(TestConfigs.USER_1);

        assertEquals(FailureReason.STATE_WRITE, outcome.getReason());
        assertEquals(SeedingState.QUEST_READY, outcome.getFailure().getFailedIn());
        assertEquals(0, content.fetchCount());
        assertEquals(1, store.participantCount(), "The participant write stays committed");
        assertEquals("error", publisher.published().get(0).getEvent());
    }

    @Test
    void testRerunAfterContentDeletedLeavesStateUnchanged() {
        SeedingOrchestrator orchestrator = orchestrator();
        SeedingOutcome first = orchestrator.runSeeding(TestConfigs.USER_1);
        assertTrue(first.isDone());
        String questId = first.getQuestId();
        Quest questBefore = store.quest("first-flame-ritual");
        String roleBefore = store.participantRole(questId, TestConfigs.USER_1);
        ParticipantState progressBefore = store.progress(questId, TestConfigs.USER_1);
        int publishedBefore = publisher.published().size();

        content.delete(DAY_1);
        SeedingOutcome rerun = orchestrator.runSeeding(TestConfigs.USER_1);

        assertEquals(FailureReason.CONTENT_MISSING, rerun.getReason());
        assertEquals("content", rerun.getReason().getStep());
        assertEquals(SeedingState.PARTICIPANT_READY, rerun.getFailure().getFailedIn());

        Quest questAfter = store.quest("first-flame-ritual");
        assertEquals(questBefore.getId(), questAfter.getId(), "Quest id must not change");
        assertEquals(questBefore.getTitle(), questAfter.getTitle());
        assertEquals(questBefore.isPinned(), questAfter.isPinned());
        assertEquals(1, store.quests().size());
        assertEquals(roleBefore, store.participantRole(questId, TestConfigs.USER_1));
        assertEquals(progressBefore, store.progress(questId, TestConfigs.USER_1),
            "Progress must be the row written by the successful run");
        assertEquals(1, store.participantCount());
        assertEquals(1, store.progressCount());

        assertEquals(publishedBefore + 1, publisher.published().size());
        RecordingBroadcastPublisher.Published last = publisher.published().get(publishedBefore);
        assertEquals("error", last.getEvent());
        assertEquals(TestConfigs.USER_1, last.getPayload().path("user_id").asText());
        assertTrue(last.getPayload().path("detail").asText().startsWith("content: "));
    }

    @Test
    void testUncheckedRegistryErrorBecomesFailedOutcome() {
        store = new InMemoryRitualStore(calls) {
            @Override
            public synchronized Quest upsertQuest(Quest quest) {
                throw new IllegalStateException("Connection pool shut down");
            }
        };

        SeedingOutcome outcome = orchestrator().runSeeding(TestConfigs.USER_1);

        assertEquals(SeedingState.FAILED, outcome.getState());
        assertEquals(FailureReason.REGISTRY, outcome.getReason());
        assertEquals(SeedingState.START, outcome.getFailure().getFailedIn());
        assertTrue(outcome.getFailure().getCause() instanceof IllegalStateException);
        assertTrue(outcome.getFailure().getMessage().contains("Connection pool shut down"));
        assertEquals(Arrays.asList("notify:error"), new ArrayList<>(calls));
        assertTrue(publisher.published().get(0).getPayload().path("detail").asText().startsWith("registry: "));
    }

    @Test
    void testUncheckedStateWriteErrorBecomesFailedOutcome() {
        store = new InMemoryRitualStore(calls) {
            @Override
            public synchronized void upsertProgress(ParticipantState state, boolean overwriteExisting) {
                throw new IllegalArgumentException("Unrecognized field \"current_day_target\"");
            }
        };

        SeedingOutcome outcome = orchestrator().runSeeding(TestConfigs.USER_1);

        assertEquals(FailureReason.STATE_WRITE, outcome.getReason());
        assertEquals(SeedingState.QUEST_READY, outcome.getFailure().getFailedIn());
        assertEquals(0, content.fetchCount());
        assertEquals("error", publisher.published().get(0).getEvent());
    }

    @Test
    void testUncheckedContentErrorBecomesFailedOutcome() {
        SeedingConfig config = TestConfigs.defaults();
        SeedingOrchestrator orchestrator = new SeedingOrchestrator(
            new QuestRegistry(store, config),
            ParticipantSeeders.forConfig(config, store),
            new ContentValidator(key -> {
                throw new IllegalStateException("Connection pool shut down");
            }, objectMapper, config),
            new Notifier(publisher, objectMapper, config.getChannel()));

        SeedingOutcome outcome = orchestrator.runSeeding(TestConfigs.USER_1);

        assertEquals(FailureReason.CONTENT_MISSING, outcome.getReason());
        assertEquals(SeedingState.PARTICIPANT_READY, outcome.getFailure().getFailedIn());
        assertEquals(1, store.progressCount(), "Writes before the failing step stay committed");
        assertEquals("error", publisher.published().get(0).getEvent());
    }

    @Test
    void testReasonForEachStepState() {
        assertEquals(FailureReason.REGISTRY, SeedingOrchestrator.reasonFor(SeedingState.START));
        assertEquals(FailureReason.STATE_WRITE, SeedingOrchestrator.reasonFor(SeedingState.QUEST_READY));
        assertEquals(FailureReason.CONTENT_MISSING, SeedingOrchestrator.reasonFor(SeedingState.PARTICIPANT_READY));
    }

    @Test
    void testMalformedContentIsNotRetryable() {
        content.put(DAY_1, "{\"prompts\": []}");

        SeedingOutcome outcome = orchestrator().runSeeding(TestConfigs.USER_1);

        assertEquals(FailureReason.CONTENT_MALFORMED, outcome.getReason());
        assertFalse(outcome.getReason().isRetryable());
    }

    @Test
    void testNotifierFailureDoesNotChangeOutcome() {
        publisher.failWith(new SupabaseException("rpc broadcast failed: Connection reset", new java.io.IOException()));

        SeedingOutcome outcome = orchestrator().runSeeding(TestConfigs.USER_1);

        assertTrue(outcome.isDone());
        assertTrue(calls.contains("notify:ready"), "Publish should have been attempted");
    }

    @Test
    void testNotifierFailureDoesNotMaskStepFailure() {
        publisher.failWith(new IllegalStateException("closed"));
        content.delete(DAY_1);

        SeedingOutcome outcome = orchestrator().runSeeding(TestConfigs.USER_1);

        assertEquals(FailureReason.CONTENT_MISSING, outcome.getReason());
    }

    @Test
    void testInvalidUserIdIsRejectedWithoutSideEffects() {
        SeedingOutcome outcome = orchestrator().runSeeding("not-a-uuid");

        assertEquals(FailureReason.INVALID_USER, outcome.getReason());
        assertEquals(SeedingState.START, outcome.getFailure().getFailedIn());
        assertTrue(calls.isEmpty(), "No store call and no notification for an invalid user");

        assertEquals(FailureReason.INVALID_USER, orchestrator().runSeeding(null).getReason());
        assertTrue(calls.isEmpty());
    }

    @Test
    void testUserIdValidation() {
        assertTrue(SeedingOrchestrator.isValidUserId(TestConfigs.USER_1));
        assertTrue(SeedingOrchestrator.isValidUserId(TestConfigs.USER_1.toUpperCase()));
        assertFalse(SeedingOrchestrator.isValidUserId(""));
        assertFalse(SeedingOrchestrator.isValidUserId("6f1c2e9a3b4d4c5e8f70112233445566"));
        assertFalse(SeedingOrchestrator.isValidUserId("6f1c2e9a-3b4d-4c5e-8f70-11223344556"));
    }

    @Test
    void testRepairRunDoesNotRegressProgress() {
        SeedingOrchestrator orchestrator = orchestrator();
        String questId = orchestrator.runSeeding(TestConfigs.USER_1).getQuestId();
        store.advance(questId, TestConfigs.USER_1, 4, false);

        assertTrue(orchestrator.runSeeding(TestConfigs.USER_1).isDone());

        assertEquals(4, store.progress(questId, TestConfigs.USER_1).getCurrentDayTarget());
    }

    @Test
    void testRpcModeSeedsWithOneCall() {
        SeedingOutcome outcome = orchestrator(TestConfigs.builder().setParticipantMode(ParticipantMode.RPC).build())
            .runSeeding(TestConfigs.USER_1);

        assertTrue(outcome.isDone());
        assertEquals(Arrays.asList(
                InMemoryRitualStore.QUEST,
                InMemoryRitualStore.RPC,
                "content:" + DAY_1,
                "notify:ready"),
            new ArrayList<>(calls));
        assertEquals(1, store.progress(outcome.getQuestId(), TestConfigs.USER_1).getCurrentDayTarget());
    }

    @Test
    void testUserIdIsRemovedFromMdcAfterRun() {
        orchestrator().runSeeding(TestConfigs.USER_1);

        assertNull(MDC.get(SeedingOrchestrator.MDC_USER_ID));
    }
}
