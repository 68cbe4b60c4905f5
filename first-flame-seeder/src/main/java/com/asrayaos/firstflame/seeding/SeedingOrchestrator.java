package com.asrayaos.firstflame.seeding;

import com.asrayaos.firstflame.content.ContentValidator;
import com.asrayaos.firstflame.model.ContentDefinition;
import com.asrayaos.firstflame.notify.NotificationEvent;
import com.asrayaos.firstflame.notify.Notifier;
import com.asrayaos.firstflame.participant.ParticipantSeeder;
import com.asrayaos.firstflame.quest.QuestRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.regex.Pattern;

/**
 * Runs the First-Flame seeding sequence for one user:
 * quest, participant state, day-1 content, then a ready notification.
 *
 * <p>Each step is idempotent on its own, so a run that was interrupted, retried or raced by
 * another run for the same user converges to the same rows. The orchestrator holds no mutable
 * state between runs and does not retry; re-invoking a failed run is up to the caller.
 */
public class SeedingOrchestrator implements SeedingService {
    private static final Logger logger = LoggerFactory.getLogger(SeedingOrchestrator.class);

    static final String MDC_USER_ID = "userId";
    static final int SEED_DAY = 1;

    private static final Pattern UUID_PATTERN = Pattern.compile(
        "^[0-9a-f]{8}-[0-9a-f]{4}-[1-5][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$",
        Pattern.CASE_INSENSITIVE);

    private final QuestRegistry questRegistry;
    private final ParticipantSeeder participantSeeder;
    private final ContentValidator contentValidator;
    private final Notifier notifier;

    public SeedingOrchestrator(QuestRegistry questRegistry, ParticipantSeeder participantSeeder,
                               ContentValidator contentValidator, Notifier notifier) {
        this.questRegistry = questRegistry;
        this.participantSeeder = participantSeeder;
        this.contentValidator = contentValidator;
        this.notifier = notifier;
    }

    /**
     * Checks that a user id has the UUID shape the store expects.
     */
    public static boolean isValidUserId(String userId) {
        return userId != null && UUID_PATTERN.matcher(userId).matches();
    }

    @Override
    public SeedingOutcome runSeeding(String userId) {
        long startedAt = System.currentTimeMillis();
        MDC.put(MDC_USER_ID, String.valueOf(userId));
        try {
            if (!isValidUserId(userId)) {
                SeedingFailure failure = new SeedingFailure(FailureReason.INVALID_USER, SeedingState.START,
                    "User id is not a UUID: " + userId, null);
                logger.warn("Rejected seeding run: {}", failure.getMessage());
                return SeedingOutcome.failed(userId, failure, elapsedSince(startedAt));
            }

            logger.info("Seeding First-Flame state for user {}", userId);
            SeedingOutcome outcome = execute(userId, startedAt);
            if (outcome.isDone()) {
                logger.info("Seeding done for user {} (quest {}) in {} ms",
                    userId, outcome.getQuestId(), outcome.getElapsedMillis());
            } else {
                logger.warn("Seeding failed for user {} in state {} after {} ms: {}",
                    userId, outcome.getFailure().getFailedIn(), outcome.getElapsedMillis(),
                    outcome.getFailure().getMessage());
            }
            return outcome;
        } finally {
            MDC.remove(MDC_USER_ID);
        }
    }

    private SeedingOutcome execute(String userId, long startedAt) {
        SeedingState state = SeedingState.START;
        String questId = null;
        SeedingFailure failure = null;

        while (!state.isTerminal()) {
            try {
                switch (state) {
                    case START: {
                        StepResult<String> quest = questRegistry.ensureQuest();
                        if (quest.isSuccess()) {
                            questId = quest.getValue();
                            state = transition(state, SeedingState.QUEST_READY);
                        } else {
                            failure = quest.toFailure(state);
                            state = transition(state, SeedingState.FAILED);
                        }
                        break;
                    }
                    case QUEST_READY: {
                        StepResult<Void> seeded = participantSeeder.seed(questId, userId);
                        if (seeded.isSuccess()) {
                            state = transition(state, SeedingState.PARTICIPANT_READY);
                        } else {
                            failure = seeded.toFailure(state);
                            state = transition(state, SeedingState.FAILED);
                        }
                        break;
                    }
                    case PARTICIPANT_READY: {
                        // earlier writes stay committed whatever happens here
                        StepResult<ContentDefinition> content = contentValidator.loadAndValidate(SEED_DAY);
                        if (content.isSuccess()) {
                            state = transition(state, SeedingState.CONTENT_VALIDATED);
                        } else {
                            failure = content.toFailure(state);
                            state = transition(state, SeedingState.FAILED);
                        }
                        break;
                    }
                    case CONTENT_VALIDATED: {
                        notifier.notify(userId, NotificationEvent.READY, null);
                        state = transition(state, SeedingState.DONE);
                        break;
                    }
                    default:
                        throw new IllegalStateException("Unexpected seeding state: " + state);
                }
            } catch (RuntimeException e) {
                logger.error("Unexpected error in state {} for user {}", state, userId, e);
                failure = new SeedingFailure(reasonFor(state), state,
                    "Unexpected error: " + e, e);
                state = transition(state, SeedingState.FAILED);
            }
        }

        if (state == SeedingState.DONE) {
            return SeedingOutcome.done(userId, questId, elapsedSince(startedAt));
        }
        notifier.notify(userId, NotificationEvent.ERROR, failure.getReason().getStep() + ": " + failure.getMessage());
        return SeedingOutcome.failed(userId, failure, elapsedSince(startedAt));
    }

    /**
     * Failure reason for an unchecked exception raised by the step run in the given state.
     */
    static FailureReason reasonFor(SeedingState state) {
        switch (state) {
            case START:
                return FailureReason.REGISTRY;
            case QUEST_READY:
                return FailureReason.STATE_WRITE;
            case PARTICIPANT_READY:
                return FailureReason.CONTENT_MISSING;
            default:
                throw new IllegalStateException("No step runs in state " + state);
        }
    }

    private static SeedingState transition(SeedingState from, SeedingState to) {
        logger.debug("{} -> {}", from, to);
        return to;
    }

    private static long elapsedSince(long startedAt) {
        return System.currentTimeMillis() - startedAt;
    }
}
