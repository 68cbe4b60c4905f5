package com.asrayaos.firstflame.worker;

import com.asrayaos.firstflame.seeding.SeedingOutcome;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a First-Flame seeding workflow, serializable through Temporal's payload converter.
 */
public class SeedingReport {
    /** Attempt or elapsed time that was not observed. */
    public static final int UNKNOWN = -1;

    private final String userId;
    private final boolean success;
    private final String questId;
    private final String failureReason;
    private final String failedStep;
    private final String message;
    private final int attempt;
    private final long elapsedMillis;

    @JsonCreator
    public SeedingReport(@JsonProperty("userId") String userId,
                         @JsonProperty("success") boolean success,
                         @JsonProperty("questId") String questId,
                         @JsonProperty("failureReason") String failureReason,
                         @JsonProperty("failedStep") String failedStep,
                         @JsonProperty("message") String message,
                         @JsonProperty("attempt") int attempt,
                         @JsonProperty("elapsedMillis") long elapsedMillis) {
        this.userId = userId;
        this.success = success;
        this.questId = questId;
        this.failureReason = failureReason;
        this.failedStep = failedStep;
        this.message = message;
        this.attempt = attempt;
        this.elapsedMillis = elapsedMillis;
    }

    /**
     * Converts a seeding outcome into a report.
     *
     * @param outcome the outcome of one run
     * @param attempt the activity attempt that produced it, starting at 1
     * @return the report
     */
    public static SeedingReport fromOutcome(SeedingOutcome outcome, int attempt) {
        if (outcome.isDone()) {
            return new SeedingReport(outcome.getUserId(), true, outcome.getQuestId(), null, null,
                "First-Flame state ready", attempt, outcome.getElapsedMillis());
        }
        return new SeedingReport(outcome.getUserId(), false, null, outcome.getReason().name(),
            outcome.getReason().getStep(), outcome.getFailure().getMessage(), attempt, outcome.getElapsedMillis());
    }

    /**
     * A failure that did not come from a seeding outcome, e.g. an activity timeout.
     * Attempt and elapsed time are {@link #UNKNOWN}.
     */
    public static SeedingReport failure(String userId, String failureReason, String message) {
        return new SeedingReport(userId, false, null, failureReason, null, message, UNKNOWN, UNKNOWN);
    }

    @JsonProperty("userId")
    public String getUserId() {
        return userId;
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return success;
    }

    @JsonProperty("questId")
    public String getQuestId() {
        return questId;
    }

    @JsonProperty("failureReason")
    public String getFailureReason() {
        return failureReason;
    }

    @JsonProperty("failedStep")
    public String getFailedStep() {
        return failedStep;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("attempt")
    public int getAttempt() {
        return attempt;
    }

    @JsonProperty("elapsedMillis")
    public long getElapsedMillis() {
        return elapsedMillis;
    }

    @Override
    public String toString() {
        return "SeedingReport{" +
                "userId='" + userId + '\'' +
                ", success=" + success +
                ", questId='" + questId + '\'' +
                ", failureReason='" + failureReason + '\'' +
                ", failedStep='" + failedStep + '\'' +
                ", message='" + message + '\'' +
                ", attempt=" + attempt +
                ", elapsedMillis=" + elapsedMillis +
                '}';
    }
}
