package com.asrayaos.firstflame.seeding;

/**
 * Terminal result of one seeding run: {@link SeedingState#DONE} with the quest id, or
 * {@link SeedingState#FAILED} with the failure. There is no partial success.
 */
public class SeedingOutcome {
    private final String userId;
    private final SeedingState state;
    private final String questId;
    private final SeedingFailure failure;
    private final long elapsedMillis;

    private SeedingOutcome(String userId, SeedingState state, String questId, SeedingFailure failure,
                           long elapsedMillis) {
        this.userId = userId;
        this.state = state;
        this.questId = questId;
        this.failure = failure;
        this.elapsedMillis = elapsedMillis;
    }

    public static SeedingOutcome done(String userId, String questId, long elapsedMillis) {
        return new SeedingOutcome(userId, SeedingState.DONE, questId, null, elapsedMillis);
    }

    public static SeedingOutcome failed(String userId, SeedingFailure failure, long elapsedMillis) {
        return new SeedingOutcome(userId, SeedingState.FAILED, null, failure, elapsedMillis);
    }

    public String getUserId() {
        return userId;
    }

    public SeedingState getState() {
        return state;
    }

    public boolean isDone() {
        return state == SeedingState.DONE;
    }

    /**
     * @return the quest id, or {@code null} when the run failed
     */
    public String getQuestId() {
        return questId;
    }

    /**
     * @return the failure, or {@code null} when the run is done
     */
    public SeedingFailure getFailure() {
        return failure;
    }

    /**
     * @return the failure reason, or {@code null} when the run is done
     */
    public FailureReason getReason() {
        return failure == null ? null : failure.getReason();
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    @Override
    public String toString() {
        return "SeedingOutcome{" +
                "userId='" + userId + '\'' +
                ", state=" + state +
                ", questId='" + questId + '\'' +
                ", failure=" + failure +
                ", elapsedMillis=" + elapsedMillis +
                '}';
    }
}
