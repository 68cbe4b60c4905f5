package com.asrayaos.firstflame.model;

import java.util.Objects;

/**
 * Membership and progress of one user in one quest, keyed by {@code (questId, userId)}.
 */
public class ParticipantState {
    public static final String ROLE_PARTICIPANT = "participant";
    public static final int FIRST_DAY = 1;

    private final String questId;
    private final String userId;
    private final String role;
    private final int currentDayTarget;
    private final boolean questComplete;

    public ParticipantState(String questId, String userId, String role, int currentDayTarget, boolean questComplete) {
        if (currentDayTarget < FIRST_DAY) {
            throw new IllegalArgumentException("currentDayTarget must be >= 1, got " + currentDayTarget);
        }
        this.questId = Objects.requireNonNull(questId, "questId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.role = role;
        this.currentDayTarget = currentDayTarget;
        this.questComplete = questComplete;
    }

    /**
     * The state a user starts the ritual with: day 1, not complete.
     */
    public static ParticipantState seed(String questId, String userId) {
        return new ParticipantState(questId, userId, ROLE_PARTICIPANT, FIRST_DAY, false);
    }

    public String getQuestId() {
        return questId;
    }

    public String getUserId() {
        return userId;
    }

    public String getRole() {
        return role;
    }

    public int getCurrentDayTarget() {
        return currentDayTarget;
    }

    public boolean isQuestComplete() {
        return questComplete;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParticipantState)) {
            return false;
        }
        ParticipantState that = (ParticipantState) o;
        return currentDayTarget == that.currentDayTarget
                && questComplete == that.questComplete
                && questId.equals(that.questId)
                && userId.equals(that.userId)
                && Objects.equals(role, that.role);
    }

    @Override
    public int hashCode() {
        return Objects.hash(questId, userId, role, currentDayTarget, questComplete);
    }

    @Override
    public String toString() {
        return "ParticipantState{" +
                "questId='" + questId + '\'' +
                ", userId='" + userId + '\'' +
                ", role='" + role + '\'' +
                ", currentDayTarget=" + currentDayTarget +
                ", questComplete=" + questComplete +
                '}';
    }
}
