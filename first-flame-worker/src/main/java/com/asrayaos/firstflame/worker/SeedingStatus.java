package com.asrayaos.firstflame.worker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Current phase of a seeding workflow, returned by its query method.
 */
public class SeedingStatus {
    public static final String RUNNING = "RUNNING";
    public static final String DONE = "DONE";
    public static final String FAILED = "FAILED";

    private final String userId;
    private final String phase;
    private final String failureReason;
    private final long lastUpdated;

    @JsonCreator
    public SeedingStatus(@JsonProperty("userId") String userId,
                         @JsonProperty("phase") String phase,
                         @JsonProperty("failureReason") String failureReason,
                         @JsonProperty("lastUpdated") long lastUpdated) {
        this.userId = userId;
        this.phase = phase;
        this.failureReason = failureReason;
        this.lastUpdated = lastUpdated;
    }

    @JsonProperty("userId")
    public String getUserId() {
        return userId;
    }

    @JsonProperty("phase")
    public String getPhase() {
        return phase;
    }

    @JsonProperty("failureReason")
    public String getFailureReason() {
        return failureReason;
    }

    @JsonProperty("lastUpdated")
    public long getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "SeedingStatus{" +
                "userId='" + userId + '\'' +
                ", phase='" + phase + '\'' +
                ", failureReason='" + failureReason + '\'' +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
