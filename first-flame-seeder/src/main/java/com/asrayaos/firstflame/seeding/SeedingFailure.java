package com.asrayaos.firstflame.seeding;

import java.util.Objects;

/**
 * A classified step failure: which reason, in which state it happened, and the underlying cause.
 */
public class SeedingFailure {
    private final FailureReason reason;
    private final SeedingState failedIn;
    private final String message;
    private final Throwable cause;

    public SeedingFailure(FailureReason reason, SeedingState failedIn, String message, Throwable cause) {
        this.reason = Objects.requireNonNull(reason, "reason");
        this.failedIn = Objects.requireNonNull(failedIn, "failedIn");
        this.message = message;
        this.cause = cause;
    }

    public FailureReason getReason() {
        return reason;
    }

    public SeedingState getFailedIn() {
        return failedIn;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return the exception that caused the failure, or {@code null} for validation failures
     */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "SeedingFailure{" +
                "reason=" + reason +
                ", failedIn=" + failedIn +
                ", message='" + message + '\'' +
                '}';
    }
}
