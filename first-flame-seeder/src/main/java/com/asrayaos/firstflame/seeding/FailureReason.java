package com.asrayaos.firstflame.seeding;

/**
 * Why a seeding run ended in {@link SeedingState#FAILED}.
 */
public enum FailureReason {
    /**
     * The user id is not a UUID; no remote call was made.
     */
    INVALID_USER("invalid_user", false),

    /**
     * The quest upsert was rejected or returned no usable row.
     */
    REGISTRY("registry", true),

    /**
     * A participant or progress write was rejected.
     */
    STATE_WRITE("state_write", true),

    /**
     * The day definition could not be fetched.
     */
    CONTENT_MISSING("content", true),

    /**
     * The day definition was fetched but is not a usable document.
     */
    CONTENT_MALFORMED("content", false);

    private final String step;
    private final boolean retryable;

    FailureReason(String step, boolean retryable) {
        this.step = step;
        this.retryable = retryable;
    }

    /**
     * The step label reported to clients, e.g. {@code content} for both content failures.
     */
    public String getStep() {
        return step;
    }

    /**
     * Whether re-invoking the whole run may succeed without outside intervention.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
