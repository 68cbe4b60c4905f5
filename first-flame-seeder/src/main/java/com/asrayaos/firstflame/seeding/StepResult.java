package com.asrayaos.firstflame.seeding;

/**
 * Outcome of a single component call: a value, or a failure reason with context.
 *
 * @param <T> the value type
 */
public final class StepResult<T> {
    private final T value;
    private final FailureReason reason;
    private final String message;
    private final Throwable cause;

    private StepResult(T value, FailureReason reason, String message, Throwable cause) {
        this.value = value;
        this.reason = reason;
        this.message = message;
        this.cause = cause;
    }

    public static <T> StepResult<T> success(T value) {
        return new StepResult<>(value, null, null, null);
    }

    public static <T> StepResult<T> failure(FailureReason reason, String message) {
        return new StepResult<>(null, reason, message, null);
    }

    public static <T> StepResult<T> failure(FailureReason reason, String message, Throwable cause) {
        return new StepResult<>(null, reason, message, cause);
    }

    public boolean isSuccess() {
        return reason == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on a failed step: " + message);
        }
        return value;
    }

    public FailureReason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getCause() {
        return cause;
    }

    /**
     * Attaches the state the run was in when this step failed.
     */
    public SeedingFailure toFailure(SeedingState state) {
        if (isSuccess()) {
            throw new IllegalStateException("Step succeeded");
        }
        return new SeedingFailure(reason, state, message, cause);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "StepResult{success, value=" + value + '}'
                : "StepResult{failure, reason=" + reason + ", message='" + message + "'}";
    }
}
