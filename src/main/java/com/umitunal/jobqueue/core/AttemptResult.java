package com.umitunal.jobqueue.core;

import java.util.Objects;

/**
 * Outcome of one attempt of a {@link DurableOperation}.
 */
public final class AttemptResult {

    public enum Outcome {
        SUCCESS,
        FAILURE,            // Retried if the job type deems the error retryable and retries remain
        PERMANENT_FAILURE,
        OBSOLETE
    }

    private static final AttemptResult SUCCESS = new AttemptResult(Outcome.SUCCESS, null, null);

    private final Outcome outcome;
    private final Throwable error;
    private final String message;

    private AttemptResult(Outcome outcome, Throwable error, String message) {
        this.outcome = outcome;
        this.error = error;
        this.message = message;
    }

    public Outcome getOutcome() { return outcome; }
    public Throwable getError() { return error; }

    public String getMessage() {
        if (message != null) {
            return message;
        }
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    public static AttemptResult success() {
        return SUCCESS;
    }

    public static AttemptResult failure(Throwable error) {
        return new AttemptResult(Outcome.FAILURE, Objects.requireNonNull(error, "error"), null);
    }

    public static AttemptResult permanentFailure(Throwable error) {
        return new AttemptResult(Outcome.PERMANENT_FAILURE, Objects.requireNonNull(error, "error"), null);
    }

    public static AttemptResult obsolete(String reason) {
        return new AttemptResult(Outcome.OBSOLETE, null, reason);
    }

    /**
     * Map an exception thrown by an attempt onto an outcome.
     */
    public static AttemptResult fromException(Throwable error) {
        if (error instanceof ObsoleteJobException) {
            return obsolete(error.getMessage());
        }
        if (error instanceof PermanentJobFailureException) {
            return permanentFailure(error);
        }
        return failure(error);
    }

    @Override
    public String toString() {
        return message == null && error == null
                ? "AttemptResult{" + outcome + "}"
                : "AttemptResult{" + outcome + ", " + getMessage() + "}";
    }
}
