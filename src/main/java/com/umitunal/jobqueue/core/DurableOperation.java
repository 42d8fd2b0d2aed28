package com.umitunal.jobqueue.core;

import com.umitunal.jobqueue.model.JobRecord;

import java.util.Objects;

/**
 * In-memory execution of a job record's work. Built by the job type when
 * the queue claims the record; never persisted, so a crash loses it and
 * the record is rebuilt into a fresh operation on restart.
 *
 * The queue calls {@link #perform()} once per attempt and retries
 * failures itself; implementations only describe a single attempt.
 *
 * @param <T> the decoded payload type
 */
public abstract class DurableOperation<T> {
    private final JobRecord jobRecord;
    private final T payload;
    private volatile boolean cancelled;

    protected DurableOperation(JobRecord jobRecord, T payload) {
        this.jobRecord = Objects.requireNonNull(jobRecord, "jobRecord");
        this.payload = payload;
    }

    /**
     * Perform the work once.
     *
     * Returning {@link AttemptResult#failure} or throwing any exception other
     * than a {@link JobException} reports a failure that the job type's
     * {@code isRetryable} classifier may turn into a retry.
     */
    public abstract AttemptResult perform() throws Exception;

    /**
     * Invoked once when the queue shuts down while this operation is in
     * flight. Long-running attempts should watch {@link #isCancelled()}.
     */
    protected void onCancel() {
    }

    public final void cancel() {
        if (!cancelled) {
            cancelled = true;
            onCancel();
        }
    }

    public final boolean isCancelled() {
        return cancelled;
    }

    public JobRecord getJobRecord() {
        return jobRecord;
    }

    public T getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{record=" + jobRecord.getId() + ", label='" + jobRecord.getLabel() + "'}";
    }

    /**
     * Single attempt expressed as a function of the payload.
     */
    @FunctionalInterface
    public interface Attempt<T> {
        AttemptResult perform(T payload) throws Exception;
    }

    public static <T> DurableOperation<T> of(JobRecord jobRecord, T payload, Attempt<T> attempt) {
        Objects.requireNonNull(attempt, "attempt");
        return new DurableOperation<>(jobRecord, payload) {
            @Override
            public AttemptResult perform() throws Exception {
                return attempt.perform(getPayload());
            }
        };
    }
}
