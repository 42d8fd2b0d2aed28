package com.umitunal.jobqueue.core;

import com.umitunal.jobqueue.config.BackoffPolicy;
import com.umitunal.jobqueue.model.JobRecord;
import com.umitunal.jobqueue.serialization.PayloadCodec;
import com.umitunal.jobqueue.storage.JobStorageException;
import com.umitunal.jobqueue.storage.WriteTransaction;

import java.time.Duration;

/**
 * Contract between the queue and one kind of job. Each label has exactly
 * one job type; the label partitions both the stored records and the
 * queues.
 *
 * @param <T> the payload type stored in this job type's records
 */
public interface JobType<T> {

    String getLabel();

    PayloadCodec<T> getCodec();

    /**
     * Build the operation for a claimed record.
     *
     * @throws PermanentJobFailureException if the record can never run
     * @throws ObsoleteJobException if the record is no longer relevant
     */
    DurableOperation<T> buildOperation(JobRecord record, T payload);

    /**
     * Retryable failures a record may accumulate before it is marked
     * permanently failed; the queue allows this many retries after the
     * first attempt. Failures from earlier process lifetimes count.
     * Default: unbounded.
     */
    default long getMaxRetries() {
        return Long.MAX_VALUE;
    }

    /**
     * Operations of this type are retried right away when connectivity returns.
     */
    default boolean requiresInternet() {
        return false;
    }

    /**
     * Upper bound on operations of this type in flight at once. Use 1 for
     * strictly ordered execution. Default: unbounded.
     */
    default int getMaxConcurrentOperations() {
        return Integer.MAX_VALUE;
    }

    /**
     * Whether a failure should consume a retry (true) or fail the record
     * immediately (false). Overrides the remaining retry count.
     */
    default boolean isRetryable(Throwable error) {
        return !(error instanceof JobException);
    }

    default Duration getRetryInterval(long failureCount) {
        return BackoffPolicy.exponential().retryInterval(failureCount);
    }

    /**
     * Called for every record found {@code RUNNING} on startup, in the same
     * transaction that resets it to {@code READY}. If the hook throws, the
     * reset and the hook's own writes are rolled back and the record is
     * marked permanently failed.
     */
    default void didMarkAsReady(JobRecord oldRecord, WriteTransaction tx) throws JobStorageException {
    }

    /**
     * A disabled job type never runs, recovers or prunes anything.
     */
    default boolean isEnabled() {
        return true;
    }
}
