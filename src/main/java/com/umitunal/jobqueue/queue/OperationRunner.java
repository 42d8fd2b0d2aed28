package com.umitunal.jobqueue.queue;

import com.umitunal.jobqueue.core.AttemptResult;
import com.umitunal.jobqueue.core.DurableOperation;
import com.umitunal.jobqueue.core.JobType;
import com.umitunal.jobqueue.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one claimed record's operation to a final outcome on a worker
 * thread: attempt, and on a retryable failure persist the consumed retry,
 * wait out the backoff, attempt again.
 *
 * The runner keeps its worker slot while backing off, so a job type
 * limited to one concurrent operation stays strictly ordered.
 */
final class OperationRunner<T> implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(OperationRunner.class);

    private final DurableJobQueue<T> queue;
    private final JobType<T> jobType;
    private final DurableOperation<T> operation;
    private final long recordId;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition retryCondition = lock.newCondition();
    private boolean waitingForRetry;
    private boolean retryRequested;

    private volatile JobRecord record;
    private volatile long remainingRetries;

    OperationRunner(DurableJobQueue<T> queue, DurableOperation<T> operation, JobRecord record,
                    long remainingRetries) {
        this.queue = queue;
        this.jobType = queue.getJobType();
        this.operation = operation;
        this.record = record;
        this.recordId = record.getId();
        this.remainingRetries = remainingRetries;
    }

    @Override
    public void run() {
        while (true) {
            if (operation.isCancelled()) {
                queue.operationCancelled(this);
                return;
            }

            AttemptResult result = attempt();

            if (operation.isCancelled() && result.getOutcome() != AttemptResult.Outcome.SUCCESS) {
                queue.operationCancelled(this);
                return;
            }

            switch (result.getOutcome()) {
                case SUCCESS -> {
                    queue.operationSucceeded(this);
                    return;
                }
                case OBSOLETE -> {
                    queue.operationObsolete(this, result.getMessage());
                    return;
                }
                case PERMANENT_FAILURE -> {
                    queue.operationFailed(this, result.getError());
                    return;
                }
                case FAILURE -> {
                    if (!retry(result.getError())) {
                        return;
                    }
                }
            }
        }
    }

    private AttemptResult attempt() {
        try {
            AttemptResult result = operation.perform();
            if (result == null) {
                return AttemptResult.failure(new IllegalStateException(operation + " returned no result"));
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            operation.cancel();
            return AttemptResult.failure(e);
        } catch (Exception e) {
            return AttemptResult.fromException(e);
        }
    }

    /**
     * @return true if another attempt should follow
     */
    private boolean retry(Throwable error) {
        if (!jobType.isRetryable(error)) {
            log.warn("{} job {} failed with non-retryable error: {}", record.getLabel(), recordId, error.toString());
            queue.operationFailed(this, error);
            return false;
        }
        if (remainingRetries <= 0) {
            log.warn("{} job {} failed, no retries remaining: {}", record.getLabel(), recordId, error.toString());
            queue.operationFailed(this, error);
            return false;
        }

        remainingRetries--;
        // Wake-ups that arrive while the failure is being persisted must not be lost
        enterBackoff();
        if (!queue.operationReportedError(this, error)) {
            leaveBackoff();
            return false;
        }

        Duration delay = jobType.getRetryInterval(record.getFailureCount());
        log.warn("{} job {} failed ({} retries left), retrying in {} ms: {}",
                record.getLabel(), recordId, remainingRetries, delay.toMillis(), error.toString());
        awaitRetry(delay);
        return true;
    }

    private void enterBackoff() {
        lock.lock();
        try {
            waitingForRetry = true;
            retryRequested = false;
        } finally {
            lock.unlock();
        }
    }

    private void leaveBackoff() {
        lock.lock();
        try {
            waitingForRetry = false;
            retryRequested = false;
        } finally {
            lock.unlock();
        }
    }

    private void awaitRetry(Duration delay) {
        lock.lock();
        try {
            long nanos = delay.toNanos();
            while (!retryRequested && !operation.isCancelled() && nanos > 0) {
                nanos = retryCondition.awaitNanos(nanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            operation.cancel();
        } finally {
            waitingForRetry = false;
            retryRequested = false;
            lock.unlock();
        }
    }

    /**
     * Skip the remainder of the current backoff, if any.
     *
     * @return true if the runner was backing off
     */
    boolean runAnyQueuedRetry() {
        lock.lock();
        try {
            if (!waitingForRetry) {
                return false;
            }
            retryRequested = true;
            retryCondition.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop after the current attempt. The record stays running in storage.
     */
    void cancel() {
        operation.cancel();
        lock.lock();
        try {
            retryCondition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void updateRecord(JobRecord updated) {
        this.record = updated;
    }

    long getRecordId() {
        return recordId;
    }

    JobRecord getJobRecord() {
        return record;
    }

    DurableOperation<T> getOperation() {
        return operation;
    }

    long getRemainingRetries() {
        return remainingRetries;
    }

    @Override
    public String toString() {
        return "OperationRunner{" + operation + ", remainingRetries=" + remainingRetries + "}";
    }
}
