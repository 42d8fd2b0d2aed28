package com.umitunal.jobqueue.queue;

import com.umitunal.jobqueue.config.ProcessIdentity;
import com.umitunal.jobqueue.core.DurableOperation;
import com.umitunal.jobqueue.core.JobType;
import com.umitunal.jobqueue.core.ObsoleteJobException;
import com.umitunal.jobqueue.core.PermanentJobFailureException;
import com.umitunal.jobqueue.core.QueueMetrics;
import com.umitunal.jobqueue.model.JobRecord;
import com.umitunal.jobqueue.model.JobStatus;
import com.umitunal.jobqueue.reachability.ReachabilitySignal;
import com.umitunal.jobqueue.serialization.PayloadCodecException;
import com.umitunal.jobqueue.storage.JobDatabase;
import com.umitunal.jobqueue.storage.JobRecordStore;
import com.umitunal.jobqueue.storage.JobStorageException;
import com.umitunal.jobqueue.storage.WriteTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Durable work queue for one job type.
 *
 * Callers insert records inside their own write transaction with
 * {@link #add}. Once the transaction commits, the queue's trigger thread
 * claims ready records one transaction at a time (lowest id first), turns
 * each into a {@link DurableOperation} and hands it to a worker pool sized
 * by the job type. Outcomes are written back in fresh transactions and
 * each one triggers the next claim, so the queue drains without polling.
 *
 * A record is claimed by flipping it to {@code RUNNING} in the same
 * transaction that selected it, so no two operations ever hold one record.
 * Records stranded in {@code RUNNING} by a crash are reset by
 * {@link #restartOldJobs()} during {@link #setup()}. There is no timeout
 * on in-flight operations: a stuck operation's record is only recovered by
 * a restart.
 *
 * @param <T> the job type's payload
 */
public class DurableJobQueue<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DurableJobQueue.class);

    private final JobType<T> jobType;
    private final String label;
    private final JobDatabase database;
    private final JobRecordStore store;
    private final ProcessIdentity processIdentity;
    private final AppReadiness appReadiness;
    private final ReachabilitySignal reachabilitySignal;

    private final ExecutorService operationPool;
    private final RunningOperations<T> runningOperations = new RunningOperations<>();
    private final WorkTrigger trigger;

    private final AtomicBoolean setupStarted = new AtomicBoolean(false);
    private final AtomicBoolean isSetup = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ReachabilitySignal.Subscription reachabilitySubscription;

    private DurableJobQueue(Builder<T> builder) {
        this.jobType = builder.jobType;
        this.label = builder.jobType.getLabel();
        this.database = builder.database;
        this.processIdentity = builder.processIdentity;
        this.store = builder.store != null ? builder.store : new JobRecordStore(builder.processIdentity);
        this.appReadiness = builder.appReadiness;
        this.reachabilitySignal = builder.reachabilitySignal;
        this.operationPool = createOperationPool(label, jobType.getMaxConcurrentOperations());
        this.trigger = new WorkTrigger("job-queue-" + label, this::workStep);
    }

    /**
     * Insert a record any process sharing the store may run. Work starts
     * after {@code tx} commits; failures of the work never surface here.
     */
    public JobRecord add(T payload, WriteTransaction tx) throws JobStorageException {
        return insert(payload, null, tx);
    }

    /**
     * Insert a record only the current process may run.
     */
    public JobRecord addExclusive(T payload, WriteTransaction tx) throws JobStorageException {
        return insert(payload, processIdentity.getIdentifier(), tx);
    }

    private JobRecord insert(T payload, String exclusiveProcessIdentifier, WriteTransaction tx)
            throws JobStorageException {
        byte[] bytes = jobType.getCodec().encode(payload);
        JobRecord record = store.insert(label, bytes, exclusiveProcessIdentifier, tx);
        tx.addAsyncCompletion(this::startWorkWhenAppIsReady);
        return record;
    }

    /**
     * Recover orphaned records, prune stale ones, subscribe to reachability
     * and start draining. Work requested before this completes is deferred
     * until it does.
     */
    public CompletableFuture<Void> setup() {
        if (!jobType.isEnabled()) {
            log.info("Job queue {} is disabled", label);
            return CompletableFuture.completedFuture(null);
        }
        if (!setupStarted.compareAndSet(false, true)) {
            log.error("Job queue {} is already set up", label);
            return CompletableFuture.completedFuture(null);
        }

        trigger.start();

        Executor setupThread = task -> {
            Thread thread = new Thread(task, "job-queue-setup-" + label);
            thread.setDaemon(true);
            thread.start();
        };

        return CompletableFuture.runAsync(() -> {
            restartOldJobs();
            pruneStaleJobs();
        }, setupThread).thenRun(() -> {
            if (jobType.requiresInternet()) {
                subscribeToReachability();
            }
            isSetup.set(true);
            log.info("Job queue {} is set up", label);
            startWorkWhenAppIsReady();
        });
    }

    /**
     * Reset every record of this label left {@code RUNNING} by a previous
     * process lifetime to {@code READY}. Only the main process does this.
     *
     * @return number of records reset
     */
    public int restartOldJobs() {
        if (!processIdentity.isMainProcess() || !jobType.isEnabled()) {
            return 0;
        }

        List<JobRecord> runningRecords;
        try {
            runningRecords = database.read(tx -> store.all(label, JobStatus.RUNNING, tx));
        } catch (JobStorageException e) {
            log.error("Couldn't restart old {} jobs", label, e);
            return 0;
        }

        int restarted = 0;
        for (JobRecord record : runningRecords) {
            if (runningOperations.contains(record.getId())) {
                continue;
            }
            if (restart(record)) {
                restarted++;
            }
        }
        log.info("Marked {} old running {} job record(s) as ready", restarted, label);
        return restarted;
    }

    /**
     * Reset one record and run the job type's hook in the same transaction,
     * so a failing hook leaves none of its writes behind.
     */
    private boolean restart(JobRecord record) {
        try {
            database.write(tx -> {
                JobRecord ready = store.markReady(record, tx);
                jobType.didMarkAsReady(ready, tx);
                return null;
            });
            return true;
        } catch (JobStorageException e) {
            log.error("Couldn't mark old running {} job {} as ready", label, record.getId(), e);
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to mark old running {} job {} as ready", label, record.getId(), e);
            markFailedAfterRestart(record, "Restart failed: " + e.getMessage());
            return false;
        }
    }

    private void markFailedAfterRestart(JobRecord record, String reason) {
        try {
            database.write(tx -> {
                JobRecord current = store.find(record.getId(), tx);
                if (current != null && current.getStatus() == JobStatus.RUNNING) {
                    store.markPermanentlyFailed(current, reason, tx);
                }
                return null;
            });
        } catch (JobStorageException e) {
            log.error("Couldn't mark {} job {} as permanently failed", label, record.getId(), e);
        }
    }

    /**
     * Delete records of this label that will never run here. Only the main
     * process does this.
     *
     * @return number of records deleted
     */
    public int pruneStaleJobs() {
        if (!processIdentity.isMainProcess() || !jobType.isEnabled()) {
            return 0;
        }

        try {
            return database.write(tx -> {
                List<JobRecord> staleRecords = store.staleRecords(label, tx);
                for (JobRecord record : staleRecords) {
                    store.remove(record, tx);
                }
                log.info("Pruned {} stale {} job record(s)", staleRecords.size(), label);
                return staleRecords.size();
            });
        } catch (JobStorageException e) {
            log.error("Failed to prune stale {} jobs", label, e);
            return 0;
        }
    }

    /**
     * Ask the trigger thread to drain once the process is ready. A request
     * made before setup finishes is picked up when it does.
     */
    public void startWorkWhenAppIsReady() {
        if (!jobType.isEnabled() || closed.get()) {
            return;
        }
        appReadiness.runNowOrWhenReady(() -> {
            if (isSetup.get()) {
                trigger.signal();
            } else {
                log.debug("Job queue {} not set up yet, deferring work", label);
            }
        });
    }

    /**
     * Claim and dispatch at most one record in its own transaction.
     *
     * @return true if a record was claimed
     */
    boolean workStep() {
        if (!isSetup.get() || closed.get()) {
            return false;
        }
        try {
            return database.write(this::claimNext);
        } catch (JobStorageException e) {
            log.error("Couldn't start next {} job", label, e);
            return false;
        }
    }

    private boolean claimNext(WriteTransaction tx) throws JobStorageException {
        JobRecord next = store.nextReady(label, tx);
        if (next == null) {
            return false;
        }

        JobRecord claimed = store.markRunning(next, tx);

        DurableOperation<T> operation;
        try {
            T payload = jobType.getCodec().decode(claimed.getPayload());
            operation = Objects.requireNonNull(jobType.buildOperation(claimed, payload), "buildOperation returned null");
        } catch (PermanentJobFailureException | PayloadCodecException e) {
            log.error("Permanent failure building {} job {}: {}", label, claimed.getId(), e.getMessage());
            store.markPermanentlyFailed(claimed, e.getMessage(), tx);
            return true;
        } catch (ObsoleteJobException e) {
            log.info("Marking obsolete {} job {}: {}", label, claimed.getId(), e.getMessage());
            store.markObsolete(claimed, e.getMessage(), tx);
            return true;
        } catch (RuntimeException e) {
            log.error("Unexpected error building {} job {}", label, claimed.getId(), e);
            store.markPermanentlyFailed(claimed, String.valueOf(e.getMessage()), tx);
            return true;
        }

        long remainingRetries = remainingRetries(jobType.getMaxRetries(), claimed.getFailureCount());
        OperationRunner<T> runner = new OperationRunner<>(this, operation, claimed, remainingRetries);
        tx.addSyncCompletion(() -> dispatch(runner));
        return true;
    }

    private void dispatch(OperationRunner<T> runner) {
        if (!runningOperations.add(runner)) {
            log.error("{} job {} already has an operation in flight", label, runner.getRecordId());
            return;
        }
        log.debug("Adding operation {} with remainingRetries {}", runner.getOperation(), runner.getRemainingRetries());
        try {
            operationPool.execute(runner);
        } catch (RejectedExecutionException e) {
            runningOperations.remove(runner);
            log.warn("Job queue {} is closed, job {} stays running until the next start", label, runner.getRecordId());
        }
    }

    static long remainingRetries(long maxRetries, long failureCount) {
        return Math.max(0, maxRetries - failureCount);
    }

    void operationSucceeded(OperationRunner<T> runner) {
        log.debug("{} job {} succeeded", label, runner.getRecordId());
        finish(runner, tx -> {
            store.remove(runner.getJobRecord(), tx);
            return null;
        });
    }

    /**
     * Persist one consumed retry. If the store cannot be written the retry is
     * counted in memory only and the operation keeps going.
     *
     * @return false if the record is gone or no longer running and the runner must stop
     */
    boolean operationReportedError(OperationRunner<T> runner, Throwable error) {
        try {
            JobRecord updated = database.write(tx -> store.addFailure(runner.getJobRecord(), describe(error), tx));
            runner.updateRecord(updated);
            return true;
        } catch (JobStorageException e) {
            log.error("Couldn't persist failure of {} job {}, retrying anyway", label, runner.getRecordId(), e);
            runner.getJobRecord().recordFailure(describe(error));
            return true;
        } catch (IllegalStateException e) {
            log.error("{} job {} changed underneath its operation, stopping", label, runner.getRecordId(), e);
            finish(runner, tx -> {
                JobRecord current = store.find(runner.getRecordId(), tx);
                if (current != null && current.getStatus() == JobStatus.RUNNING) {
                    store.markPermanentlyFailed(current, describe(error), tx);
                }
                return null;
            });
            return false;
        }
    }

    void operationFailed(OperationRunner<T> runner, Throwable error) {
        log.error("{} job {} permanently failed: {}", label, runner.getRecordId(), describe(error));
        finish(runner, tx -> store.markPermanentlyFailed(runner.getJobRecord(), describe(error), tx));
    }

    void operationObsolete(OperationRunner<T> runner, String reason) {
        log.info("{} job {} is obsolete: {}", label, runner.getRecordId(), reason);
        finish(runner, tx -> store.markObsolete(runner.getJobRecord(), reason, tx));
    }

    void operationCancelled(OperationRunner<T> runner) {
        runningOperations.remove(runner);
        log.info("{} job {} cancelled, left running until the next start", label, runner.getRecordId());
    }

    private void finish(OperationRunner<T> runner, JobDatabase.WriteBlock<?> block) {
        try {
            database.write(block);
        } catch (JobStorageException | IllegalStateException e) {
            log.error("Couldn't record outcome of {} job {}", label, runner.getRecordId(), e);
        } finally {
            runningOperations.remove(runner);
        }
        startWorkWhenAppIsReady();
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    private void subscribeToReachability() {
        if (reachabilitySignal == null) {
            log.warn("Job queue {} requires internet but has no reachability signal", label);
            return;
        }
        reachabilitySubscription = reachabilitySignal.subscribe(this::becameReachable);
    }

    /**
     * Retry every in-flight operation that is waiting out a backoff, right now.
     *
     * @return number of operations woken
     */
    public int becameReachable() {
        if (!jobType.requiresInternet()) {
            log.error("becameReachable called on {}, which does not require internet", label);
            return 0;
        }
        int woken = 0;
        for (OperationRunner<T> runner : runningOperations.snapshot()) {
            if (runner.runAnyQueuedRetry()) {
                woken++;
            }
        }
        log.debug("Network reachable, woke {} {} operation(s)", woken, label);
        return woken;
    }

    /**
     * Skip the backoff of the oldest in-flight operation, if it is waiting.
     *
     * @return the record id of that operation, or empty if nothing is in flight
     */
    public OptionalLong runAnyQueuedRetry() {
        OperationRunner<T> runner = runningOperations.first();
        if (runner == null) {
            return OptionalLong.empty();
        }
        runner.runAnyQueuedRetry();
        return OptionalLong.of(runner.getRecordId());
    }

    public QueueMetrics getMetrics() throws JobStorageException {
        Map<JobStatus, Long> counts = database.read(tx -> store.countByStatus(label, tx));
        return new QueueMetrics(
                label,
                counts.get(JobStatus.READY),
                counts.get(JobStatus.RUNNING),
                counts.get(JobStatus.PERMANENTLY_FAILED),
                counts.get(JobStatus.OBSOLETE),
                counts.get(JobStatus.UNKNOWN),
                runningOperations.size()
        );
    }

    public List<Long> getInFlightRecordIds() {
        return runningOperations.recordIds();
    }

    public String getLabel() {
        return label;
    }

    public JobType<T> getJobType() {
        return jobType;
    }

    public JobRecordStore getStore() {
        return store;
    }

    public boolean isSetup() {
        return isSetup.get();
    }

    /**
     * Stop claiming records and cancel in-flight operations cooperatively.
     * Their records stay {@code RUNNING} until the next main-process start.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ReachabilitySignal.Subscription subscription = reachabilitySubscription;
        if (subscription != null) {
            subscription.close();
        }
        trigger.stop();
        runningOperations.snapshot().forEach(OperationRunner::cancel);

        operationPool.shutdown();
        try {
            if (!operationPool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Job queue {} operations did not stop within 5s", label);
                operationPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            operationPool.shutdownNow();
        }
        log.info("Closed job queue {}", label);
    }

    private static ExecutorService createOperationPool(String label, int maxConcurrentOperations) {
        if (maxConcurrentOperations <= 0) {
            throw new IllegalArgumentException("maxConcurrentOperations must be positive: " + maxConcurrentOperations);
        }
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = r -> {
            Thread thread = new Thread(r, "job-" + label + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        if (maxConcurrentOperations == Integer.MAX_VALUE) {
            return Executors.newCachedThreadPool(threadFactory);
        }
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                maxConcurrentOperations, maxConcurrentOperations,
                60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory);
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    public static <T> Builder<T> builder(JobType<T> jobType, JobDatabase database) {
        return new Builder<>(jobType, database);
    }

    public static class Builder<T> {
        private final JobType<T> jobType;
        private final JobDatabase database;
        private ProcessIdentity processIdentity = ProcessIdentity.randomMainProcess();
        private AppReadiness appReadiness = AppReadiness.alreadyReady();
        private ReachabilitySignal reachabilitySignal;
        private JobRecordStore store;

        private Builder(JobType<T> jobType, JobDatabase database) {
            this.jobType = Objects.requireNonNull(jobType, "jobType");
            this.database = Objects.requireNonNull(database, "database");
        }

        /**
         * Default: a main process with a random identifier.
         */
        public Builder<T> withProcessIdentity(ProcessIdentity processIdentity) {
            this.processIdentity = Objects.requireNonNull(processIdentity, "processIdentity");
            return this;
        }

        /**
         * Default: already ready.
         */
        public Builder<T> withAppReadiness(AppReadiness appReadiness) {
            this.appReadiness = Objects.requireNonNull(appReadiness, "appReadiness");
            return this;
        }

        public Builder<T> withReachabilitySignal(ReachabilitySignal reachabilitySignal) {
            this.reachabilitySignal = reachabilitySignal;
            return this;
        }

        /**
         * Replace the record store. It must carry the same process identity.
         */
        Builder<T> withRecordStore(JobRecordStore store) {
            this.store = Objects.requireNonNull(store, "store");
            return this;
        }

        public DurableJobQueue<T> build() {
            return new DurableJobQueue<>(this);
        }
    }
}
