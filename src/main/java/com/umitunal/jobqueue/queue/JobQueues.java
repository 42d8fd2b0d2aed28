package com.umitunal.jobqueue.queue;

import com.umitunal.jobqueue.config.ProcessIdentity;
import com.umitunal.jobqueue.core.JobType;
import com.umitunal.jobqueue.reachability.ReachabilitySignal;
import com.umitunal.jobqueue.storage.JobDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Registry of the process's job queues, one per label, all sharing one
 * store, process identity, readiness gate and reachability signal.
 */
public class JobQueues implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobQueues.class);

    private final JobDatabase database;
    private final ProcessIdentity processIdentity;
    private final AppReadiness appReadiness;
    private final ReachabilitySignal reachabilitySignal;
    private final Map<String, DurableJobQueue<?>> queues = new LinkedHashMap<>();

    public JobQueues(JobDatabase database, ProcessIdentity processIdentity, AppReadiness appReadiness,
                     ReachabilitySignal reachabilitySignal) {
        this.database = database;
        this.processIdentity = processIdentity;
        this.appReadiness = appReadiness;
        this.reachabilitySignal = reachabilitySignal;
    }

    /**
     * @throws IllegalArgumentException if the label is already registered
     */
    public synchronized <T> DurableJobQueue<T> register(JobType<T> jobType) {
        String label = jobType.getLabel();
        if (queues.containsKey(label)) {
            throw new IllegalArgumentException("Job queue already registered for label: " + label);
        }
        DurableJobQueue<T> queue = DurableJobQueue.builder(jobType, database)
                .withProcessIdentity(processIdentity)
                .withAppReadiness(appReadiness)
                .withReachabilitySignal(reachabilitySignal)
                .build();
        queues.put(label, queue);
        log.debug("Registered job queue {}", label);
        return queue;
    }

    /**
     * @return the queue for {@code label}, or null if none is registered
     */
    public synchronized DurableJobQueue<?> get(String label) {
        return queues.get(label);
    }

    public synchronized Set<String> labels() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(queues.keySet()));
    }

    /**
     * Set up every registered queue; completes when all of them are set up.
     */
    public CompletableFuture<Void> setupAll() {
        List<CompletableFuture<Void>> setups = new ArrayList<>();
        for (DurableJobQueue<?> queue : snapshot()) {
            setups.add(queue.setup());
        }
        return CompletableFuture.allOf(setups.toArray(new CompletableFuture[0]));
    }

    @Override
    public void close() {
        List<DurableJobQueue<?>> toClose = snapshot();
        Collections.reverse(toClose);
        for (DurableJobQueue<?> queue : toClose) {
            queue.close();
        }
    }

    private synchronized List<DurableJobQueue<?>> snapshot() {
        return new ArrayList<>(queues.values());
    }
}
