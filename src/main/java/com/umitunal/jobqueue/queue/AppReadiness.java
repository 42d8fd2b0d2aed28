package com.umitunal.jobqueue.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Process-wide readiness gate. Queues start working only once the process
 * declares itself ready; work requested earlier runs at that moment.
 */
public class AppReadiness {
    private static final Logger log = LoggerFactory.getLogger(AppReadiness.class);

    private final List<Runnable> pending = new ArrayList<>();
    private boolean ready;

    public AppReadiness() {
    }

    /**
     * A gate that is open from the start.
     */
    public static AppReadiness alreadyReady() {
        AppReadiness readiness = new AppReadiness();
        readiness.markReady();
        return readiness;
    }

    public synchronized boolean isReady() {
        return ready;
    }

    public void markReady() {
        List<Runnable> toRun;
        synchronized (this) {
            if (ready) {
                return;
            }
            ready = true;
            toRun = new ArrayList<>(pending);
            pending.clear();
        }
        log.info("Process ready, running {} deferred task(s)", toRun.size());
        toRun.forEach(this::runSafely);
    }

    public void runNowOrWhenReady(Runnable task) {
        synchronized (this) {
            if (!ready) {
                pending.add(task);
                return;
            }
        }
        runSafely(task);
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Readiness task failed", e);
        }
    }
}
