package com.umitunal.jobqueue.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Dedicated thread that drains a queue whenever it is signalled.
 *
 * Signals coalesce: any number of signals while a drain is in progress
 * cause exactly one more drain. A drain calls the step until it reports
 * that nothing was claimed, so inserts and completions never need to
 * re-invoke the step themselves.
 */
final class WorkTrigger implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkTrigger.class);

    private final String name;
    private final BooleanSupplier step;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lock = new Object();
    private boolean pending;
    private Thread thread;

    WorkTrigger(String name, BooleanSupplier step) {
        this.name = name;
        this.step = step;
    }

    void start() {
        if (running.compareAndSet(false, true)) {
            thread = new Thread(this::run, name);
            thread.setDaemon(true);
            thread.start();
        }
    }

    void signal() {
        synchronized (lock) {
            pending = true;
            lock.notifyAll();
        }
    }

    boolean isRunning() {
        return running.get();
    }

    void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        synchronized (lock) {
            lock.notifyAll();
        }
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        stop();
    }

    private void run() {
        while (running.get()) {
            synchronized (lock) {
                while (!pending && running.get()) {
                    try {
                        lock.wait();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        running.set(false);
                        return;
                    }
                }
                pending = false;
            }

            try {
                while (running.get() && step.getAsBoolean()) {
                    // keep claiming until the queue is idle
                }
            } catch (RuntimeException e) {
                log.error("{} work step failed", name, e);
            }
        }
    }
}
