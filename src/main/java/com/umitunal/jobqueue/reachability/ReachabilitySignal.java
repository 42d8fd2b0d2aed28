package com.umitunal.jobqueue.reachability;

/**
 * Source of "network became reachable" events.
 */
public interface ReachabilitySignal {

    /**
     * Register a listener fired every time connectivity is restored.
     * Listeners run on the notifying thread and must not block.
     */
    Subscription subscribe(Runnable onReachable);

    /**
     * Handle for removing a listener.
     */
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
