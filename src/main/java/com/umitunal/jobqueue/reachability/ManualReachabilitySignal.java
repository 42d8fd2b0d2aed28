package com.umitunal.jobqueue.reachability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process reachability signal. The embedding application bridges its
 * platform connectivity callbacks into {@link #notifyReachable()}.
 */
public class ManualReachabilitySignal implements ReachabilitySignal {
    private static final Logger log = LoggerFactory.getLogger(ManualReachabilitySignal.class);

    private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Subscription subscribe(Runnable onReachable) {
        listeners.add(onReachable);
        return () -> listeners.remove(onReachable);
    }

    public void notifyReachable() {
        log.debug("Network reachable, notifying {} listener(s)", listeners.size());
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Reachability listener failed", e);
            }
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
