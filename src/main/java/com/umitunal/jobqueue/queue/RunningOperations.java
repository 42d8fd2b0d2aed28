package com.umitunal.jobqueue.queue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Queue-owned index of in-flight operations keyed by record id. Storage
 * stays the source of truth; this index exists for cancellation and
 * reachability signalling.
 */
final class RunningOperations<T> {
    private final Map<Long, OperationRunner<T>> byRecordId = new TreeMap<>();

    /**
     * @return false if the record already has an operation in flight
     */
    synchronized boolean add(OperationRunner<T> runner) {
        return byRecordId.putIfAbsent(runner.getRecordId(), runner) == null;
    }

    synchronized void remove(OperationRunner<T> runner) {
        byRecordId.remove(runner.getRecordId(), runner);
    }

    synchronized boolean contains(long recordId) {
        return byRecordId.containsKey(recordId);
    }

    /**
     * The in-flight operation with the lowest record id, or null.
     */
    synchronized OperationRunner<T> first() {
        return byRecordId.isEmpty() ? null : byRecordId.values().iterator().next();
    }

    synchronized List<OperationRunner<T>> snapshot() {
        return new ArrayList<>(byRecordId.values());
    }

    synchronized List<Long> recordIds() {
        return new ArrayList<>(byRecordId.keySet());
    }

    synchronized int size() {
        return byRecordId.size();
    }
}
