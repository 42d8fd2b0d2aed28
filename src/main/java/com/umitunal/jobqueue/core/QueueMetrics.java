package com.umitunal.jobqueue.core;

/**
 * Snapshot of one label's records plus the operations currently in flight.
 */
public class QueueMetrics {
    private final String label;
    private final long readyJobs;
    private final long runningJobs;
    private final long permanentlyFailedJobs;
    private final long obsoleteJobs;
    private final long unknownJobs;
    private final int inFlightOperations;

    public QueueMetrics(String label, long readyJobs, long runningJobs, long permanentlyFailedJobs,
                        long obsoleteJobs, long unknownJobs, int inFlightOperations) {
        this.label = label;
        this.readyJobs = readyJobs;
        this.runningJobs = runningJobs;
        this.permanentlyFailedJobs = permanentlyFailedJobs;
        this.obsoleteJobs = obsoleteJobs;
        this.unknownJobs = unknownJobs;
        this.inFlightOperations = inFlightOperations;
    }

    public String getLabel() { return label; }
    public long getReadyJobs() { return readyJobs; }
    public long getRunningJobs() { return runningJobs; }
    public long getPermanentlyFailedJobs() { return permanentlyFailedJobs; }
    public long getObsoleteJobs() { return obsoleteJobs; }
    public long getUnknownJobs() { return unknownJobs; }
    public int getInFlightOperations() { return inFlightOperations; }

    public long getTotalJobs() {
        return readyJobs + runningJobs + permanentlyFailedJobs + obsoleteJobs + unknownJobs;
    }

    @Override
    public String toString() {
        return String.format(
            "QueueMetrics{label='%s', total=%d, ready=%d, running=%d, failed=%d, obsolete=%d, unknown=%d, inFlight=%d}",
            label, getTotalJobs(), readyJobs, runningJobs, permanentlyFailedJobs, obsoleteJobs, unknownJobs,
            inFlightOperations
        );
    }
}
