package com.umitunal.jobqueue.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Persisted description of one unit of work and its retry state.
 *
 * The payload is opaque to the queue; only the owning job type decodes it.
 * Status and failure count change only inside a storage write transaction,
 * through {@link com.umitunal.jobqueue.storage.JobRecordStore}.
 */
public class JobRecord {
    private final long id;
    private final String label;
    private final String exclusiveProcessIdentifier;
    private final byte[] payload;

    private JobStatus status;
    private long failureCount;
    private long createdAt;
    private long lastModified;
    private String lastError;

    public JobRecord(long id, String label, byte[] payload, String exclusiveProcessIdentifier) {
        this.id = id;
        this.label = Objects.requireNonNull(label, "label");
        this.payload = payload != null ? payload : new byte[0];
        this.exclusiveProcessIdentifier = exclusiveProcessIdentifier;
        this.status = JobStatus.READY;
        this.failureCount = 0;
        this.createdAt = System.currentTimeMillis();
        this.lastModified = this.createdAt;
    }

    /**
     * Placeholder for a record whose stored bytes could not be decoded.
     */
    public static JobRecord corrupted(long id, String label) {
        JobRecord record = new JobRecord(id, label, null, null);
        record.status = JobStatus.UNKNOWN;
        return record;
    }

    public long getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public String getExclusiveProcessIdentifier() {
        return exclusiveProcessIdentifier;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public JobStatus getStatus() {
        return status;
    }

    public long getFailureCount() {
        return failureCount;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastModified() {
        return lastModified;
    }

    public String getLastError() {
        return lastError;
    }

    /**
     * Whether a process with the given identifier may claim this record.
     */
    public boolean canBeRunBy(String processIdentifier) {
        return exclusiveProcessIdentifier == null || exclusiveProcessIdentifier.equals(processIdentifier);
    }

    // Package-private setters for deserialization
    void setStatus(JobStatus status) {
        this.status = status;
    }

    void setFailureCount(long failureCount) {
        this.failureCount = failureCount;
    }

    void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    void setLastModified(long lastModified) {
        this.lastModified = lastModified;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    byte[] rawPayload() {
        return payload;
    }

    public void markRunning() {
        requireStatus(JobStatus.READY);
        this.status = JobStatus.RUNNING;
        touch();
    }

    public void markReady() {
        requireStatus(JobStatus.RUNNING);
        this.status = JobStatus.READY;
        touch();
    }

    public void recordFailure(String error) {
        requireStatus(JobStatus.RUNNING);
        this.failureCount++;
        this.lastError = error;
        touch();
    }

    public void markPermanentlyFailed(String error) {
        requireStatus(JobStatus.READY, JobStatus.RUNNING);
        this.status = JobStatus.PERMANENTLY_FAILED;
        this.lastError = error;
        touch();
    }

    public void markObsolete(String reason) {
        requireStatus(JobStatus.READY, JobStatus.RUNNING);
        this.status = JobStatus.OBSOLETE;
        this.lastError = reason;
        touch();
    }

    private void requireStatus(JobStatus... allowed) {
        for (JobStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new IllegalStateException(String.format(
                "Job record %d (%s) is %s, expected one of %s", id, label, status, Arrays.toString(allowed)));
    }

    private void touch() {
        this.lastModified = System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id=%d, label='%s', status=%s, failures=%d, exclusive='%s'}",
                id, label, status, failureCount, exclusiveProcessIdentifier);
    }
}
