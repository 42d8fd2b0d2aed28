package com.umitunal.jobqueue.model;

/**
 * Persisted lifecycle state of a {@link JobRecord}.
 *
 * The persisted code is stable across releases; never reuse a retired code.
 */
public enum JobStatus {
    READY(1),
    RUNNING(2),
    PERMANENTLY_FAILED(3),
    OBSOLETE(4),
    UNKNOWN(0);       // Unrecognized or corrupted data

    private final int code;

    JobStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Terminal states are never claimed again and are removed by the pruning pass.
     */
    public boolean isTerminal() {
        return this == PERMANENTLY_FAILED || this == OBSOLETE || this == UNKNOWN;
    }

    public static JobStatus fromCode(int code) {
        for (JobStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
