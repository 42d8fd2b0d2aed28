package com.umitunal.jobqueue.core;

/**
 * The work can never succeed; the record is marked permanently failed
 * regardless of remaining retries.
 */
public class PermanentJobFailureException extends JobException {

    public PermanentJobFailureException(String message) {
        super(message);
    }

    public PermanentJobFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
