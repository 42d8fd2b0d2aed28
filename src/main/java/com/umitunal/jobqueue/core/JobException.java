package com.umitunal.jobqueue.core;

/**
 * Base of the errors a job type raises to tell the queue that a record
 * must not be retried.
 */
public abstract class JobException extends RuntimeException {

    protected JobException(String message) {
        super(message);
    }

    protected JobException(String message, Throwable cause) {
        super(message, cause);
    }
}
