package com.umitunal.jobqueue.storage;

/**
 * Raised when the job store cannot be read or written.
 */
public class JobStorageException extends Exception {

    public JobStorageException(String message) {
        super(message);
    }

    public JobStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
