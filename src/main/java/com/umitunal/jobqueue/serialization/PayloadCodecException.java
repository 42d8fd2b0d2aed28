package com.umitunal.jobqueue.serialization;

/**
 * Raised when a job payload cannot be encoded or decoded.
 */
public class PayloadCodecException extends RuntimeException {

    public PayloadCodecException(String message) {
        super(message);
    }

    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
