package com.umitunal.jobqueue.core;

/**
 * The work is no longer relevant, for example because newer state
 * superseded it. The record is marked obsolete and later pruned.
 */
public class ObsoleteJobException extends JobException {

    public ObsoleteJobException(String message) {
        super(message);
    }
}
