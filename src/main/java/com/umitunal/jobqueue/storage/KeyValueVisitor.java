package com.umitunal.jobqueue.storage;

/**
 * Callback for ordered key scans.
 */
@FunctionalInterface
public interface KeyValueVisitor {

    /**
     * @return true to continue the scan, false to stop
     */
    boolean visit(byte[] key, byte[] value) throws JobStorageException;
}
