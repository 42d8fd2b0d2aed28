package com.umitunal.jobqueue.storage;

/**
 * An atomic read/write transaction. Reads observe the transaction's own
 * uncommitted writes. Completions registered here run only if the
 * transaction commits.
 */
public interface WriteTransaction extends ReadTransaction {

    void put(byte[] key, byte[] value) throws JobStorageException;

    void delete(byte[] key) throws JobStorageException;

    /**
     * Run on the committing thread right after commit, before
     * {@link JobDatabase#write} returns.
     */
    void addSyncCompletion(Runnable completion);

    /**
     * Run after commit on the store's completion thread, in commit order.
     */
    void addAsyncCompletion(Runnable completion);
}
