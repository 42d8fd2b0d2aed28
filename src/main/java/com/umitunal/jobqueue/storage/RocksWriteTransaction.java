package com.umitunal.jobqueue.storage;

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Transaction;

import java.util.ArrayList;
import java.util.List;

/**
 * Write transaction over a RocksDB optimistic transaction. Conflicts cannot
 * occur because {@link JobDatabase} admits one writer at a time.
 */
final class RocksWriteTransaction implements WriteTransaction {
    private final Transaction txn;
    private final ColumnFamilyHandle columnFamily;
    private final ReadOptions readOptions;
    private final List<Runnable> syncCompletions = new ArrayList<>();
    private final List<Runnable> asyncCompletions = new ArrayList<>();

    RocksWriteTransaction(Transaction txn, ColumnFamilyHandle columnFamily, ReadOptions readOptions) {
        this.txn = txn;
        this.columnFamily = columnFamily;
        this.readOptions = readOptions;
    }

    @Override
    public byte[] get(byte[] key) throws JobStorageException {
        try {
            return txn.get(columnFamily, readOptions, key);
        } catch (RocksDBException e) {
            throw new JobStorageException("Read failed", e);
        }
    }

    @Override
    public void scan(byte[] prefix, KeyValueVisitor visitor) throws JobStorageException {
        try (RocksIterator iter = txn.getIterator(readOptions, columnFamily)) {
            RocksScans.scan(iter, prefix, visitor);
        }
    }

    @Override
    public void put(byte[] key, byte[] value) throws JobStorageException {
        try {
            txn.put(columnFamily, key, value);
        } catch (RocksDBException e) {
            throw new JobStorageException("Write failed", e);
        }
    }

    @Override
    public void delete(byte[] key) throws JobStorageException {
        try {
            txn.delete(columnFamily, key);
        } catch (RocksDBException e) {
            throw new JobStorageException("Delete failed", e);
        }
    }

    @Override
    public void addSyncCompletion(Runnable completion) {
        syncCompletions.add(completion);
    }

    @Override
    public void addAsyncCompletion(Runnable completion) {
        asyncCompletions.add(completion);
    }

    List<Runnable> syncCompletions() {
        return syncCompletions;
    }

    List<Runnable> asyncCompletions() {
        return asyncCompletions;
    }
}
