package com.umitunal.jobqueue.storage;

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.OptimisticTransactionDB;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;

/**
 * Read transaction pinned to a RocksDB snapshot.
 */
final class SnapshotReadTransaction implements ReadTransaction {
    private final OptimisticTransactionDB db;
    private final ColumnFamilyHandle columnFamily;
    private final ReadOptions readOptions;

    SnapshotReadTransaction(OptimisticTransactionDB db, ColumnFamilyHandle columnFamily, ReadOptions readOptions) {
        this.db = db;
        this.columnFamily = columnFamily;
        this.readOptions = readOptions;
    }

    @Override
    public byte[] get(byte[] key) throws JobStorageException {
        try {
            return db.get(columnFamily, readOptions, key);
        } catch (RocksDBException e) {
            throw new JobStorageException("Read failed", e);
        }
    }

    @Override
    public void scan(byte[] prefix, KeyValueVisitor visitor) throws JobStorageException {
        try (RocksIterator iter = db.newIterator(columnFamily, readOptions)) {
            RocksScans.scan(iter, prefix, visitor);
        }
    }
}
