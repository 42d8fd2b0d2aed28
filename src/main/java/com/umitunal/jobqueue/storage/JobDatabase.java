package com.umitunal.jobqueue.storage;

import com.umitunal.jobqueue.config.StorageConfig;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Transactional store shared by every job queue in the process.
 *
 * Writers are serialized: one write transaction runs at a time, in arrival
 * order, which gives the queues single-writer semantics. Reads run against
 * a snapshot and never block writers.
 */
public class JobDatabase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobDatabase.class);

    private final OptimisticTransactionDB transactionDB;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions columnFamilyOptions;
    private final ColumnFamilyHandle defaultColumnFamily;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;

    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private final ExecutorService asyncCompletions;
    private volatile boolean closed;

    @FunctionalInterface
    public interface ReadBlock<R> {
        R apply(ReadTransaction transaction) throws JobStorageException;
    }

    @FunctionalInterface
    public interface WriteBlock<R> {
        R apply(WriteTransaction transaction) throws JobStorageException;
    }

    private JobDatabase(StorageConfig config) throws RocksDBException {
        RocksDB.loadLibrary();

        this.blockCache = new LRUCache((long) config.getBlockCacheSizeMB() * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true);

        this.columnFamilyOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setTableFormatConfig(tableConfig);

        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads());

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());
        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        // Transaction reads and iterators need the default family handle
        List<ColumnFamilyDescriptor> descriptors = List.of(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, columnFamilyOptions));
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory(), descriptors, handles);
        this.defaultColumnFamily = handles.get(0);

        this.asyncCompletions = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "job-db-completions");
            thread.setDaemon(true);
            return thread;
        });
    }

    public static JobDatabase open(StorageConfig config) throws JobStorageException {
        try {
            JobDatabase database = new JobDatabase(config);
            log.info("Opened job store at {}", config.getDataDirectory());
            return database;
        } catch (RocksDBException e) {
            throw new JobStorageException("Failed to open job store at " + config.getDataDirectory(), e);
        }
    }

    /**
     * Run {@code block} against a consistent snapshot.
     */
    public <R> R read(ReadBlock<R> block) throws JobStorageException {
        lifecycle.readLock().lock();
        try {
            ensureOpen();
            Snapshot snapshot = transactionDB.getSnapshot();
            try (ReadOptions readOptions = new ReadOptions().setSnapshot(snapshot)) {
                return block.apply(new SnapshotReadTransaction(transactionDB, defaultColumnFamily, readOptions));
            } finally {
                transactionDB.releaseSnapshot(snapshot);
            }
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    /**
     * Run {@code block} in a write transaction and commit it. If the block
     * throws, nothing is written and no completion runs.
     *
     * @throws IllegalStateException if called from inside another write block
     */
    public <R> R write(WriteBlock<R> block) throws JobStorageException {
        if (writeLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Nested write transactions are not supported");
        }

        RocksWriteTransaction transaction;
        R result;

        lifecycle.readLock().lock();
        try {
            ensureOpen();
            writeLock.lock();
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts);
                 ReadOptions readOptions = new ReadOptions()) {
                transaction = new RocksWriteTransaction(txn, defaultColumnFamily, readOptions);
                boolean committed = false;
                try {
                    result = block.apply(transaction);
                    txn.commit();
                    committed = true;
                } catch (RocksDBException e) {
                    throw new JobStorageException("Commit failed", e);
                } finally {
                    if (!committed) {
                        rollback(txn);
                    }
                }
            } finally {
                writeLock.unlock();
            }
        } finally {
            lifecycle.readLock().unlock();
        }

        runSyncCompletions(transaction.syncCompletions());
        scheduleAsyncCompletions(transaction.asyncCompletions());
        return result;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        lifecycle.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            lifecycle.writeLock().unlock();
        }

        asyncCompletions.shutdown();
        try {
            if (!asyncCompletions.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Job store completions did not drain within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        txnOpts.close();
        writeOpts.close();
        defaultColumnFamily.close();
        transactionDB.close();
        dbOptions.close();
        columnFamilyOptions.close();
        blockCache.close();
        bloomFilter.close();
        log.info("Closed job store");
    }

    private void ensureOpen() throws JobStorageException {
        if (closed) {
            throw new JobStorageException("Job store is closed");
        }
    }

    private static void rollback(Transaction txn) {
        try {
            txn.rollback();
        } catch (RocksDBException e) {
            // Closing the transaction discards its writes regardless
            log.warn("Rollback failed", e);
        }
    }

    private static void runSyncCompletions(List<Runnable> completions) {
        for (Runnable completion : completions) {
            try {
                completion.run();
            } catch (RuntimeException e) {
                log.error("Transaction completion failed", e);
            }
        }
    }

    private void scheduleAsyncCompletions(List<Runnable> completions) {
        for (Runnable completion : completions) {
            try {
                asyncCompletions.execute(() -> {
                    try {
                        completion.run();
                    } catch (RuntimeException e) {
                        log.error("Async transaction completion failed", e);
                    }
                });
            } catch (RejectedExecutionException e) {
                log.debug("Job store closing, dropped async completion");
            }
        }
    }
}
