package com.umitunal.jobqueue.storage;

import com.umitunal.jobqueue.config.ProcessIdentity;
import com.umitunal.jobqueue.model.JobRecord;
import com.umitunal.jobqueue.model.JobRecordSerializer;
import com.umitunal.jobqueue.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Queries and mutations over persisted job records, partitioned by label.
 *
 * Every method runs inside a transaction supplied by the caller; the store
 * never opens one itself. Records of one label are visited in ascending id
 * order.
 *
 * Key layout:
 * - {@code R<id>}: the serialized record
 * - {@code L<label>\0<id>}: label index entry (empty value)
 * - {@code MnextId}: next id to hand out
 */
public class JobRecordStore {
    private static final Logger log = LoggerFactory.getLogger(JobRecordStore.class);

    private static final byte RECORD_PREFIX = 'R';
    private static final byte LABEL_PREFIX = 'L';
    private static final byte[] NEXT_ID_KEY = "MnextId".getBytes(UTF_8);

    private final String currentProcessIdentifier;

    public JobRecordStore(ProcessIdentity processIdentity) {
        this.currentProcessIdentifier = processIdentity.getIdentifier();
    }

    public String getCurrentProcessIdentifier() {
        return currentProcessIdentifier;
    }

    /**
     * Persist a new {@code READY} record with the next id.
     *
     * @param exclusiveProcessIdentifier process allowed to run the record, or null for any
     */
    public JobRecord insert(String label, byte[] payload, String exclusiveProcessIdentifier,
                            WriteTransaction tx) throws JobStorageException {
        validateLabel(label);

        long id = nextId(tx);
        JobRecord record = new JobRecord(id, label, payload, exclusiveProcessIdentifier);
        tx.put(recordKey(id), JobRecordSerializer.serialize(record));
        tx.put(labelIndexKey(label, id), new byte[0]);

        log.debug("Inserted job record {} ({})", id, label);
        return record;
    }

    /**
     * @return the record, or null if it does not exist
     */
    public JobRecord find(long id, ReadTransaction tx) throws JobStorageException {
        byte[] value = tx.get(recordKey(id));
        if (value == null) {
            return null;
        }
        return decode(id, null, value);
    }

    /**
     * The lowest-id {@code READY} record of {@code label} that the current
     * process may run, or null when there is none.
     */
    public JobRecord nextReady(String label, ReadTransaction tx) throws JobStorageException {
        JobRecord[] result = new JobRecord[1];
        enumerate(label, tx, record -> {
            if (record.getStatus() == JobStatus.READY && record.canBeRunBy(currentProcessIdentifier)) {
                result[0] = record;
                return false;
            }
            return true;
        });
        return result[0];
    }

    public List<JobRecord> all(String label, JobStatus status, ReadTransaction tx) throws JobStorageException {
        List<JobRecord> result = new ArrayList<>();
        enumerate(label, tx, record -> {
            if (record.getStatus() == status) {
                result.add(record);
            }
            return true;
        });
        return result;
    }

    public List<JobRecord> all(String label, ReadTransaction tx) throws JobStorageException {
        List<JobRecord> result = new ArrayList<>();
        enumerate(label, tx, record -> {
            result.add(record);
            return true;
        });
        return result;
    }

    /**
     * Records that will never run in this process: terminal ones, and ready
     * ones reserved for another process.
     */
    public List<JobRecord> staleRecords(String label, ReadTransaction tx) throws JobStorageException {
        List<JobRecord> result = new ArrayList<>();
        enumerate(label, tx, record -> {
            if (isStale(record)) {
                result.add(record);
            }
            return true;
        });
        return result;
    }

    public Map<JobStatus, Long> countByStatus(String label, ReadTransaction tx) throws JobStorageException {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        enumerate(label, tx, record -> {
            counts.merge(record.getStatus(), 1L, Long::sum);
            return true;
        });
        return counts;
    }

    public JobRecord markRunning(JobRecord record, WriteTransaction tx) throws JobStorageException {
        JobRecord current = require(record, tx);
        current.markRunning();
        save(current, tx);
        return current;
    }

    public JobRecord markReady(JobRecord record, WriteTransaction tx) throws JobStorageException {
        JobRecord current = require(record, tx);
        current.markReady();
        save(current, tx);
        return current;
    }

    /**
     * Count one consumed retry. The record stays {@code RUNNING}.
     */
    public JobRecord addFailure(JobRecord record, String error, WriteTransaction tx) throws JobStorageException {
        JobRecord current = require(record, tx);
        current.recordFailure(error);
        save(current, tx);
        return current;
    }

    public JobRecord markPermanentlyFailed(JobRecord record, String error, WriteTransaction tx)
            throws JobStorageException {
        JobRecord current = require(record, tx);
        current.markPermanentlyFailed(error);
        save(current, tx);
        return current;
    }

    public JobRecord markObsolete(JobRecord record, String reason, WriteTransaction tx)
            throws JobStorageException {
        JobRecord current = require(record, tx);
        current.markObsolete(reason);
        save(current, tx);
        return current;
    }

    /**
     * Delete the record and its index entry. Removing an absent record is a no-op.
     */
    public void remove(JobRecord record, WriteTransaction tx) throws JobStorageException {
        tx.delete(recordKey(record.getId()));
        tx.delete(labelIndexKey(record.getLabel(), record.getId()));
    }

    private boolean isStale(JobRecord record) {
        return switch (record.getStatus()) {
            case RUNNING -> false;
            case READY -> !record.canBeRunBy(currentProcessIdentifier);
            default -> true;
        };
    }

    private JobRecord require(JobRecord record, ReadTransaction tx) throws JobStorageException {
        JobRecord current = find(record.getId(), tx);
        if (current == null) {
            throw new IllegalStateException("Job record not found: " + record.getId());
        }
        return current;
    }

    private void save(JobRecord record, WriteTransaction tx) throws JobStorageException {
        tx.put(recordKey(record.getId()), JobRecordSerializer.serialize(record));
    }

    @FunctionalInterface
    private interface RecordVisitor {
        boolean visit(JobRecord record) throws JobStorageException;
    }

    private void enumerate(String label, ReadTransaction tx, RecordVisitor visitor) throws JobStorageException {
        validateLabel(label);
        byte[] prefix = labelIndexPrefix(label);

        tx.scan(prefix, (key, ignored) -> {
            long id = ByteBuffer.wrap(key, prefix.length, Long.BYTES).getLong();
            byte[] value = tx.get(recordKey(id));
            if (value == null) {
                log.warn("Dangling index entry for job record {} ({})", id, label);
                return true;
            }
            return visitor.visit(decode(id, label, value));
        });
    }

    private static JobRecord decode(long id, String label, byte[] value) {
        try {
            return JobRecordSerializer.deserialize(value);
        } catch (IllegalArgumentException e) {
            log.error("Undecodable job record {} ({}), treating as unknown", id, label, e);
            return JobRecord.corrupted(id, label != null ? label : "");
        }
    }

    private long nextId(WriteTransaction tx) throws JobStorageException {
        byte[] stored = tx.get(NEXT_ID_KEY);
        long id = stored != null ? ByteBuffer.wrap(stored).getLong() : 1L;
        tx.put(NEXT_ID_KEY, ByteBuffer.allocate(Long.BYTES).putLong(id + 1).array());
        return id;
    }

    private static void validateLabel(String label) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException("label must not be empty");
        }
        if (label.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("label must not contain NUL: " + label);
        }
    }

    static byte[] recordKey(long id) {
        return ByteBuffer.allocate(1 + Long.BYTES)
                .put(RECORD_PREFIX)
                .putLong(id)
                .array();
    }

    static byte[] labelIndexPrefix(String label) {
        byte[] labelBytes = label.getBytes(UTF_8);
        return ByteBuffer.allocate(1 + labelBytes.length + 1)
                .put(LABEL_PREFIX)
                .put(labelBytes)
                .put((byte) 0)
                .array();
    }

    static byte[] labelIndexKey(String label, long id) {
        byte[] prefix = labelIndexPrefix(label);
        return ByteBuffer.allocate(prefix.length + Long.BYTES)
                .put(prefix)
                .putLong(id)
                .array();
    }
}
