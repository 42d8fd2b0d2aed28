package com.umitunal.jobqueue.model;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary codec for {@link JobRecord} values.
 *
 * Layout (format 1):
 * - format (1 byte)
 * - id (8 bytes)
 * - label length (4 bytes) + label bytes (UTF-8)
 * - status code (4 bytes)
 * - failureCount (8 bytes)
 * - exclusiveProcessIdentifier length (4 bytes, -1 when absent) + bytes (UTF-8)
 * - createdAt (8 bytes)
 * - lastModified (8 bytes)
 * - lastError length (4 bytes, -1 when absent) + bytes (UTF-8)
 * - payload length (4 bytes) + payload bytes
 */
public final class JobRecordSerializer {

    public static final byte FORMAT_VERSION = 1;

    private JobRecordSerializer() {
    }

    public static byte[] serialize(JobRecord record) {
        byte[] labelBytes = record.getLabel().getBytes(UTF_8);
        byte[] exclusiveBytes = encodeNullable(record.getExclusiveProcessIdentifier());
        byte[] errorBytes = encodeNullable(record.getLastError());
        byte[] payloadBytes = record.rawPayload();

        int totalSize = 1 +                                          // format
                        8 +                                          // id
                        4 + labelBytes.length +                      // label
                        4 +                                          // status
                        8 +                                          // failureCount
                        4 + lengthOf(exclusiveBytes) +               // exclusiveProcessIdentifier
                        8 +                                          // createdAt
                        8 +                                          // lastModified
                        4 + lengthOf(errorBytes) +                   // lastError
                        4 + payloadBytes.length;                     // payload

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);
        buffer.putLong(record.getId());
        putBytes(buffer, labelBytes);
        buffer.putInt(record.getStatus().getCode());
        buffer.putLong(record.getFailureCount());
        putNullable(buffer, exclusiveBytes);
        buffer.putLong(record.getCreatedAt());
        buffer.putLong(record.getLastModified());
        putNullable(buffer, errorBytes);
        putBytes(buffer, payloadBytes);
        return buffer.array();
    }

    /**
     * @throws IllegalArgumentException if the bytes are not a record this format understands
     */
    public static JobRecord deserialize(byte[] bytes) {
        try {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);

            byte format = buffer.get();
            if (format != FORMAT_VERSION) {
                throw new IllegalArgumentException("Unsupported job record format: " + format);
            }

            long id = buffer.getLong();
            String label = new String(getBytes(buffer), UTF_8);
            JobStatus status = JobStatus.fromCode(buffer.getInt());
            long failureCount = buffer.getLong();
            String exclusive = getNullable(buffer);
            long createdAt = buffer.getLong();
            long lastModified = buffer.getLong();
            String lastError = getNullable(buffer);
            byte[] payload = getBytes(buffer);

            JobRecord record = new JobRecord(id, label, payload, exclusive);
            record.setStatus(status);
            record.setFailureCount(failureCount);
            record.setCreatedAt(createdAt);
            record.setLastModified(lastModified);
            record.setLastError(lastError);
            return record;
        } catch (BufferUnderflowException | NegativeArraySizeException e) {
            throw new IllegalArgumentException("Truncated job record", e);
        }
    }

    private static byte[] encodeNullable(String value) {
        return value != null ? value.getBytes(UTF_8) : null;
    }

    private static int lengthOf(byte[] bytes) {
        return bytes != null ? bytes.length : 0;
    }

    private static void putBytes(ByteBuffer buffer, byte[] bytes) {
        buffer.putInt(bytes.length);
        buffer.put(bytes);
    }

    private static void putNullable(ByteBuffer buffer, byte[] bytes) {
        if (bytes == null) {
            buffer.putInt(-1);
        } else {
            putBytes(buffer, bytes);
        }
    }

    private static byte[] getBytes(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length > buffer.remaining()) {
            throw new BufferUnderflowException();
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    private static String getNullable(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0) {
            return null;
        }
        if (length > buffer.remaining()) {
            throw new BufferUnderflowException();
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, UTF_8);
    }
}
