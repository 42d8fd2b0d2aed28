package com.umitunal.jobqueue.serialization;

/**
 * Encodes and decodes the job-type-specific payload stored in a job record.
 *
 * @param <T> the payload type
 */
public interface PayloadCodec<T> {

    /**
     * Encode a payload to bytes.
     *
     * @throws PayloadCodecException if the payload cannot be encoded
     */
    byte[] encode(T payload);

    /**
     * Decode stored bytes to a payload.
     *
     * @throws PayloadCodecException if the bytes are malformed
     */
    T decode(byte[] bytes);
}
