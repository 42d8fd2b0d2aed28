package com.umitunal.jobqueue.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

/**
 * JSON payload codec backed by Jackson.
 *
 * Unknown properties are ignored on decode so that a newer build can add
 * fields to a payload without stranding records written by an older one.
 *
 * @param <T> the payload type
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private final ObjectMapper mapper;
    private final JavaType type;

    public JsonCodec(Class<T> type) {
        this(type, createDefaultMapper());
    }

    public JsonCodec(Class<T> type, ObjectMapper mapper) {
        this.mapper = mapper;
        this.type = mapper.constructType(type);
    }

    @Override
    public byte[] encode(T payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new PayloadCodecException("Failed to write " + type + " as JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new PayloadCodecException("Empty JSON payload for " + type);
        }
        try {
            T value = mapper.readValue(bytes, type);
            if (value == null) {
                throw new PayloadCodecException("JSON payload decoded to null for " + type);
            }
            return value;
        } catch (IOException e) {
            throw new PayloadCodecException("Failed to read " + type + " from JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
