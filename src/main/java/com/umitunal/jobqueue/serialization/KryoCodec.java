package com.umitunal.jobqueue.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.Pool;

import java.util.List;

/**
 * Compact binary payload codec backed by Kryo.
 *
 * Kryo instances are not thread-safe; operations run on several worker
 * threads, so instances are borrowed from a pool per call.
 *
 * When registered classes are supplied, registration becomes mandatory and
 * the registration order is part of the stored format: append new classes,
 * never reorder.
 *
 * @param <T> the payload type
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private static final int POOL_SIZE = 16;
    private static final int INITIAL_BUFFER = 256;

    private final Class<T> type;
    private final Pool<Kryo> kryoPool;

    public KryoCodec(Class<T> type) {
        this(type, List.of());
    }

    public KryoCodec(Class<T> type, List<Class<?>> registeredClasses) {
        this.type = type;
        this.kryoPool = new Pool<>(true, false, POOL_SIZE) {
            @Override
            protected Kryo create() {
                Kryo kryo = new Kryo();
                kryo.setReferences(true);
                if (registeredClasses.isEmpty()) {
                    kryo.setRegistrationRequired(false);
                } else {
                    kryo.setRegistrationRequired(true);
                    kryo.register(type);
                    registeredClasses.forEach(kryo::register);
                }
                return kryo;
            }
        };
    }

    @Override
    public byte[] encode(T payload) {
        Kryo kryo = kryoPool.obtain();
        try (Output output = new Output(INITIAL_BUFFER, -1)) {
            kryo.writeObject(output, payload);
            return output.toBytes();
        } catch (KryoException | IllegalArgumentException e) {
            throw new PayloadCodecException("Failed to encode " + type.getName() + " with Kryo", e);
        } finally {
            kryoPool.free(kryo);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        Kryo kryo = kryoPool.obtain();
        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        } catch (RuntimeException e) {
            throw new PayloadCodecException("Failed to decode " + type.getName() + " with Kryo", e);
        } finally {
            kryoPool.free(kryo);
        }
    }
}
