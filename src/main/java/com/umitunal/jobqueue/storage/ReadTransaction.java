package com.umitunal.jobqueue.storage;

/**
 * A consistent view of the store. Only valid inside the block it was handed to.
 */
public interface ReadTransaction {

    /**
     * @return the stored value, or null if the key is absent
     */
    byte[] get(byte[] key) throws JobStorageException;

    /**
     * Visit every key starting with {@code prefix}, in ascending byte order.
     */
    void scan(byte[] prefix, KeyValueVisitor visitor) throws JobStorageException;
}
