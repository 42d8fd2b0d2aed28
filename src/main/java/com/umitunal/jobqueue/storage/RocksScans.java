package com.umitunal.jobqueue.storage;

import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;

final class RocksScans {

    private RocksScans() {
    }

    static void scan(RocksIterator iter, byte[] prefix, KeyValueVisitor visitor) throws JobStorageException {
        iter.seek(prefix);
        while (iter.isValid()) {
            byte[] key = iter.key();
            if (!startsWith(key, prefix)) {
                break;
            }
            if (!visitor.visit(key, iter.value())) {
                return;
            }
            iter.next();
        }
        try {
            iter.status();
        } catch (RocksDBException e) {
            throw new JobStorageException("Scan failed", e);
        }
    }

    static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
