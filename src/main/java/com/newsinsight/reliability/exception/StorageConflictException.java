package com.newsinsight.reliability.exception;

import com.newsinsight.reliability.store.SnapshotKey;

/**
 * Two writers raced on the same snapshot key during a read-modify-write upsert.
 * Retried inside the snapshot store; callers never see it unless retries are exhausted.
 */
public class StorageConflictException extends ReliabilityException {

    private final SnapshotKey key;

    public StorageConflictException(SnapshotKey key, Throwable cause) {
        super("STORAGE_CONFLICT", "Concurrent write on snapshot " + key, cause);
        this.key = key;
    }

    public SnapshotKey getKey() {
        return key;
    }
}
