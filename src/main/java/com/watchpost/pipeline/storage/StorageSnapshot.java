package com.watchpost.pipeline.storage;

import org.immutables.value.Value;

/** Measured usage of the event data root. Recomputed on demand, never persisted. */
@Value.Immutable
public interface StorageSnapshot {
    long totalBytes();

    long limitBytes();

    @Value.Derived
    default double percentUsed() {
        return limitBytes() == 0 ? 100.0 : (100.0 * totalBytes()) / limitBytes();
    }

    @Value.Derived
    default boolean isOverLimit() {
        return totalBytes() >= limitBytes();
    }

    static StorageSnapshot of(long totalBytes, long limitBytes) {
        return ImmutableStorageSnapshot.builder().totalBytes(totalBytes).limitBytes(limitBytes).build();
    }
}
