package com.watchpost.pipeline.storage;

import javax.annotation.Nullable;
import org.immutables.value.Value;

/** Outcome of one storage check. */
@Value.Immutable
public interface StorageStatus {
    StorageSnapshot snapshot();

    StorageLevel level();

    @Nullable
    RotationReport rotation();

    int retentionFloorDays();

    int retainedDays();

    /** The limit is exceeded above target and the retention floor forbids deleting more */
    boolean retentionConflict();
}
