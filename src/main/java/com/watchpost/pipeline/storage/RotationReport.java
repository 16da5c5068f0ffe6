package com.watchpost.pipeline.storage;

import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
public interface RotationReport {
    /** Deleted date partitions, oldest first */
    List<String> deletedPartitions();

    long bytesFreed();

    /** Date partitions left after rotation, today included */
    int retainedPartitions();

    /** Rotation stopped because deleting more would go below the retention floor */
    boolean floorReached();

    /** Nothing deletable was left: only today's partition or the floor remained */
    boolean candidatesExhausted();
}
