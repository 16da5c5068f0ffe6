package com.watchpost.pipeline.storage;

import static com.google.common.base.Preconditions.checkArgument;

import com.watchpost.pipeline.config.Config;
import com.watchpost.pipeline.core.PipelineEventNotifier;
import com.watchpost.pipeline.core.PipelineEventType;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the event data root under its byte limit. Usage is measured every N written events;
 * at the rotation threshold the oldest partitions are deleted, and at the limit the caller is
 * told to shut down.
 */
public class StorageGovernor {
    final static Logger LOGGER = LoggerFactory.getLogger(StorageGovernor.class);
    final static String REPORTER = "StorageGovernor";

    public static final double WARNING_PERCENT = 80.0;
    public static final double ROTATION_PERCENT = 90.0;
    public static final double CRITICAL_PERCENT = 100.0;
    public static final double ROTATION_TARGET_FRACTION = 0.8;

    final Path eventDataRoot;
    final RotationPolicy rotationPolicy;
    final PipelineEventNotifier eventNotifier;
    final String cameraName;
    final AtomicLong eventsSinceCheck = new AtomicLong();

    volatile long limitBytes;
    volatile int checkInterval;

    public StorageGovernor(Path eventDataRoot, long limitBytes, int checkInterval, RotationPolicy rotationPolicy,
                           PipelineEventNotifier eventNotifier, String cameraName) {
        this.eventDataRoot = eventDataRoot;
        this.rotationPolicy = rotationPolicy;
        this.eventNotifier = eventNotifier;
        this.cameraName = cameraName;
        reconfigure(limitBytes, checkInterval, rotationPolicy.minRetentionDays());
    }

    public static StorageGovernor fromConfig(Config config, Clock clock, PipelineEventNotifier eventNotifier) {
        Path root = Path.of(config.eventDataFolder());
        RotationPolicy rotationPolicy = new RotationPolicy(root, config.minRetentionDays(), ROTATION_TARGET_FRACTION,
                clock.withZone(config.partitionZoneId()));
        return new StorageGovernor(root, config.maxStorageBytes(), config.storageCheckInterval(), rotationPolicy,
                eventNotifier, config.cameraName());
    }

    public void reconfigure(long limitBytes, int checkInterval, int minRetentionDays) {
        checkArgument(limitBytes > 0, "limitBytes must be positive");
        checkArgument(checkInterval > 0, "checkInterval must be positive");
        this.limitBytes = limitBytes;
        this.checkInterval = checkInterval;
        rotationPolicy.reconfigure(minRetentionDays, ROTATION_TARGET_FRACTION);
    }

    /** @return the check result every {@code checkInterval} events, null otherwise */
    @Nullable
    public StorageStatus onEventWritten() throws IOException {
        if (eventsSinceCheck.incrementAndGet() < checkInterval) {
            return null;
        }
        eventsSinceCheck.set(0);
        return checkUsage();
    }

    public StorageSnapshot measure() throws IOException {
        return StorageSnapshot.of(directorySize(eventDataRoot), limitBytes);
    }

    public StorageStatus checkUsage() throws IOException {
        StorageSnapshot snapshot = measure();
        RotationReport rotation = null;
        if (snapshot.percentUsed() >= ROTATION_PERCENT) {
            LOGGER.warn("Storage at {}% of {} bytes, rotating", String.format("%.1f", snapshot.percentUsed()), limitBytes);
            rotation = rotationPolicy.rotate(snapshot.totalBytes(), limitBytes);
            snapshot = measure();
            if (!rotation.deletedPartitions().isEmpty()) {
                eventNotifier.notifyEvent(REPORTER, PipelineEventType.STORAGE_ROTATED, cameraName,
                        String.format("Deleted %d partitions, freed %d bytes", rotation.deletedPartitions().size(), rotation.bytesFreed()),
                        String.format("Deleted: %s; usage now %.1f%%", rotation.deletedPartitions(), snapshot.percentUsed()));
            }
        }

        int minRetentionDays = rotationPolicy.minRetentionDays();
        int retainedDays = rotation != null ? rotation.retainedPartitions() : rotationPolicy.listPartitions().size();
        boolean conflict = rotation != null && rotation.floorReached()
                && snapshot.percentUsed() >= ROTATION_TARGET_FRACTION * 100.0;

        StorageLevel level;
        if (snapshot.percentUsed() >= CRITICAL_PERCENT) {
            level = StorageLevel.CRITICAL;
        } else if (snapshot.percentUsed() >= WARNING_PERCENT) {
            level = StorageLevel.WARNING;
        } else {
            level = StorageLevel.OK;
        }

        if (conflict) {
            String message = String.format("Storage limit %d bytes (%.1f%% used) conflicts with retention floor of %d days; "
                            + "%d days retained, rotation stopped",
                    limitBytes, snapshot.percentUsed(), minRetentionDays, retainedDays);
            LOGGER.error(message);
            eventNotifier.notifyEvent(REPORTER, PipelineEventType.RETENTION_FLOOR_CONFLICT, cameraName,
                    "Retention floor blocks rotation", message);
        }
        if (level == StorageLevel.CRITICAL) {
            String message = String.format("Event data uses %d of %d bytes (%.1f%%)",
                    snapshot.totalBytes(), limitBytes, snapshot.percentUsed());
            LOGGER.error("Storage limit exceeded: {}", message);
            eventNotifier.notifyEvent(REPORTER, PipelineEventType.STORAGE_LIMIT_EXCEEDED, cameraName,
                    "Storage limit exceeded", message);
        } else if (level == StorageLevel.WARNING) {
            LOGGER.warn("Storage at {}% of {} bytes", String.format("%.1f", snapshot.percentUsed()), limitBytes);
            eventNotifier.notifyEvent(REPORTER, PipelineEventType.STORAGE_WARNING, cameraName,
                    "Storage above warning threshold", String.format("%.1f%% used", snapshot.percentUsed()));
        } else {
            LOGGER.debug("Storage at {}% of {} bytes", String.format("%.1f", snapshot.percentUsed()), limitBytes);
        }

        return ImmutableStorageStatus.builder()
                .snapshot(snapshot)
                .level(level)
                .rotation(rotation)
                .retentionFloorDays(minRetentionDays)
                .retainedDays(retainedDays)
                .retentionConflict(conflict)
                .build();
    }

    /** Sum of regular file sizes below {@code root}; files deleted during the walk are skipped. */
    static long directorySize(Path root) throws IOException {
        if (!Files.exists(root)) {
            return 0L;
        }
        AtomicLong total = new AtomicLong();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    total.addAndGet(attrs.size());
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
                if (e instanceof NoSuchFileException) {
                    LOGGER.debug("File vanished during storage walk: {}", file);
                    return FileVisitResult.CONTINUE;
                }
                throw e;
            }
        });
        return total.get();
    }
}
