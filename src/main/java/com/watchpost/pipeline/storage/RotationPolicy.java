package com.watchpost.pipeline.storage;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes whole {@code yyyy-MM-dd} partitions oldest-first until usage drops below the target.
 * Today's partition is never deleted, and the number of retained partitions never drops below
 * the retention floor.
 */
public class RotationPolicy {
    final static Logger LOGGER = LoggerFactory.getLogger(RotationPolicy.class);
    static final DateTimeFormatter PARTITION_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    final Path eventDataRoot;
    final Clock clock;
    int minRetentionDays;
    double targetFraction;

    /** @param clock decides which partition is today; its zone is the partition zone */
    public RotationPolicy(Path eventDataRoot, int minRetentionDays, double targetFraction, Clock clock) {
        this.eventDataRoot = eventDataRoot;
        this.clock = clock;
        reconfigure(minRetentionDays, targetFraction);
    }

    public void reconfigure(int minRetentionDays, double targetFraction) {
        checkArgument(minRetentionDays >= 1, "minRetentionDays must be at least 1");
        checkArgument(targetFraction > 0.0 && targetFraction <= 1.0, "targetFraction must be within (0, 1]");
        this.minRetentionDays = minRetentionDays;
        this.targetFraction = targetFraction;
    }

    public int minRetentionDays() {
        return minRetentionDays;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /** Date partitions under the root, oldest first. Other entries are ignored. */
    public List<Partition> listPartitions() throws IOException {
        List<Partition> partitions = new ArrayList<>();
        if (!Files.isDirectory(eventDataRoot)) {
            return partitions;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(eventDataRoot, Files::isDirectory)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                try {
                    partitions.add(new Partition(LocalDate.parse(name, PARTITION_FORMATTER), entry));
                } catch (DateTimeParseException e) {
                    LOGGER.debug("Skipping non-partition directory {}", entry);
                }
            }
        }
        Collections.sort(partitions);
        return partitions;
    }

    public RotationReport rotate(long currentBytes, long limitBytes) throws IOException {
        long targetBytes = (long) (limitBytes * targetFraction);
        LocalDate today = today();
        List<Partition> partitions = listPartitions();

        List<String> deleted = new ArrayList<>();
        long bytesFreed = 0L;
        long usage = currentBytes;
        int retained = partitions.size();
        boolean floorReached = false;
        boolean candidatesExhausted = true;

        for (Partition partition : partitions) {
            if (usage < targetBytes) {
                candidatesExhausted = false;
                break;
            }
            if (!partition.date().isBefore(today)) {
                //today (or a future-dated partition from clock skew) stays
                continue;
            }
            if (retained <= minRetentionDays) {
                floorReached = true;
                break;
            }
            long size = StorageGovernor.directorySize(partition.path());
            LOGGER.info("Rotating out partition {} ({} bytes)", partition.path(), size);
            MoreFiles.deleteRecursively(partition.path(), RecursiveDeleteOption.ALLOW_INSECURE);
            deleted.add(partition.name());
            bytesFreed += size;
            usage -= size;
            retained--;
        }
        if (usage < targetBytes) {
            candidatesExhausted = false;
        }

        return ImmutableRotationReport.builder()
                .deletedPartitions(ImmutableList.copyOf(deleted))
                .bytesFreed(bytesFreed)
                .retainedPartitions(retained)
                .floorReached(floorReached)
                .candidatesExhausted(candidatesExhausted)
                .build();
    }

    public static final class Partition implements Comparable<Partition> {
        final LocalDate date;
        final Path path;

        Partition(LocalDate date, Path path) {
            this.date = date;
            this.path = path;
        }

        public LocalDate date() {
            return date;
        }

        public Path path() {
            return path;
        }

        public String name() {
            return date.format(PARTITION_FORMATTER);
        }

        @Override
        public int compareTo(Partition other) {
            return date.compareTo(other.date);
        }
    }
}
