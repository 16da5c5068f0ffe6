package com.watchpost.pipeline.dedup;

import com.google.common.collect.ImmutableSortedSet;

/** A recently emitted label-set signature and when it was last seen (ticker nanos). */
final class SuppressionEntry {
    final ImmutableSortedSet<String> labelSetSignature;
    long lastSeenAtNanos;

    SuppressionEntry(ImmutableSortedSet<String> labelSetSignature, long lastSeenAtNanos) {
        this.labelSetSignature = labelSetSignature;
        this.lastSeenAtNanos = lastSeenAtNanos;
    }

    @Override
    public String toString() {
        return labelSetSignature + "@" + lastSeenAtNanos;
    }
}
