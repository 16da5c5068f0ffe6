package com.watchpost.pipeline.dedup;

/** Which sightings move a suppression entry's window forward. */
public enum SuppressionRefreshPolicy {
    /** Only emitted events refresh; a stationary object yields one event per window */
    REFRESH_ON_EMIT,
    /** Suppressed sightings refresh too; a continuously present object yields a single event */
    REFRESH_ON_SUPPRESS
}
