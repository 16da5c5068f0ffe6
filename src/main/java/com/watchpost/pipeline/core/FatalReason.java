package com.watchpost.pipeline.core;

/** Conditions that end the process with a non-zero exit code. */
public enum FatalReason {
    RECONNECT_EXHAUSTED(1, "camera stream unreachable after repeated reconnect attempts"),
    STARTUP_HEALTH_CHECK_FAILED(1, "collaborator unavailable at startup"),
    DRAIN_TIMEOUT(1, "drain exceeded its ceiling, forced termination"),
    INVALID_CONFIGURATION(2, "invalid configuration"),
    STORAGE_LIMIT_EXCEEDED(3, "event data exceeds the storage ceiling"),
    RETENTION_FLOOR_CONFLICT(3, "storage ceiling exceeded and retention floor forbids further rotation");

    final int exitCode;
    final String invariant;

    FatalReason(int exitCode, String invariant) {
        this.exitCode = exitCode;
        this.invariant = invariant;
    }

    public int exitCode() {
        return exitCode;
    }

    public String invariant() {
        return invariant;
    }
}
