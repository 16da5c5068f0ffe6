package com.watchpost.pipeline.storage;

public enum StorageLevel {
    OK,
    /** Usage at or above the warning threshold, logged only */
    WARNING,
    /** Usage at or above the limit; the pipeline shuts down */
    CRITICAL
}
