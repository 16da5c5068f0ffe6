package com.watchpost.pipeline.pipeline;

public enum PipelineState {
    /** Health checks, before any frame is consumed */
    STARTING,
    RUNNING,
    /** Applying a new configuration; returns to RUNNING */
    RELOADING_CONFIG,
    /** Acquisition stopped, sinks being flushed and closed */
    DRAINING,
    STOPPED
}
