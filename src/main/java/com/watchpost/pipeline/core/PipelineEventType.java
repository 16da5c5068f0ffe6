package com.watchpost.pipeline.core;

public enum PipelineEventType {
  /** Watchpost process lifecycle (start, drain, stop) */
  PIPELINE_PROCESS,
  /** Camera stream connection established */
  CAMERA_CONNECTED,
  /** Camera stream lost: read timeout, closed stream or failed connect */
  CAMERA_DISCONNECTED,
  /** Consecutive reconnect failures reached the limit */
  CAMERA_RECONNECT_EXHAUSTED,
  /** A collaborator failed its startup health check */
  COLLABORATOR_UNAVAILABLE,
  /** Event data usage crossed the warning threshold */
  STORAGE_WARNING,
  /** Oldest date partitions were deleted to bring usage down */
  STORAGE_ROTATED,
  /** Rotation stopped at the retention floor while usage is still above target */
  RETENTION_FLOOR_CONFLICT,
  /** Event data usage reached the storage limit, pipeline is shutting down */
  STORAGE_LIMIT_EXCEEDED,
  /** New configuration applied */
  CONFIG_RELOADED,
  /** Reloaded configuration was invalid, previous configuration kept */
  CONFIG_RELOAD_REJECTED,
  /** A non-primary event sink failed to write an event */
  EVENT_SINK_FAILED,
  /** Drain did not complete within its ceiling */
  DRAIN_TIMEOUT
}
