package com.watchpost.pipeline.core;

import javax.annotation.Nullable;

/** Implementations don't throw; a notification that can't be delivered is logged and dropped. */
public interface PipelineEventNotifier {
  default void notifyEvent(
      String eventReporter,
      PipelineEventType eventType,
      @Nullable String cameraName,
      String eventTitle,
      @Nullable String eventDetails) {
    long currentTime = System.currentTimeMillis();
    notifyEvent(currentTime, eventReporter, currentTime, eventType, cameraName, eventTitle, eventDetails);
  }

  void notifyEvent(
      Long eventReportTime,
      String eventReporter,
      Long eventUnixTimeMs,
      PipelineEventType eventType,
      @Nullable String cameraName,
      String eventTitle,
      @Nullable String eventDetails);
}
