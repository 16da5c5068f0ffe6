package com.watchpost.pipeline.core;

import static com.watchpost.pipeline.core.DatedFilePipelineEventNotifier.getEventMessageStr;

import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Log-only notifier, used in dry-run mode where nothing should be written to disk. */
public class LogPipelineEventNotifier implements PipelineEventNotifier {
    final static Logger LOGGER = LoggerFactory.getLogger(LogPipelineEventNotifier.class);

    @Override
    public void notifyEvent(Long eventReportTime, String eventReporter, Long eventUnixTimeMs,
                            PipelineEventType eventType, @Nullable String cameraName,
                            String eventTitle, @Nullable String eventDetails) {
        LOGGER.warn("!!!EVENT!!! {}", getEventMessageStr(eventReportTime, eventReporter, eventUnixTimeMs,
                eventType, cameraName, eventTitle, eventDetails));
    }
}
