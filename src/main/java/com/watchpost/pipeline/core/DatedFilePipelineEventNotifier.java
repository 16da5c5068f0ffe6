package com.watchpost.pipeline.core;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Appends operational events to one file per day: {@code <folder>/<yyyy-MM-dd>-watchpost-events.log}. */
public class DatedFilePipelineEventNotifier implements PipelineEventNotifier {
    final static Logger LOGGER = LoggerFactory.getLogger(DatedFilePipelineEventNotifier.class);
    final static DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    final static DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    final static String EVENTS_FILENAME_SUFFIX = "-watchpost-events.log";

    protected @Nullable BufferedWriter currentEventFileWriter;
    protected @Nullable String currentEventFileName = null;
    protected final File eventsFolder;

    public DatedFilePipelineEventNotifier(File eventsFolder) {
        this.eventsFolder = eventsFolder;
        if (!eventsFolder.exists()) {
            eventsFolder.mkdirs();
        }
    }

    public static String getEventMessageStr(Long eventReportTime, String eventReporter, Long eventUnixTimeMillis,
                                            PipelineEventType eventType, @Nullable String cameraName,
                                            String eventTitle, @Nullable String eventDetails) {
        LocalDateTime eventDateTime = Instant.ofEpochMilli(eventUnixTimeMillis).atZone(ZoneId.systemDefault()).toLocalDateTime();
        LocalDateTime eventReportDateTime = Instant.ofEpochMilli(eventReportTime).atZone(ZoneId.systemDefault()).toLocalDateTime();

        return String.format("[%s]. Camera [%s] Time: [%s]; Report time: [%s]; Reporter: [%s]; [%s]:\n\t%s",
                eventType, cameraName, eventDateTime.format(DATE_TIME_FORMATTER),
                eventReportDateTime.format(DATE_TIME_FORMATTER), eventReporter, eventTitle, eventDetails);
    }

    protected BufferedWriter getEventFileWriter() throws IOException {
        String newDateStr = LocalDate.now().format(DATE_FORMATTER);
        String newEventFileName = String.format("%s%s", newDateStr, EVENTS_FILENAME_SUFFIX);

        if (!newEventFileName.equals(currentEventFileName)) {
            if (currentEventFileWriter != null) {
                currentEventFileWriter.close();
                currentEventFileWriter = null;
                currentEventFileName = null;
            }
            File eventFile = new File(eventsFolder, newEventFileName);
            currentEventFileWriter = Files.newBufferedWriter(eventFile.toPath(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            currentEventFileName = newEventFileName;
        }

        return checkNotNull(currentEventFileWriter);
    }

    @Override
    public synchronized void notifyEvent(Long eventReportTime, String eventReporter, Long eventUnixTimeMs,
                                         PipelineEventType eventType, @Nullable String cameraName,
                                         String eventTitle, @Nullable String eventDetails) {
        String eventMessage = getEventMessageStr(eventReportTime, eventReporter, eventUnixTimeMs,
                eventType, cameraName, eventTitle, eventDetails);
        LOGGER.warn("!!!EVENT!!! {}", eventMessage);
        try {
            String timestamp = LocalDateTime.now().format(DATE_TIME_FORMATTER);
            BufferedWriter fileWriter = getEventFileWriter();
            fileWriter.write(String.format("%s %s%n", timestamp, eventMessage));
            fileWriter.flush();
        } catch (IOException e) {
            //The event is already in the application log
            LOGGER.error("Can't write event to {}", eventsFolder, e);
        }
    }
}
