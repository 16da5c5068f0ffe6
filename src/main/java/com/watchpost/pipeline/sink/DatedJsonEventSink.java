package com.watchpost.pipeline.sink;

import static com.google.common.base.Preconditions.checkNotNull;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchpost.pipeline.core.CollaboratorUnavailableException;
import com.watchpost.pipeline.core.ObjectMappers;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends events as JSON lines to {@code <root>/<yyyy-MM-dd>/events.json}, the date taken from the
 * event timestamp in the partition zone. The writer rolls over when the date changes.
 */
public class DatedJsonEventSink implements EventSink {
    final static Logger LOGGER = LoggerFactory.getLogger(DatedJsonEventSink.class);
    public final static DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    public final static String EVENTS_FILENAME = "events.json";

    protected final File eventDataFolder;
    protected final ZoneId partitionZone;
    protected final ObjectMapper mapper = ObjectMappers.json();
    protected @Nullable BufferedWriter currentEventFileWriter;
    protected @Nullable String currentPartition = null;

    public DatedJsonEventSink(File eventDataFolder, ZoneId partitionZone) {
        this.eventDataFolder = eventDataFolder;
        this.partitionZone = partitionZone;
        if (!eventDataFolder.exists()) {
            eventDataFolder.mkdirs();
        }
    }

    @Override
    public String name() {
        return "json-events[" + eventDataFolder + "]";
    }

    @Override
    public void checkHealth() throws CollaboratorUnavailableException {
        if (!eventDataFolder.isDirectory() || !Files.isWritable(eventDataFolder.toPath())) {
            throw new CollaboratorUnavailableException(name(), "Event data folder is not a writable directory");
        }
    }

    protected BufferedWriter getEventFileWriter(LocalDate date) throws IOException {
        String partition = date.format(DATE_FORMATTER);
        if (!partition.equals(currentPartition)) {
            if (currentEventFileWriter != null) {
                currentEventFileWriter.close();
                currentEventFileWriter = null;
                currentPartition = null;
            }
            File partitionFolder = new File(eventDataFolder, partition);
            if (!partitionFolder.exists()) {
                partitionFolder.mkdirs();
            }
            File eventFile = new File(partitionFolder, EVENTS_FILENAME);
            LOGGER.info("Writing events to {}", eventFile);
            currentEventFileWriter = Files.newBufferedWriter(eventFile.toPath(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            currentPartition = partition;
        }
        return checkNotNull(currentEventFileWriter);
    }

    @Override
    public synchronized void write(Event event) throws IOException {
        String line = mapper.writeValueAsString(event);
        BufferedWriter writer = getEventFileWriter(event.timestamp().atZone(partitionZone).toLocalDate());
        writer.write(line);
        writer.newLine();
        //One durable line per event
        writer.flush();
    }

    @Override
    public synchronized void flush() throws IOException {
        if (currentEventFileWriter != null) {
            currentEventFileWriter.flush();
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (currentEventFileWriter != null) {
            currentEventFileWriter.close();
            currentEventFileWriter = null;
            currentPartition = null;
        }
    }
}
