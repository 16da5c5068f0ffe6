package com.watchpost.pipeline.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchpost.pipeline.core.ObjectMappers;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes each event to the application log. */
public class LoggingEventSink implements EventSink {
    final static Logger LOGGER = LoggerFactory.getLogger(LoggingEventSink.class);

    final ObjectMapper mapper = ObjectMappers.json();

    @Override
    public String name() {
        return "log-events";
    }

    @Override
    public void write(Event event) throws IOException {
        LOGGER.info("EVENT [{}] {} at {}: {}", event.eventId(), event.cameraName(), event.timestamp(), event.description());
        LOGGER.debug("EVENT JSON {}", mapper.writeValueAsString(event));
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }
}
