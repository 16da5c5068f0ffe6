package com.watchpost.pipeline.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class ObjectMappers {
    private ObjectMappers() {}

    /** JSON lines for events and metrics: ISO-8601 instants, one object per line. */
    public static ObjectMapper json() {
        return new ObjectMapper()
                .registerModule(new GuavaModule())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    public static ObjectMapper yaml() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new GuavaModule())
                .registerModule(new JavaTimeModule());
    }
}
