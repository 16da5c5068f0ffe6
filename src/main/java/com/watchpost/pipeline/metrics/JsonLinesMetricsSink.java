package com.watchpost.pipeline.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchpost.pipeline.core.ObjectMappers;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Appends one JSON object per snapshot to a single metrics file. */
public class JsonLinesMetricsSink implements MetricsSink {
    final static Logger LOGGER = LoggerFactory.getLogger(JsonLinesMetricsSink.class);

    final File metricsFile;
    final ObjectMapper mapper = ObjectMappers.json();
    @Nullable BufferedWriter writer;

    public JsonLinesMetricsSink(File metricsFile) {
        this.metricsFile = metricsFile;
        File parent = metricsFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists()) {
            parent.mkdirs();
        }
    }

    @Override
    public synchronized void append(MetricsSnapshot snapshot) throws IOException {
        if (writer == null) {
            LOGGER.info("Opening metrics file {}", metricsFile.getAbsolutePath());
            writer = Files.newBufferedWriter(metricsFile.toPath(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        }
        writer.write(mapper.writeValueAsString(snapshot));
        writer.newLine();
        writer.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
        }
    }
}
