package com.watchpost.pipeline.metrics;

import java.io.Closeable;
import java.io.IOException;

public interface MetricsSink extends Closeable {
    void append(MetricsSnapshot snapshot) throws IOException;
}
