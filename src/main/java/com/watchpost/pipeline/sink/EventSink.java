package com.watchpost.pipeline.sink;

import com.watchpost.pipeline.core.Collaborator;
import java.io.Closeable;
import java.io.IOException;

/** Append-only event store. */
public interface EventSink extends Collaborator, Closeable {
    void write(Event event) throws IOException;

    void flush() throws IOException;
}
