package com.watchpost.pipeline.acquisition;

import com.watchpost.pipeline.core.Collaborator;
import com.watchpost.pipeline.core.FrameSourceException;
import java.time.Duration;

/**
 * Pull-based camera stream. Only the acquisition thread calls it.
 * A source may be connected again after {@link #close()}.
 */
public interface FrameSource extends Collaborator {
    void connect() throws FrameSourceException;

    /** Waits at most {@code timeout} for the next frame. */
    FrameRead read(Duration timeout) throws FrameSourceException, InterruptedException;

    void close();
}
