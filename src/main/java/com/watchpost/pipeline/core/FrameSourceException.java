package com.watchpost.pipeline.core;

/** Camera stream could not be opened or broke in a way the source cannot recover from by itself. */
public class FrameSourceException extends WatchpostException {
    public FrameSourceException(String message) {
        super(message);
    }

    public FrameSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
