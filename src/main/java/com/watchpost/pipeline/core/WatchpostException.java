package com.watchpost.pipeline.core;

/** Base of all checked pipeline errors. */
public class WatchpostException extends Exception {
    public WatchpostException(String message) {
        super(message);
    }

    public WatchpostException(String message, Throwable cause) {
        super(message, cause);
    }
}
