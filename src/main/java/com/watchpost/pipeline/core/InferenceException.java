package com.watchpost.pipeline.core;

/** Classification or description call failed or exceeded its time limit. */
public class InferenceException extends WatchpostException {
    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
