package com.watchpost.pipeline.core;

public class ConfigurationException extends WatchpostException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
