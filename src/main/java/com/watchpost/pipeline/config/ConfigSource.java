package com.watchpost.pipeline.config;

import com.watchpost.pipeline.core.ConfigurationException;

/** Supplies validated configuration; called at startup and again on every reload request. */
public interface ConfigSource {
    Config load() throws ConfigurationException;

    String describe();
}
