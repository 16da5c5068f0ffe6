package com.watchpost.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Charsets;
import com.google.common.io.Resources;
import com.watchpost.pipeline.core.ConfigurationException;
import com.watchpost.pipeline.core.ObjectMappers;
import java.io.File;
import java.io.IOException;
import java.net.URL;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link Config} from a YAML file, falling back to a classpath resource of the same name.
 * Validation runs in {@link ImmutableConfig}'s constructor ({@code Config.validate()}).
 */
public class YamlConfigSource implements ConfigSource {
    final static Logger LOGGER = LoggerFactory.getLogger(YamlConfigSource.class);

    final String configName;
    final ObjectMapper mapper;

    public YamlConfigSource(String configName) {
        this.configName = configName;
        this.mapper = ObjectMappers.yaml();
    }

    /** The config file on disk, or null when the config comes from the classpath. */
    @Nullable
    public File configFile() {
        File configFile = new File(configName);
        return configFile.exists() ? configFile : null;
    }

    @Override
    public Config load() throws ConfigurationException {
        try {
            File configFile = configFile();
            if (configFile != null) {
                LOGGER.info("Loading configuration from file {}", configFile.getAbsolutePath());
                return mapper.readValue(configFile, Config.class);
            } else {
                URL resource = Resources.getResource(configName);
                LOGGER.info("Loading configuration from classpath resource {}", resource);
                String resourceStr = Resources.toString(resource, Charsets.UTF_8);
                return mapper.readValue(resourceStr, Config.class);
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(String.format("Configuration [%s] not found: %s", configName, e.getMessage()), e);
        } catch (IOException e) {
            //Jackson wraps failures of Config.validate() into ValueInstantiationException (an IOException)
            throw new ConfigurationException(String.format("Configuration [%s] is invalid: %s",
                    configName, rootMessage(e)), e);
        } catch (IllegalStateException e) {
            throw new ConfigurationException(String.format("Configuration [%s] is invalid: %s", configName, e.getMessage()), e);
        }
    }

    @Override
    public String describe() {
        return configName;
    }

    static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return String.valueOf(cause.getMessage()).replace('\n', ' ');
    }
}
