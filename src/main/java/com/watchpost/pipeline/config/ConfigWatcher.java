package com.watchpost.pipeline.config;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches the config file's directory and fires the reload callback when the file is written.
 * {@link #poll()} is called periodically by the owner; it never blocks.
 */
public class ConfigWatcher implements Closeable {
    final static Logger LOGGER = LoggerFactory.getLogger(ConfigWatcher.class);

    final File configFile;
    final Runnable onChange;
    final WatchService watcher;

    public ConfigWatcher(File configFile, Runnable onChange) throws IOException {
        this.configFile = configFile.getAbsoluteFile();
        this.onChange = onChange;

        Path directoryPath = this.configFile.getParentFile().toPath();
        LOGGER.info("Starting config watcher: {}", this.configFile);
        this.watcher = FileSystems.getDefault().newWatchService();
        directoryPath.register(watcher, ENTRY_CREATE, ENTRY_MODIFY);
    }

    /** @return true if a change of the config file was seen */
    public boolean poll() {
        WatchKey watchKey = watcher.poll();
        boolean changed = false;
        if (watchKey != null) {
            List<WatchEvent<?>> events = watchKey.pollEvents();
            for (WatchEvent<?> event : events) {
                Object context = event.context();
                if (context instanceof Path && ((Path) context).getFileName().toString().equals(configFile.getName())) {
                    changed = true;
                }
            }
            watchKey.reset();
        }
        if (changed) {
            LOGGER.info("Config file changed: {}", configFile);
            onChange.run();
        }
        return changed;
    }

    @Override
    public void close() throws IOException {
        watcher.close();
    }
}
