package com.watchpost.pipeline.core;

import java.time.Duration;

/** Waits between retries. Swapped out in tests to avoid real waits. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
}
