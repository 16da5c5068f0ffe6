package com.watchpost.pipeline.metrics;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;

/** Latency samples over a fixed-size ring; statistics are computed on a copy outside the lock. */
class RollingTimer {
    final long[] window;
    int next;
    int size;

    RollingTimer(int windowSize) {
        checkArgument(windowSize > 0, "windowSize must be positive");
        this.window = new long[windowSize];
    }

    synchronized void record(long millis) {
        window[next] = millis;
        next = (next + 1) % window.length;
        if (size < window.length) {
            size++;
        }
    }

    TimerStats stats() {
        long[] samples;
        synchronized (this) {
            samples = Arrays.copyOf(window, size);
        }
        return TimerStats.of(samples);
    }
}
