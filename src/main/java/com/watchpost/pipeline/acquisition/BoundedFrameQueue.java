package com.watchpost.pipeline.acquisition;

import static com.google.common.base.Preconditions.checkArgument;

import com.watchpost.pipeline.metrics.MetricsAggregator;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;

/**
 * Fixed-capacity frame buffer between acquisition and processing. {@link #push} never blocks:
 * when full the oldest frame is dropped so the consumer always sees the most recent footage.
 */
public class BoundedFrameQueue {
    public enum PushOutcome {
        ACCEPTED,
        EVICTED_OLDEST
    }

    final int capacity;
    final MetricsAggregator metrics;
    final ArrayDeque<Frame> frames;
    final ReentrantLock lock = new ReentrantLock();
    final Condition notEmpty = lock.newCondition();

    public BoundedFrameQueue(int capacity, MetricsAggregator metrics) {
        checkArgument(capacity > 0, "capacity must be positive, got %s", capacity);
        this.capacity = capacity;
        this.metrics = metrics;
        this.frames = new ArrayDeque<>(capacity);
    }

    public PushOutcome push(Frame frame) {
        PushOutcome outcome = PushOutcome.ACCEPTED;
        lock.lock();
        try {
            if (frames.size() >= capacity) {
                frames.pollFirst();
                outcome = PushOutcome.EVICTED_OLDEST;
            }
            frames.addLast(frame);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
        if (outcome == PushOutcome.EVICTED_OLDEST) {
            metrics.increment(MetricsAggregator.Counter.FRAMES_DROPPED);
        }
        return outcome;
    }

    /** @return the oldest frame, or null if none arrived within {@code timeout} */
    @Nullable
    public Frame pop(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (frames.isEmpty()) {
                if (nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return frames.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    @Nullable
    public Frame poll() {
        lock.lock();
        try {
            return frames.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return frames.size();
        } finally {
            lock.unlock();
        }
    }

    /** @return the number of frames discarded */
    public int clear() {
        lock.lock();
        try {
            int size = frames.size();
            frames.clear();
            return size;
        } finally {
            lock.unlock();
        }
    }
}
