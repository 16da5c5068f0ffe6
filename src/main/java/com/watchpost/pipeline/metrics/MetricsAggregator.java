package com.watchpost.pipeline.metrics;

import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe counters and rolling latency timers shared by every pipeline stage.
 * Counters never block; timers hold their own short lock only while recording or copying.
 */
public class MetricsAggregator {
    public enum Counter {
        FRAMES_SEEN,
        FRAMES_DROPPED,
        MOTION_FRAMES,
        FRAMES_SAMPLED,
        EVENTS_EMITTED,
        EVENTS_SUPPRESSED,
        EVENTS_FAILED,
        INFERENCE_FAILURES,
        FRAME_ERRORS,
        SINK_FAILURES
    }

    public enum Timer {
        CLASSIFICATION,
        DESCRIPTION,
        FRAME_PROCESSING
    }

    public static final int DEFAULT_WINDOW_SIZE = 1000;

    final Map<Counter, LongAdder> counters = new EnumMap<>(Counter.class);
    final Map<Timer, RollingTimer> timers = new EnumMap<>(Timer.class);

    public MetricsAggregator() {
        this(DEFAULT_WINDOW_SIZE);
    }

    public MetricsAggregator(int windowSize) {
        for (Counter counter : Counter.values()) {
            counters.put(counter, new LongAdder());
        }
        for (Timer timer : Timer.values()) {
            timers.put(timer, new RollingTimer(windowSize));
        }
    }

    public void increment(Counter counter) {
        counters.get(counter).increment();
    }

    public long count(Counter counter) {
        return counters.get(counter).sum();
    }

    public void record(Timer timer, long millis) {
        timers.get(timer).record(millis);
    }

    public TimerStats timerStats(Timer timer) {
        return timers.get(timer).stats();
    }

    public MetricsSnapshot snapshot() {
        ImmutableMap.Builder<String, Long> counterValues = ImmutableMap.builder();
        for (Map.Entry<Counter, LongAdder> entry : counters.entrySet()) {
            counterValues.put(entry.getKey().name().toLowerCase(), entry.getValue().sum());
        }
        ImmutableMap.Builder<String, TimerStats> timerValues = ImmutableMap.builder();
        for (Map.Entry<Timer, RollingTimer> entry : timers.entrySet()) {
            timerValues.put(entry.getKey().name().toLowerCase(), entry.getValue().stats());
        }
        return ImmutableMetricsSnapshot.builder()
                .timestamp(Instant.now())
                .counters(counterValues.build())
                .timers(timerValues.build())
                .build();
    }

    /** One-line human readable status, logged next to every published snapshot. */
    public static String statusLine(MetricsSnapshot snapshot) {
        long seen = snapshot.counter(Counter.FRAMES_SEEN);
        long motion = snapshot.counter(Counter.MOTION_FRAMES);
        double motionRate = seen == 0 ? 0.0 : (100.0 * motion) / seen;
        TimerStats classification = snapshot.timer(Timer.CLASSIFICATION);
        TimerStats description = snapshot.timer(Timer.DESCRIPTION);
        return String.format("frames=%d dropped=%d motion=%.1f%% sampled=%d events=%d suppressed=%d failed=%d "
                        + "classify_avg=%.1fms describe_avg=%.1fms",
                seen, snapshot.counter(Counter.FRAMES_DROPPED), motionRate,
                snapshot.counter(Counter.FRAMES_SAMPLED), snapshot.counter(Counter.EVENTS_EMITTED),
                snapshot.counter(Counter.EVENTS_SUPPRESSED), snapshot.counter(Counter.EVENTS_FAILED),
                classification.mean(), description.mean());
    }
}
