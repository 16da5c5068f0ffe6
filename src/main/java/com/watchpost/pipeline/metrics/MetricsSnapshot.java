package com.watchpost.pipeline.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import java.util.Map;
import org.immutables.value.Value;

/** Point-in-time copy of all counters and timer statistics. Keys are lower-case metric names. */
@Value.Immutable
@JsonSerialize(as = ImmutableMetricsSnapshot.class)
@JsonDeserialize(as = ImmutableMetricsSnapshot.class)
public interface MetricsSnapshot {
    @JsonProperty
    Instant timestamp();

    @JsonProperty
    Map<String, Long> counters();

    @JsonProperty
    Map<String, TimerStats> timers();

    default long counter(MetricsAggregator.Counter counter) {
        Long value = counters().get(counter.name().toLowerCase());
        return value == null ? 0L : value;
    }

    default TimerStats timer(MetricsAggregator.Timer timer) {
        TimerStats stats = timers().get(timer.name().toLowerCase());
        return stats == null ? TimerStats.empty() : stats;
    }
}
