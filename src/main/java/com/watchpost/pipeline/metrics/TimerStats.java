package com.watchpost.pipeline.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Arrays;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableTimerStats.class)
@JsonDeserialize(as = ImmutableTimerStats.class)
public interface TimerStats {
    @JsonProperty
    long count();

    @JsonProperty
    double mean();

    @JsonProperty
    double p95();

    @JsonProperty
    long min();

    @JsonProperty
    long max();

    static TimerStats empty() {
        return ImmutableTimerStats.builder().count(0).mean(0.0).p95(0.0).min(0).max(0).build();
    }

    /** Takes ownership of {@code samples}, which gets sorted in place. */
    static TimerStats of(long[] samples) {
        if (samples.length == 0) {
            return empty();
        }
        Arrays.sort(samples);
        long sum = 0;
        for (long sample : samples) {
            sum += sample;
        }
        return ImmutableTimerStats.builder()
                .count(samples.length)
                .mean((double) sum / samples.length)
                .p95(percentile(samples, 0.95))
                .min(samples[0])
                .max(samples[samples.length - 1])
                .build();
    }

    /** Linear interpolation between closest ranks over sorted samples. */
    static double percentile(long[] sorted, double fraction) {
        double rank = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }
}
