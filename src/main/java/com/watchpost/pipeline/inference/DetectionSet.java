package com.watchpost.pipeline.inference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import org.immutables.value.Value;

/** Detections found in one frame. */
@Value.Immutable
@JsonSerialize(as = ImmutableDetectionSet.class)
@JsonDeserialize(as = ImmutableDetectionSet.class)
public interface DetectionSet {
    @JsonProperty
    List<Detection> detections();

    /** Sorted distinct labels; this is the de-duplication signature. */
    @JsonIgnore
    @Value.Lazy
    default ImmutableSortedSet<String> labels() {
        ImmutableSortedSet.Builder<String> labels = ImmutableSortedSet.naturalOrder();
        for (Detection detection : detections()) {
            labels.add(detection.label());
        }
        return labels.build();
    }

    @JsonIgnore
    default boolean hasDetections() {
        return !detections().isEmpty();
    }

    static DetectionSet empty() {
        return ImmutableDetectionSet.builder().build();
    }

    static DetectionSet of(Detection... detections) {
        return ImmutableDetectionSet.builder().addDetections(detections).build();
    }

    static DetectionSet of(Iterable<? extends Detection> detections) {
        return ImmutableDetectionSet.builder().addAllDetections(detections).build();
    }
}
