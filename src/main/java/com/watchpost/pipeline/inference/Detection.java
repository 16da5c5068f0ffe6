package com.watchpost.pipeline.inference;

import static com.google.common.base.Preconditions.checkState;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableDetection.class)
@JsonDeserialize(as = ImmutableDetection.class)
public interface Detection {
    @JsonProperty
    String label();

    @JsonProperty
    double confidence();

    @JsonProperty
    BoundingBox boundingBox();

    @Value.Check
    default void check() {
        checkState(!label().isBlank(), "Detection label must not be blank");
        checkState(confidence() >= 0.0 && confidence() <= 1.0,
                "Detection confidence must be within [0, 1], got %s", confidence());
    }

    static Detection of(String label, double confidence, BoundingBox boundingBox) {
        return ImmutableDetection.builder().label(label).confidence(confidence).boundingBox(boundingBox).build();
    }
}
