package com.watchpost.pipeline.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/** Pixel rectangle in frame coordinates, origin top-left. */
@Value.Immutable
@JsonSerialize(as = ImmutableBoundingBox.class)
@JsonDeserialize(as = ImmutableBoundingBox.class)
public interface BoundingBox {
    @JsonProperty
    int x();

    @JsonProperty
    int y();

    @JsonProperty
    int width();

    @JsonProperty
    int height();

    static BoundingBox of(int x, int y, int width, int height) {
        return ImmutableBoundingBox.builder().x(x).y(y).width(width).height(height).build();
    }
}
