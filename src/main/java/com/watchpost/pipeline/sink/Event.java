package com.watchpost.pipeline.sink;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.watchpost.pipeline.inference.Detection;
import java.time.Instant;
import java.util.List;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/** A confirmed, de-duplicated detection. Written once to every sink as a single JSON line. */
@Value.Immutable
@JsonSerialize(as = ImmutableEvent.class)
@JsonDeserialize(as = ImmutableEvent.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public interface Event {
    /** evt_{epochMillis}_{4 hex} */
    @JsonProperty
    String eventId();

    /** Capture time of the frame the event was detected in */
    @JsonProperty
    Instant timestamp();

    @JsonProperty
    String cameraName();

    @JsonProperty
    long frameSequence();

    @JsonProperty
    double motionConfidence();

    @JsonProperty
    List<Detection> detections();

    @JsonProperty
    String description();

    /** Annotated image path relative to the event data root */
    @JsonProperty
    @Nullable
    String imageRef();

    @JsonProperty
    long classificationMillis();

    @JsonProperty
    long descriptionMillis();

    @JsonProperty
    Instant createdAt();
}
