package com.watchpost.pipeline.config;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.watchpost.pipeline.dedup.SuppressionRefreshPolicy;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import org.immutables.value.Value;

import javax.annotation.Nullable;

@Value.Immutable
@JsonSerialize(as = ImmutableConfig.class)
@JsonDeserialize(as = ImmutableConfig.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public interface Config {
    long BYTES_PER_GB = 1024L * 1024L * 1024L;

    /** Username / password creds */
    @Value.Immutable
    @JsonSerialize(as = ImmutableCredentials.class)
    @JsonDeserialize(as = ImmutableCredentials.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    interface Credentials {
        @JsonProperty
        String username();
        @JsonProperty
        String password();
    }

    interface Camera {
        /** Frames are scaled to this size by ffmpeg before they reach the motion gate */
        @Value.Default
        @JsonProperty
        default int frameWidth() { return 640; }

        @Value.Default
        @JsonProperty
        default int frameHeight() { return 360; }

        /** Decoded frames per second handed to the pipeline */
        @Value.Default
        @JsonProperty
        default int frameRate() { return 5; }
    }

    /** RTSP camera */
    @Value.Immutable
    @JsonSerialize(as = ImmutableRtspCamera.class)
    @JsonDeserialize(as = ImmutableRtspCamera.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    interface RtspCamera extends Camera {
        @JsonProperty
        String rtspUrl();

        @JsonProperty
        @Nullable
        Credentials credentials();
    }

    /** Camera defined directly by ffmpeg input arguments */
    @Value.Immutable
    @JsonSerialize(as = ImmutableCommandCamera.class)
    @JsonDeserialize(as = ImmutableCommandCamera.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    interface CommandCamera extends Camera {
        @JsonProperty
        String commandPrefix();
    }

    // ---------------- Folders ----------------

    @JsonProperty
    @Nullable
    String log4jFolder();

    /** Root of the date-partitioned event data (events.json + images) */
    @JsonProperty
    String eventDataFolder();

    @Value.Default
    @JsonProperty
    default String operationsLogFolder() { return "logs/operations"; }

    @Value.Default
    @JsonProperty
    default String metricsLogFile() { return "logs/metrics.json"; }

    // ---------------- Camera / acquisition ----------------

    @Value.Default
    @JsonProperty
    default String cameraName() { return "camera_1"; }

    @JsonProperty
    @Nullable
    RtspCamera rtspCamera();

    @JsonProperty
    @Nullable
    CommandCamera commandCamera();

    /** ffmpeg's -timeout parameter (socket timeout in microseconds)
     * Default 1 second (1000000 us)*/
    @Value.Default
    @JsonProperty
    default Long socketTimeout_us() { return 1000000L; }

    @Value.Default
    @JsonProperty
    default int queueCapacity() { return 100; }

    @Value.Default
    @JsonProperty
    default long queuePollMillis() { return 100L; }

    @Value.Default
    @JsonProperty
    default long readTimeoutSeconds() { return 5L; }

    @Value.Default
    @JsonProperty
    default long reconnectInitialDelaySeconds() { return 1L; }

    @Value.Default
    @JsonProperty
    default long reconnectMaxDelaySeconds() { return 8L; }

    @Value.Default
    @JsonProperty
    default int maxConsecutiveReconnectFailures() { return 5; }

    /** When false, exhausting reconnect attempts shuts the pipeline down */
    @Value.Default
    @JsonProperty
    default boolean keepRetryingAfterReconnectFailure() { return false; }

    // ---------------- Motion / sampling ----------------

    /** Fraction of the frame area that must differ from the background */
    @Value.Default
    @JsonProperty
    default double motionThreshold() { return 0.02; }

    @Value.Default
    @JsonProperty
    default int motionLearningFrames() { return 100; }

    @Value.Default
    @JsonProperty
    default int motionHistoryFrames() { return 500; }

    /** Minimum luminance deviation (grey levels) for a pixel to count as changed */
    @Value.Default
    @JsonProperty
    default double motionPixelNoiseThreshold() { return 15.0; }

    /** Squared deviation in units of background variance */
    @Value.Default
    @JsonProperty
    default double motionVarianceThreshold() { return 16.0; }

    @Value.Default
    @JsonProperty
    default int samplingRate() { return 1; }

    // ---------------- Inference ----------------

    @Value.Default
    @JsonProperty
    default double minObjectConfidence() { return 0.5; }

    @Value.Default
    @JsonProperty
    default List<String> ignoredLabels() { return List.of(); }

    @Value.Default
    @JsonProperty
    default long classificationTimeoutMillis() { return 1000L; }

    @Value.Default
    @JsonProperty
    default long descriptionTimeoutSeconds() { return 10L; }

    // ---------------- De-duplication ----------------

    @Value.Default
    @JsonProperty
    default long suppressionWindowSeconds() { return 30L; }

    @Value.Default
    @JsonProperty
    default double labelOverlapThreshold() { return 0.8; }

    @Value.Default
    @JsonProperty
    default int suppressionHistorySize() { return 5; }

    @Value.Default
    @JsonProperty
    default SuppressionRefreshPolicy suppressionRefreshPolicy() { return SuppressionRefreshPolicy.REFRESH_ON_EMIT; }

    // ---------------- Event output ----------------

    /** Write an annotated JPEG next to each event */
    @Value.Default
    @JsonProperty
    default boolean saveEventImages() { return true; }

    // ---------------- Storage ----------------

    @Value.Default
    @JsonProperty
    default double maxStorageGb() { return 4.0; }

    @Value.Default
    @JsonProperty
    default int minRetentionDays() { return 7; }

    /** Storage usage is measured every N written events */
    @Value.Default
    @JsonProperty
    default int storageCheckInterval() { return 100; }

    /** Zone that decides which date partition "today" is */
    @Value.Default
    @JsonProperty
    default String partitionZone() { return "UTC"; }

    // ---------------- Metrics / lifecycle ----------------

    @Value.Default
    @JsonProperty
    default long metricsIntervalSeconds() { return 60L; }

    @Value.Default
    @JsonProperty
    default int metricsWindowSize() { return 1000; }

    @Value.Default
    @JsonProperty
    default long drainTimeoutSeconds() { return 10L; }

    /** Reload configuration when the config file changes */
    @Value.Default
    @JsonProperty
    default boolean watchConfigFile() { return true; }

    default long maxStorageBytes() {
        return (long) (maxStorageGb() * BYTES_PER_GB);
    }

    default ZoneId partitionZoneId() {
        return ZoneId.of(partitionZone());
    }

    default Camera camera() {
        RtspCamera rtspCamera = rtspCamera();
        return rtspCamera != null ? rtspCamera : checkNotNull(commandCamera());
    }

    @Value.Check
    default void validate() {
        checkState(!eventDataFolder().isBlank(), "eventDataFolder must be set");
        checkState(rtspCamera() != null ^ commandCamera() != null,
                "Exactly one of rtspCamera / commandCamera must be set");
        checkState(queueCapacity() > 0, "queueCapacity must be positive, got %s", queueCapacity());
        checkState(queuePollMillis() > 0, "queuePollMillis must be positive, got %s", queuePollMillis());
        checkState(readTimeoutSeconds() > 0, "readTimeoutSeconds must be positive, got %s", readTimeoutSeconds());
        checkState(reconnectInitialDelaySeconds() > 0 && reconnectMaxDelaySeconds() >= reconnectInitialDelaySeconds(),
                "reconnect delays must satisfy 0 < initial <= max, got %s / %s",
                reconnectInitialDelaySeconds(), reconnectMaxDelaySeconds());
        checkState(maxConsecutiveReconnectFailures() > 0,
                "maxConsecutiveReconnectFailures must be positive, got %s", maxConsecutiveReconnectFailures());
        checkState(motionThreshold() >= 0.0 && motionThreshold() <= 1.0,
                "motionThreshold must be within [0, 1], got %s", motionThreshold());
        checkState(motionLearningFrames() >= 0, "motionLearningFrames must not be negative");
        checkState(motionHistoryFrames() > 0, "motionHistoryFrames must be positive");
        checkState(motionPixelNoiseThreshold() >= 0.0, "motionPixelNoiseThreshold must not be negative");
        checkState(motionVarianceThreshold() >= 0.0, "motionVarianceThreshold must not be negative");
        checkState(samplingRate() >= 1, "samplingRate must be at least 1, got %s", samplingRate());
        checkState(minObjectConfidence() >= 0.0 && minObjectConfidence() <= 1.0,
                "minObjectConfidence must be within [0, 1], got %s", minObjectConfidence());
        checkState(classificationTimeoutMillis() > 0, "classificationTimeoutMillis must be positive");
        checkState(descriptionTimeoutSeconds() > 0, "descriptionTimeoutSeconds must be positive");
        checkState(suppressionWindowSeconds() > 0, "suppressionWindowSeconds must be positive");
        checkState(labelOverlapThreshold() > 0.0 && labelOverlapThreshold() <= 1.0,
                "labelOverlapThreshold must be within (0, 1], got %s", labelOverlapThreshold());
        checkState(suppressionHistorySize() > 0, "suppressionHistorySize must be positive");
        checkState(maxStorageGb() > 0.0, "maxStorageGb must be positive, got %s", maxStorageGb());
        checkState(minRetentionDays() >= 1, "minRetentionDays must be at least 1, got %s", minRetentionDays());
        checkState(storageCheckInterval() > 0, "storageCheckInterval must be positive");
        checkState(metricsIntervalSeconds() > 0, "metricsIntervalSeconds must be positive");
        checkState(metricsWindowSize() > 0, "metricsWindowSize must be positive");
        checkState(drainTimeoutSeconds() > 0, "drainTimeoutSeconds must be positive");
        try {
            ZoneId.of(partitionZone());
        } catch (DateTimeException e) {
            throw new IllegalStateException("partitionZone is not a valid zone id: " + partitionZone(), e);
        }
    }
}
