package com.watchpost.pipeline.pipeline;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Objects;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.watchpost.pipeline.acquisition.BoundedFrameQueue;
import com.watchpost.pipeline.acquisition.Frame;
import com.watchpost.pipeline.acquisition.FrameSource;
import com.watchpost.pipeline.acquisition.ReconnectSupervisor;
import com.watchpost.pipeline.config.Config;
import com.watchpost.pipeline.config.ConfigSource;
import com.watchpost.pipeline.config.ConfigWatcher;
import com.watchpost.pipeline.core.Collaborator;
import com.watchpost.pipeline.core.CollaboratorUnavailableException;
import com.watchpost.pipeline.core.ConfigurationException;
import com.watchpost.pipeline.core.FatalPipelineException;
import com.watchpost.pipeline.core.FatalReason;
import com.watchpost.pipeline.core.InferenceException;
import com.watchpost.pipeline.core.LogPipelineEventNotifier;
import com.watchpost.pipeline.core.PipelineEventNotifier;
import com.watchpost.pipeline.core.PipelineEventType;
import com.watchpost.pipeline.core.Sleeper;
import com.watchpost.pipeline.dedup.Deduplicator;
import com.watchpost.pipeline.inference.Classification;
import com.watchpost.pipeline.inference.ClassificationService;
import com.watchpost.pipeline.inference.Description;
import com.watchpost.pipeline.inference.DescriptionService;
import com.watchpost.pipeline.inference.DetectionSet;
import com.watchpost.pipeline.inference.InferenceStage;
import com.watchpost.pipeline.metrics.JsonLinesMetricsSink;
import com.watchpost.pipeline.metrics.MetricsAggregator;
import com.watchpost.pipeline.metrics.MetricsSink;
import com.watchpost.pipeline.metrics.MetricsSnapshot;
import com.watchpost.pipeline.motion.MotionGate;
import com.watchpost.pipeline.motion.MotionResult;
import com.watchpost.pipeline.motion.SamplingPolicy;
import com.watchpost.pipeline.sink.AnnotatedImageWriter;
import com.watchpost.pipeline.sink.DeliveryReport;
import com.watchpost.pipeline.sink.Event;
import com.watchpost.pipeline.sink.EventFanout;
import com.watchpost.pipeline.sink.EventIdGenerator;
import com.watchpost.pipeline.sink.EventSink;
import com.watchpost.pipeline.sink.ImmutableEvent;
import com.watchpost.pipeline.storage.StorageGovernor;
import com.watchpost.pipeline.storage.StorageLevel;
import com.watchpost.pipeline.storage.StorageStatus;
import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the pipeline lifecycle: STARTING (health checks) -> RUNNING -> DRAINING -> STOPPED, with
 * RELOADING_CONFIG entered from RUNNING. Frames are consumed by the thread that calls {@link #run()},
 * one at a time, so events are emitted in frame order.
 */
public class PipelineSupervisor {
    final static Logger LOGGER = LoggerFactory.getLogger(PipelineSupervisor.class);
    final static String REPORTER = "PipelineSupervisor";

    final FrameSource frameSource;
    @Nullable final ConfigSource configSource;
    final PipelineEventNotifier eventNotifier;
    final MetricsSink metricsSink;
    final Ticker ticker;
    final Clock clock;

    final MetricsAggregator metrics;
    final BoundedFrameQueue queue;
    final ReconnectSupervisor acquisition;
    final MotionGate motionGate;
    final SamplingPolicy samplingPolicy;
    final InferenceStage inference;
    final Deduplicator deduplicator;
    final EventIdGenerator eventIdGenerator;
    @Nullable final AnnotatedImageWriter imageWriter;
    final EventFanout fanout;
    final StorageGovernor storageGovernor;

    final AtomicReference<FatalPipelineException> fatal = new AtomicReference<>();
    final AtomicBoolean reloadRequested = new AtomicBoolean(false);
    final AtomicBoolean started = new AtomicBoolean(false);
    final CountDownLatch stoppedLatch = new CountDownLatch(1);

    volatile Config config;
    volatile PipelineState state = PipelineState.STARTING;
    volatile boolean shutdownRequested = false;
    @Nullable volatile ConfigWatcher configWatcher;

    PipelineSupervisor(Builder builder) {
        Config config = checkNotNull(builder.config, "config");
        FrameSource frameSource = checkNotNull(builder.frameSource, "frameSource");
        checkState(!builder.eventSinks.isEmpty(), "At least one event sink is required");

        this.config = config;
        this.frameSource = frameSource;
        this.configSource = builder.configSource;
        this.eventNotifier = builder.eventNotifier != null ? builder.eventNotifier : new LogPipelineEventNotifier();
        this.metricsSink = builder.metricsSink != null ? builder.metricsSink
                : new JsonLinesMetricsSink(new File(config.metricsLogFile()));
        this.ticker = builder.ticker;
        this.clock = builder.clock;

        this.metrics = new MetricsAggregator(config.metricsWindowSize());
        this.queue = new BoundedFrameQueue(config.queueCapacity(), metrics);
        this.acquisition = ReconnectSupervisor.fromConfig(config, frameSource, queue, eventNotifier,
                builder.reconnectSleeper);
        this.motionGate = MotionGate.fromConfig(config);
        this.samplingPolicy = new SamplingPolicy(config.samplingRate());
        this.inference = InferenceStage.fromConfig(config, builder.classificationService, builder.descriptionService, metrics);
        this.deduplicator = Deduplicator.fromConfig(config, ticker);
        this.eventIdGenerator = new EventIdGenerator(builder.clock);
        this.imageWriter = config.saveEventImages()
                ? new AnnotatedImageWriter(new File(config.eventDataFolder()), config.partitionZoneId())
                : null;
        this.fanout = new EventFanout(builder.eventSinks, metrics, eventNotifier);
        this.storageGovernor = StorageGovernor.fromConfig(config, builder.clock, eventNotifier);
    }

    public static Builder builder() {
        return new Builder();
    }

    public PipelineState state() {
        return state;
    }

    public MetricsAggregator metrics() {
        return metrics;
    }

    public Config config() {
        return config;
    }

    /** Polled from the consumer loop; a change of the file triggers {@link #requestReload()}. */
    public void watchConfig(ConfigWatcher configWatcher) {
        this.configWatcher = configWatcher;
    }

    /** Safe to call from any thread, including signal handlers. The first fatal reason wins. */
    public void requestShutdown(@Nullable FatalPipelineException reason) {
        if (reason != null) {
            if (fatal.compareAndSet(null, reason)) {
                LOGGER.error("Shutdown requested: {}", reason.diagnostic());
            }
        } else {
            LOGGER.info("Shutdown requested");
        }
        shutdownRequested = true;
    }

    public void requestReload() {
        reloadRequested.set(true);
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stoppedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<Collaborator> collaborators() {
        ImmutableList.Builder<Collaborator> collaborators = ImmutableList.builder();
        collaborators.add(frameSource);
        collaborators.addAll(inference.collaborators());
        collaborators.addAll(fanout.sinks());
        return collaborators.build();
    }

    /** Checks every collaborator; used at startup and by dry-run. */
    public void runHealthChecks() throws FatalPipelineException {
        for (Collaborator collaborator : collaborators()) {
            try {
                collaborator.checkHealth();
                LOGGER.info("Health check passed: {}", collaborator.name());
            } catch (CollaboratorUnavailableException e) {
                eventNotifier.notifyEvent(REPORTER, PipelineEventType.COLLABORATOR_UNAVAILABLE, config.cameraName(),
                        "Health check failed: " + collaborator.name(), e.getMessage());
                throw new FatalPipelineException(FatalReason.STARTUP_HEALTH_CHECK_FAILED, e.getMessage(), e);
            }
        }
        if (inference.isMotionOnly()) {
            LOGGER.warn("No classification service available, running in motion-only mode");
        }
    }

    /** Blocks until the pipeline has stopped. */
    public PipelineOutcome run() {
        checkState(started.compareAndSet(false, true), "Pipeline can only be run once");
        LOGGER.info("Starting pipeline for camera [{}]", config.cameraName());
        eventNotifier.notifyEvent(REPORTER, PipelineEventType.PIPELINE_PROCESS, config.cameraName(),
                "Pipeline starting", null);
        try {
            startup();
            acquisition.setFatalListener(this::onAcquisitionFatal);
            acquisition.start();
            transition(PipelineState.RUNNING);
            runLoop();
        } catch (FatalPipelineException e) {
            requestShutdown(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Pipeline interrupted, draining");
        }
        return drain();
    }

    void startup() throws FatalPipelineException {
        runHealthChecks();
        StorageStatus storageStatus;
        try {
            storageStatus = storageGovernor.checkUsage();
        } catch (IOException e) {
            throw new FatalPipelineException(FatalReason.STARTUP_HEALTH_CHECK_FAILED,
                    "Can't measure event data folder: " + e.getMessage(), e);
        }
        if (storageStatus.level() == StorageLevel.CRITICAL) {
            throw storageFatal(storageStatus);
        }
    }

    void runLoop() throws InterruptedException {
        long lastMetricsNanos = ticker.read();
        while (!shutdownRequested) {
            ConfigWatcher watcher = configWatcher;
            if (watcher != null) {
                watcher.poll();
            }
            if (reloadRequested.getAndSet(false)) {
                reload();
            }

            Frame frame = queue.pop(Duration.ofMillis(config.queuePollMillis()));
            if (frame != null) {
                processFrame(frame);
            }

            long now = ticker.read();
            if (now - lastMetricsNanos >= TimeUnit.SECONDS.toNanos(config.metricsIntervalSeconds())) {
                publishMetrics();
                lastMetricsNanos = now;
            }
        }
    }

    /** Errors of a single frame are counted and logged here and never leave this method. */
    void processFrame(Frame frame) throws InterruptedException {
        Stopwatch stopwatch = Stopwatch.createStarted();
        metrics.increment(MetricsAggregator.Counter.FRAMES_SEEN);
        try {
            MotionResult motion = motionGate.evaluate(frame);
            if (!motion.hasMotion()) {
                return;
            }
            metrics.increment(MetricsAggregator.Counter.MOTION_FRAMES);
            if (!samplingPolicy.onMotionFrame()) {
                return;
            }
            metrics.increment(MetricsAggregator.Counter.FRAMES_SAMPLED);

            Classification classification;
            try {
                classification = inference.classify(motion);
            } catch (InferenceException e) {
                LOGGER.warn("Classification of frame {} failed, skipping: {}", frame.sequence(), e.getMessage());
                return;
            }
            DetectionSet detections = classification.detections();
            if (!detections.hasDetections()) {
                return;
            }
            if (!deduplicator.shouldEmit(detections)) {
                metrics.increment(MetricsAggregator.Counter.EVENTS_SUPPRESSED);
                return;
            }

            Description description = inference.describe(frame, detections);
            String eventId = eventIdGenerator.nextId();
            String imageRef = null;
            if (imageWriter != null) {
                try {
                    imageRef = imageWriter.write(eventId, frame.captureTime(), frame, detections);
                } catch (IOException e) {
                    LOGGER.warn("Can't save image for event {}: {}", eventId, e.getMessage());
                }
            }

            Event event = ImmutableEvent.builder()
                    .eventId(eventId)
                    .timestamp(frame.captureTime())
                    .cameraName(config.cameraName())
                    .frameSequence(frame.sequence())
                    .motionConfidence(motion.confidence())
                    .detections(detections.detections())
                    .description(description.text())
                    .imageRef(imageRef)
                    .classificationMillis(classification.millis())
                    .descriptionMillis(description.millis())
                    .createdAt(Instant.now(clock))
                    .build();

            DeliveryReport report = fanout.deliver(event);
            if (!report.primaryDelivered()) {
                metrics.increment(MetricsAggregator.Counter.EVENTS_FAILED);
                return;
            }
            metrics.increment(MetricsAggregator.Counter.EVENTS_EMITTED);
            LOGGER.info("Event {} emitted: {}", eventId, detections.labels());
            checkStorage();
        } catch (RuntimeException e) {
            metrics.increment(MetricsAggregator.Counter.FRAME_ERRORS);
            LOGGER.error("Error processing frame {}", frame.sequence(), e);
        } finally {
            metrics.record(MetricsAggregator.Timer.FRAME_PROCESSING, stopwatch.elapsed(TimeUnit.MILLISECONDS));
        }
    }

    void checkStorage() {
        try {
            StorageStatus status = storageGovernor.onEventWritten();
            if (status != null && status.level() == StorageLevel.CRITICAL) {
                requestShutdown(storageFatal(status));
            }
        } catch (IOException e) {
            LOGGER.error("Storage check failed", e);
        }
    }

    static FatalPipelineException storageFatal(StorageStatus status) {
        FatalReason reason = status.retentionConflict()
                ? FatalReason.RETENTION_FLOOR_CONFLICT
                : FatalReason.STORAGE_LIMIT_EXCEEDED;
        return new FatalPipelineException(reason, String.format(
                "%d of %d bytes used (%.1f%%), retention floor %d days, %d days retained",
                status.snapshot().totalBytes(), status.snapshot().limitBytes(), status.snapshot().percentUsed(),
                status.retentionFloorDays(), status.retainedDays()));
    }

    void onAcquisitionFatal(FatalPipelineException e) {
        //The running acquisition thread decides, not the reloaded config
        if (acquisition.keepRetrying()) {
            LOGGER.error("{}; acquisition keeps retrying", e.diagnostic());
        } else {
            requestShutdown(e);
        }
    }

    void publishMetrics() {
        MetricsSnapshot snapshot = metrics.snapshot();
        LOGGER.info("STATUS {}", MetricsAggregator.statusLine(snapshot));
        try {
            metricsSink.append(snapshot);
        } catch (IOException e) {
            LOGGER.error("Can't write metrics snapshot", e);
        }
    }

    // ---------------- Reload ----------------

    void reload() {
        if (configSource == null) {
            LOGGER.warn("Reload requested but there is no config source");
            return;
        }
        transition(PipelineState.RELOADING_CONFIG);
        try {
            Config newConfig = configSource.load();
            List<String> restartRequired = restartRequiredChanges(config, newConfig);
            applyConfig(newConfig);
            String details = restartRequired.isEmpty() ? null : "Require restart, not applied: " + restartRequired;
            if (!restartRequired.isEmpty()) {
                LOGGER.warn("Changed settings {} only take effect after a restart", restartRequired);
            }
            LOGGER.info("Configuration reloaded from {}", configSource.describe());
            eventNotifier.notifyEvent(REPORTER, PipelineEventType.CONFIG_RELOADED, config.cameraName(),
                    "Configuration reloaded", details);
        } catch (ConfigurationException e) {
            LOGGER.error("Configuration reload rejected, keeping previous configuration: {}", e.getMessage());
            eventNotifier.notifyEvent(REPORTER, PipelineEventType.CONFIG_RELOAD_REJECTED, config.cameraName(),
                    "Configuration reload rejected", e.getMessage());
        } finally {
            transition(PipelineState.RUNNING);
        }
    }

    void applyConfig(Config newConfig) {
        motionGate.reconfigure(newConfig.motionThreshold(), newConfig.motionLearningFrames(),
                newConfig.motionHistoryFrames(), newConfig.motionPixelNoiseThreshold(), newConfig.motionVarianceThreshold());
        samplingPolicy.setSamplingRate(newConfig.samplingRate());
        inference.reconfigure(newConfig.minObjectConfidence(), newConfig.ignoredLabels(),
                Duration.ofMillis(newConfig.classificationTimeoutMillis()),
                Duration.ofSeconds(newConfig.descriptionTimeoutSeconds()));
        deduplicator.reconfigure(Duration.ofSeconds(newConfig.suppressionWindowSeconds()),
                newConfig.labelOverlapThreshold(), newConfig.suppressionHistorySize(),
                newConfig.suppressionRefreshPolicy());
        storageGovernor.reconfigure(newConfig.maxStorageBytes(), newConfig.storageCheckInterval(),
                newConfig.minRetentionDays());
        //Settings that need a restart keep their running values
        this.config = newConfig;
    }

    static List<String> restartRequiredChanges(Config current, Config next) {
        List<String> changes = new ArrayList<>();
        addIfChanged(changes, "eventDataFolder", current.eventDataFolder(), next.eventDataFolder());
        addIfChanged(changes, "operationsLogFolder", current.operationsLogFolder(), next.operationsLogFolder());
        addIfChanged(changes, "metricsLogFile", current.metricsLogFile(), next.metricsLogFile());
        addIfChanged(changes, "log4jFolder", current.log4jFolder(), next.log4jFolder());
        addIfChanged(changes, "cameraName", current.cameraName(), next.cameraName());
        addIfChanged(changes, "rtspCamera", current.rtspCamera(), next.rtspCamera());
        addIfChanged(changes, "commandCamera", current.commandCamera(), next.commandCamera());
        addIfChanged(changes, "socketTimeout_us", current.socketTimeout_us(), next.socketTimeout_us());
        addIfChanged(changes, "queueCapacity", current.queueCapacity(), next.queueCapacity());
        addIfChanged(changes, "readTimeoutSeconds", current.readTimeoutSeconds(), next.readTimeoutSeconds());
        addIfChanged(changes, "reconnectInitialDelaySeconds",
                current.reconnectInitialDelaySeconds(), next.reconnectInitialDelaySeconds());
        addIfChanged(changes, "reconnectMaxDelaySeconds",
                current.reconnectMaxDelaySeconds(), next.reconnectMaxDelaySeconds());
        addIfChanged(changes, "maxConsecutiveReconnectFailures",
                current.maxConsecutiveReconnectFailures(), next.maxConsecutiveReconnectFailures());
        addIfChanged(changes, "keepRetryingAfterReconnectFailure",
                current.keepRetryingAfterReconnectFailure(), next.keepRetryingAfterReconnectFailure());
        addIfChanged(changes, "partitionZone", current.partitionZone(), next.partitionZone());
        addIfChanged(changes, "metricsWindowSize", current.metricsWindowSize(), next.metricsWindowSize());
        addIfChanged(changes, "saveEventImages", current.saveEventImages(), next.saveEventImages());
        return changes;
    }

    static void addIfChanged(List<String> changes, String name, @Nullable Object current, @Nullable Object next) {
        if (!Objects.equal(current, next)) {
            changes.add(name);
        }
    }

    // ---------------- Drain ----------------

    PipelineOutcome drain() {
        transition(PipelineState.DRAINING);
        boolean interrupted = Thread.interrupted();
        Duration ceiling = Duration.ofSeconds(config.drainTimeoutSeconds());
        LOGGER.info("Draining pipeline, ceiling {}", ceiling);

        ExecutorService drainExecutor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("drain-%d")
                .setDaemon(true)
                .build());
        Future<?> drainTask = drainExecutor.submit(() -> {
            drainSteps(ceiling);
            return null;
        });
        try {
            drainTask.get(ceiling.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            drainTask.cancel(true);
            FatalPipelineException drainTimeout = new FatalPipelineException(FatalReason.DRAIN_TIMEOUT,
                    "Drain didn't finish within " + ceiling);
            fatal.compareAndSet(null, drainTimeout);
            LOGGER.error(drainTimeout.diagnostic());
            eventNotifier.notifyEvent(REPORTER, PipelineEventType.DRAIN_TIMEOUT, config.cameraName(),
                    "Drain timed out", drainTimeout.getMessage());
        } catch (ExecutionException e) {
            LOGGER.error("Error while draining", e.getCause());
        } catch (InterruptedException e) {
            interrupted = true;
            drainTask.cancel(true);
            LOGGER.warn("Interrupted while draining");
        } finally {
            drainExecutor.shutdownNow();
            inference.close();
        }

        PipelineOutcome outcome = fatal.get() == null ? PipelineOutcome.clean() : PipelineOutcome.fatal(fatal.get());
        transition(PipelineState.STOPPED);
        eventNotifier.notifyEvent(REPORTER, PipelineEventType.PIPELINE_PROCESS, config.cameraName(),
                "Pipeline stopped", outcome.diagnostic());
        stoppedLatch.countDown();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return outcome;
    }

    void drainSteps(Duration ceiling) throws InterruptedException, IOException {
        acquisition.stop(ceiling);
        int discarded = queue.clear();
        if (discarded > 0) {
            LOGGER.info("Discarded {} queued frames", discarded);
        }
        fanout.flushAndClose();
        publishMetrics();
        metricsSink.close();
        ConfigWatcher watcher = configWatcher;
        if (watcher != null) {
            watcher.close();
        }
    }

    void transition(PipelineState newState) {
        PipelineState oldState = state;
        state = newState;
        LOGGER.info("Pipeline {} -> {}", oldState, newState);
    }

    public static class Builder {
        @Nullable Config config;
        @Nullable ConfigSource configSource;
        @Nullable FrameSource frameSource;
        @Nullable ClassificationService classificationService;
        @Nullable DescriptionService descriptionService;
        final List<EventSink> eventSinks = new ArrayList<>();
        @Nullable MetricsSink metricsSink;
        @Nullable PipelineEventNotifier eventNotifier;
        @Nullable Sleeper reconnectSleeper;
        Ticker ticker = Ticker.systemTicker();
        Clock clock = Clock.systemUTC();

        public Builder config(Config config) {
            this.config = config;
            return this;
        }

        public Builder configSource(@Nullable ConfigSource configSource) {
            this.configSource = configSource;
            return this;
        }

        public Builder frameSource(FrameSource frameSource) {
            this.frameSource = frameSource;
            return this;
        }

        public Builder classificationService(@Nullable ClassificationService classificationService) {
            this.classificationService = classificationService;
            return this;
        }

        public Builder descriptionService(@Nullable DescriptionService descriptionService) {
            this.descriptionService = descriptionService;
            return this;
        }

        /** The first sink added is the primary one. */
        public Builder addEventSink(EventSink eventSink) {
            this.eventSinks.add(eventSink);
            return this;
        }

        public Builder metricsSink(MetricsSink metricsSink) {
            this.metricsSink = metricsSink;
            return this;
        }

        public Builder eventNotifier(PipelineEventNotifier eventNotifier) {
            this.eventNotifier = eventNotifier;
            return this;
        }

        public Builder reconnectSleeper(Sleeper reconnectSleeper) {
            this.reconnectSleeper = reconnectSleeper;
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PipelineSupervisor build() {
            return new PipelineSupervisor(this);
        }
    }
}
