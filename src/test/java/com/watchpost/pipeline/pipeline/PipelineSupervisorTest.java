package com.watchpost.pipeline.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import com.watchpost.pipeline.acquisition.Frame;
import com.watchpost.pipeline.acquisition.ScriptedFrameSource;
import com.watchpost.pipeline.acquisition.TestFrames;
import com.watchpost.pipeline.config.Config;
import com.watchpost.pipeline.config.ConfigSource;
import com.watchpost.pipeline.config.ImmutableCommandCamera;
import com.watchpost.pipeline.config.ImmutableConfig;
import com.watchpost.pipeline.core.ConfigurationException;
import com.watchpost.pipeline.core.FatalPipelineException;
import com.watchpost.pipeline.core.FatalReason;
import com.watchpost.pipeline.core.ManualTicker;
import com.watchpost.pipeline.core.PipelineEventType;
import com.watchpost.pipeline.core.RecordingPipelineEventNotifier;
import com.watchpost.pipeline.inference.BoundingBox;
import com.watchpost.pipeline.inference.ClassificationService;
import com.watchpost.pipeline.inference.Detection;
import com.watchpost.pipeline.inference.DescriptionService;
import com.watchpost.pipeline.inference.DetectionSet;
import com.watchpost.pipeline.metrics.MetricsAggregator.Counter;
import com.watchpost.pipeline.metrics.MetricsSink;
import com.watchpost.pipeline.metrics.MetricsSnapshot;
import com.watchpost.pipeline.sink.Event;
import com.watchpost.pipeline.sink.EventSink;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import javax.annotation.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(30)
public class PipelineSupervisorTest {
    static final int WIDTH = 32;
    static final int HEIGHT = 24;
    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-07-10T12:00:00Z"), ZoneOffset.UTC);

    static class RecordingEventSink implements EventSink {
        final List<Event> events = new CopyOnWriteArrayList<>();
        volatile boolean closed;

        @Override
        public String name() {
            return "recording-sink";
        }

        @Override
        public void write(Event event) {
            events.add(event);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    static class RecordingMetricsSink implements MetricsSink {
        final List<MetricsSnapshot> snapshots = new CopyOnWriteArrayList<>();
        volatile boolean closed;

        @Override
        public void append(MetricsSnapshot snapshot) {
            snapshots.add(snapshot);
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    static class SwitchableConfigSource implements ConfigSource {
        volatile Config next;
        @Nullable volatile ConfigurationException failure;

        SwitchableConfigSource(Config next) {
            this.next = next;
        }

        @Override
        public Config load() throws ConfigurationException {
            ConfigurationException currentFailure = failure;
            if (currentFailure != null) {
                throw currentFailure;
            }
            return next;
        }

        @Override
        public String describe() {
            return "test config";
        }
    }

    static class PersonClassifier implements ClassificationService {
        @Override
        public String name() {
            return "person-classifier";
        }

        @Override
        public DetectionSet classify(Frame frame) {
            return DetectionSet.of(Detection.of("person", 0.9, BoundingBox.of(0, 0, 10, 10)));
        }
    }

    @TempDir
    Path eventData;

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    final RecordingPipelineEventNotifier notifier = new RecordingPipelineEventNotifier();
    final RecordingEventSink eventSink = new RecordingEventSink();
    final RecordingMetricsSink metricsSink = new RecordingMetricsSink();
    final ManualTicker ticker = new ManualTicker();

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    ImmutableConfig.Builder configBuilder() {
        return ImmutableConfig.builder()
                .eventDataFolder(eventData.toString())
                .cameraName("front_door")
                .commandCamera(ImmutableCommandCamera.builder()
                        .commandPrefix("ffmpeg -i test.mp4")
                        .frameWidth(WIDTH)
                        .frameHeight(HEIGHT)
                        .build())
                .motionLearningFrames(2)
                .saveEventImages(false)
                .queuePollMillis(10)
                .readTimeoutSeconds(1)
                .maxConsecutiveReconnectFailures(100)
                .drainTimeoutSeconds(5);
    }

    PipelineSupervisor.Builder supervisorBuilder(Config config) {
        return PipelineSupervisor.builder()
                .config(config)
                .addEventSink(eventSink)
                .metricsSink(metricsSink)
                .eventNotifier(notifier)
                .reconnectSleeper(delay -> { })
                .ticker(ticker)
                .clock(CLOCK);
    }

    /** Background at level 50 with pixels [from, to) at 200 */
    static Frame frame(long sequence, int from, int to) {
        Frame frame = TestFrames.gray(WIDTH, HEIGHT, 50, sequence);
        Arrays.fill(frame.pixels(), from, to, (byte) 200);
        return frame;
    }

    static void await(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(10);
        }
    }

    @Test
    public void motionFramesBecomeOneEventAndRepeatsAreSuppressed() throws Exception {
        QueueFrameSource source = new QueueFrameSource();
        PipelineSupervisor supervisor = supervisorBuilder(configBuilder().build())
                .frameSource(source)
                .classificationService(new PersonClassifier())
                .descriptionService(new DescriptionService() {
                    @Override
                    public String name() {
                        return "describer";
                    }

                    @Override
                    public String describe(Frame frame, DetectionSet detections) {
                        return "A person stands at the door";
                    }
                })
                .build();
        Future<PipelineOutcome> outcome = executor.submit(supervisor::run);

        //Three background frames: one to initialise, two while learning / settled
        source.offer(TestFrames.gray(WIDTH, HEIGHT, 50, 0));
        source.offer(TestFrames.gray(WIDTH, HEIGHT, 50, 1));
        source.offer(TestFrames.gray(WIDTH, HEIGHT, 50, 2));
        source.offer(frame(3, 0, 400));
        source.offer(frame(4, 400, WIDTH * HEIGHT));
        await("five frames", () -> supervisor.metrics().count(Counter.FRAMES_SEEN) == 5);
        assertEquals(PipelineState.RUNNING, supervisor.state());

        supervisor.requestShutdown(null);
        PipelineOutcome result = outcome.get(15, TimeUnit.SECONDS);

        assertTrue(result.isClean());
        assertEquals(0, result.exitCode());
        assertEquals(PipelineState.STOPPED, supervisor.state());
        assertTrue(supervisor.awaitStopped(Duration.ZERO));

        assertEquals(2, supervisor.metrics().count(Counter.MOTION_FRAMES));
        assertEquals(1, supervisor.metrics().count(Counter.EVENTS_EMITTED));
        assertEquals(1, supervisor.metrics().count(Counter.EVENTS_SUPPRESSED));

        assertEquals(1, eventSink.events.size());
        Event event = eventSink.events.get(0);
        assertTrue(event.eventId().matches("evt_\\d+_[0-9a-f]{4}"), event.eventId());
        assertEquals("front_door", event.cameraName());
        assertEquals(3, event.frameSequence());
        assertEquals("A person stands at the door", event.description());
        assertEquals("person", event.detections().get(0).label());
        assertNull(event.imageRef());
        assertEquals(CLOCK.instant(), event.createdAt());

        assertTrue(eventSink.closed);
        assertTrue(metricsSink.closed);
        assertFalse(metricsSink.snapshots.isEmpty());
        MetricsSnapshot last = metricsSink.snapshots.get(metricsSink.snapshots.size() - 1);
        assertEquals(5, last.counter(Counter.FRAMES_SEEN));
    }

    @Test
    public void motionOnlyModeEmitsWholeFrameMotionEvents() throws Exception {
        QueueFrameSource source = new QueueFrameSource();
        PipelineSupervisor supervisor = supervisorBuilder(configBuilder().build())
                .frameSource(source)
                .build();
        Future<PipelineOutcome> outcome = executor.submit(supervisor::run);

        for (int seq = 0; seq < 3; seq++) {
            source.offer(TestFrames.gray(WIDTH, HEIGHT, 50, seq));
        }
        source.offer(frame(3, 0, 400));
        await("motion event", () -> eventSink.events.size() == 1);
        supervisor.requestShutdown(null);
        assertTrue(outcome.get(15, TimeUnit.SECONDS).isClean());

        Event event = eventSink.events.get(0);
        assertEquals("motion", event.detections().get(0).label());
        assertEquals(WIDTH, event.detections().get(0).boundingBox().width());
        assertEquals("Detected: motion", event.description());
    }

    @Test
    public void failedHealthCheckStopsWithExitCodeOne() {
        QueueFrameSource source = new QueueFrameSource().unhealthy("ffmpeg not found");
        PipelineSupervisor supervisor = supervisorBuilder(configBuilder().build())
                .frameSource(source)
                .build();

        PipelineOutcome outcome = supervisor.run();

        assertEquals(FatalReason.STARTUP_HEALTH_CHECK_FAILED, outcome.fatal().getReason());
        assertEquals(1, outcome.exitCode());
        assertTrue(outcome.diagnostic().startsWith("FATAL [STARTUP_HEALTH_CHECK_FAILED]"), outcome.diagnostic());
        assertEquals(1, notifier.count(PipelineEventType.COLLABORATOR_UNAVAILABLE));
        assertEquals(PipelineState.STOPPED, supervisor.state());
    }

    @Test
    public void exhaustedReconnectsStopTheRun() {
        ScriptedFrameSource source = new ScriptedFrameSource().alwaysFailConnect();
        PipelineSupervisor supervisor = supervisorBuilder(configBuilder().maxConsecutiveReconnectFailures(3).build())
                .frameSource(source)
                .build();

        PipelineOutcome outcome = supervisor.run();

        assertEquals(FatalReason.RECONNECT_EXHAUSTED, outcome.fatal().getReason());
        assertEquals(1, outcome.exitCode());
        assertEquals(3, source.connectAttempts.get());
    }

    @Test
    public void storageOverLimitAtStartupExitsWithStorageCode() throws IOException {
        Path today = Files.createDirectories(eventData.resolve("2024-07-10"));
        Files.write(today.resolve("events.json"), new byte[4096]);
        Config config = configBuilder().maxStorageGb(2048.0 / Config.BYTES_PER_GB).build();
        PipelineSupervisor supervisor = supervisorBuilder(config)
                .frameSource(new QueueFrameSource())
                .build();

        PipelineOutcome outcome = supervisor.run();

        assertEquals(FatalReason.STORAGE_LIMIT_EXCEEDED, outcome.fatal().getReason());
        assertEquals(3, outcome.exitCode());
        assertTrue(Files.exists(today.resolve("events.json")));
    }

    @Test
    public void invalidReloadKeepsRunningConfiguration() throws Exception {
        Config initial = configBuilder().build();
        SwitchableConfigSource configSource = new SwitchableConfigSource(initial);
        PipelineSupervisor supervisor = supervisorBuilder(initial)
                .configSource(configSource)
                .frameSource(new QueueFrameSource())
                .build();
        Future<PipelineOutcome> outcome = executor.submit(supervisor::run);
        await("running", () -> supervisor.state() == PipelineState.RUNNING);

        configSource.failure = new ConfigurationException("samplingRate must be at least 1, got 0");
        supervisor.requestReload();
        await("rejected reload", () -> notifier.count(PipelineEventType.CONFIG_RELOAD_REJECTED) == 1);
        assertEquals(initial, supervisor.config());

        configSource.failure = null;
        configSource.next = configBuilder().samplingRate(3).suppressionWindowSeconds(60).build();
        supervisor.requestReload();
        await("applied reload", () -> notifier.count(PipelineEventType.CONFIG_RELOADED) == 1);
        assertEquals(3, supervisor.config().samplingRate());
        assertEquals(60, supervisor.config().suppressionWindowSeconds());

        supervisor.requestShutdown(null);
        assertTrue(outcome.get(15, TimeUnit.SECONDS).isClean());
    }

    @Test
    public void reloadedRetryPolicyWaitsForRestart() throws Exception {
        Config initial = configBuilder()
                .readTimeoutSeconds(30)
                .maxConsecutiveReconnectFailures(3)
                .keepRetryingAfterReconnectFailure(false)
                .build();
        SwitchableConfigSource configSource = new SwitchableConfigSource(
                configBuilder().from(initial).keepRetryingAfterReconnectFailure(true).build());
        QueueFrameSource source = new QueueFrameSource();
        PipelineSupervisor supervisor = supervisorBuilder(initial)
                .configSource(configSource)
                .frameSource(source)
                .build();
        Future<PipelineOutcome> outcome = executor.submit(supervisor::run);
        await("running", () -> supervisor.state() == PipelineState.RUNNING);

        supervisor.requestReload();
        await("applied reload", () -> notifier.count(PipelineEventType.CONFIG_RELOADED) == 1);
        assertTrue(notifier.messages.stream().anyMatch(message -> message.contains("keepRetryingAfterReconnectFailure")));

        //The acquisition thread still runs with keepRetrying=false and gives up, so the run must stop
        source.cameraGone();
        PipelineOutcome result = outcome.get(15, TimeUnit.SECONDS);

        assertEquals(FatalReason.RECONNECT_EXHAUSTED, result.fatal().getReason());
        assertEquals(1, result.exitCode());
        assertEquals(PipelineState.STOPPED, supervisor.state());
        assertEquals(3, source.connectAttempts.get());
    }

    @Test
    public void metricsArePublishedEveryIntervalWithoutEvents() throws Exception {
        QueueFrameSource source = new QueueFrameSource();
        PipelineSupervisor supervisor = supervisorBuilder(configBuilder().metricsIntervalSeconds(60).build())
                .frameSource(source)
                .build();
        Future<PipelineOutcome> outcome = executor.submit(supervisor::run);

        source.offer(TestFrames.gray(WIDTH, HEIGHT, 50, 0));
        await("first frame", () -> supervisor.metrics().count(Counter.FRAMES_SEEN) == 1);
        ticker.advance(Duration.ofSeconds(59));
        Thread.sleep(100);
        assertTrue(metricsSink.snapshots.isEmpty());

        ticker.advance(Duration.ofSeconds(1));
        await("first snapshot", () -> metricsSink.snapshots.size() == 1);
        assertEquals(PipelineState.RUNNING, supervisor.state());
        assertEquals(1, metricsSink.snapshots.get(0).counter(Counter.FRAMES_SEEN));
        assertEquals(0, metricsSink.snapshots.get(0).counter(Counter.EVENTS_EMITTED));

        source.offer(TestFrames.gray(WIDTH, HEIGHT, 50, 1));
        await("second frame", () -> supervisor.metrics().count(Counter.FRAMES_SEEN) == 2);
        ticker.advance(Duration.ofSeconds(60));
        await("second snapshot", () -> metricsSink.snapshots.size() == 2);
        assertEquals(2, metricsSink.snapshots.get(1).counter(Counter.FRAMES_SEEN));

        supervisor.requestShutdown(null);
        assertTrue(outcome.get(15, TimeUnit.SECONDS).isClean());
        //Plus the final snapshot written while draining
        assertEquals(3, metricsSink.snapshots.size());
    }

    @Test
    public void drainStopsAtItsCeilingWhenASinkHangs() throws Exception {
        CountDownLatch flushStarted = new CountDownLatch(1);
        EventSink hangingSink = new EventSink() {
            @Override
            public String name() {
                return "hanging-sink";
            }

            @Override
            public void write(Event event) {
            }

            @Override
            public void close() {
            }

            @Override
            public void flush() throws IOException {
                flushStarted.countDown();
                try {
                    Thread.sleep(TimeUnit.MINUTES.toMillis(1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("flush interrupted");
                }
            }
        };
        PipelineSupervisor supervisor = PipelineSupervisor.builder()
                .config(configBuilder().drainTimeoutSeconds(2).build())
                .addEventSink(hangingSink)
                .metricsSink(metricsSink)
                .eventNotifier(notifier)
                .reconnectSleeper(delay -> { })
                .ticker(ticker)
                .clock(CLOCK)
                .frameSource(new QueueFrameSource())
                .build();
        Future<PipelineOutcome> outcome = executor.submit(supervisor::run);
        await("running", () -> supervisor.state() == PipelineState.RUNNING);

        long start = System.nanoTime();
        supervisor.requestShutdown(null);
        PipelineOutcome result = outcome.get(15, TimeUnit.SECONDS);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(flushStarted.await(0, TimeUnit.SECONDS));
        assertEquals(FatalReason.DRAIN_TIMEOUT, result.fatal().getReason());
        assertEquals(1, result.exitCode());
        assertEquals(PipelineState.STOPPED, supervisor.state());
        assertEquals(1, notifier.count(PipelineEventType.DRAIN_TIMEOUT));
        assertTrue(elapsedMillis < 10_000, "drain took " + elapsedMillis + " ms");
    }

    @Test
    public void restartOnlySettingsAreReported() {
        Config current = configBuilder().build();
        Config next = configBuilder()
                .cameraName("back_yard")
                .queueCapacity(20)
                .samplingRate(4)
                .motionThreshold(0.05)
                .build();

        assertEquals(List.of("cameraName", "queueCapacity"), PipelineSupervisor.restartRequiredChanges(current, next));
        assertTrue(PipelineSupervisor.restartRequiredChanges(current, configBuilder().build()).isEmpty());
    }

    @Test
    public void firstFatalReasonWins() throws Exception {
        PipelineSupervisor supervisor = supervisorBuilder(configBuilder().build())
                .frameSource(new QueueFrameSource())
                .build();
        Future<PipelineOutcome> outcome = executor.submit(supervisor::run);
        await("running", () -> supervisor.state() == PipelineState.RUNNING);

        supervisor.requestShutdown(new FatalPipelineException(
                FatalReason.STORAGE_LIMIT_EXCEEDED, "full"));
        supervisor.requestShutdown(new FatalPipelineException(
                FatalReason.RECONNECT_EXHAUSTED, "camera gone"));

        assertEquals(3, outcome.get(15, TimeUnit.SECONDS).exitCode());
    }
}
