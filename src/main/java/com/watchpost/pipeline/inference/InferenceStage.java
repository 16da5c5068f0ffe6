package com.watchpost.pipeline.inference;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.watchpost.pipeline.acquisition.Frame;
import com.watchpost.pipeline.config.Config;
import com.watchpost.pipeline.core.Collaborator;
import com.watchpost.pipeline.core.InferenceException;
import com.watchpost.pipeline.metrics.MetricsAggregator;
import com.watchpost.pipeline.motion.MotionResult;
import java.io.Closeable;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classification and description behind one stage. Calls run on a worker pool only so that
 * they can be abandoned after their time limit; the caller always waits for the result.
 * Without a classification service the stage runs in motion-only mode.
 */
public class InferenceStage implements Closeable {
    final static Logger LOGGER = LoggerFactory.getLogger(InferenceStage.class);

    public static final String MOTION_LABEL = "motion";
    static final String FALLBACK_PREFIX = "Detected: ";

    @Nullable final ClassificationService classificationService;
    @Nullable final DescriptionService descriptionService;
    final MetricsAggregator metrics;
    final ExecutorService executor;
    final TimeLimiter timeLimiter;

    volatile double minConfidence;
    volatile ImmutableSet<String> ignoredLabels;
    volatile Duration classificationTimeout;
    volatile Duration descriptionTimeout;

    public InferenceStage(@Nullable ClassificationService classificationService,
                          @Nullable DescriptionService descriptionService,
                          MetricsAggregator metrics,
                          double minConfidence, Collection<String> ignoredLabels,
                          Duration classificationTimeout, Duration descriptionTimeout) {
        this.classificationService = classificationService;
        this.descriptionService = descriptionService;
        this.metrics = metrics;
        this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("inference-%d")
                .setDaemon(true)
                .build());
        this.timeLimiter = SimpleTimeLimiter.create(executor);
        reconfigure(minConfidence, ignoredLabels, classificationTimeout, descriptionTimeout);
    }

    public static InferenceStage fromConfig(Config config, @Nullable ClassificationService classificationService,
                                            @Nullable DescriptionService descriptionService, MetricsAggregator metrics) {
        return new InferenceStage(classificationService, descriptionService, metrics,
                config.minObjectConfidence(), config.ignoredLabels(),
                Duration.ofMillis(config.classificationTimeoutMillis()),
                Duration.ofSeconds(config.descriptionTimeoutSeconds()));
    }

    public void reconfigure(double minConfidence, Collection<String> ignoredLabels,
                            Duration classificationTimeout, Duration descriptionTimeout) {
        this.minConfidence = minConfidence;
        this.ignoredLabels = ImmutableSet.copyOf(ignoredLabels);
        this.classificationTimeout = classificationTimeout;
        this.descriptionTimeout = descriptionTimeout;
    }

    public boolean isMotionOnly() {
        return classificationService == null;
    }

    public List<Collaborator> collaborators() {
        ImmutableList.Builder<Collaborator> collaborators = ImmutableList.builder();
        if (classificationService != null) {
            collaborators.add(classificationService);
        }
        if (descriptionService != null) {
            collaborators.add(descriptionService);
        }
        return collaborators.build();
    }

    /**
     * @return filtered detections; empty when nothing passes the filters
     * @throws InferenceException when the classifier fails or exceeds its time limit
     */
    public Classification classify(MotionResult motion) throws InferenceException, InterruptedException {
        Frame frame = motion.frame();
        ClassificationService classifier = classificationService;
        if (classifier == null) {
            Detection wholeFrame = Detection.of(MOTION_LABEL, motion.confidence(),
                    BoundingBox.of(0, 0, frame.width(), frame.height()));
            return new Classification(DetectionSet.of(wholeFrame), 0L);
        }

        Stopwatch stopwatch = Stopwatch.createStarted();
        DetectionSet raw;
        try {
            raw = callWithTimeout(() -> classifier.classify(frame), classificationTimeout, "classification");
        } catch (InferenceException e) {
            metrics.increment(MetricsAggregator.Counter.INFERENCE_FAILURES);
            throw e;
        } finally {
            metrics.record(MetricsAggregator.Timer.CLASSIFICATION, stopwatch.elapsed(TimeUnit.MILLISECONDS));
        }
        return new Classification(filter(raw), stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }

    DetectionSet filter(DetectionSet raw) {
        ImmutableList.Builder<Detection> kept = ImmutableList.builder();
        for (Detection detection : raw.detections()) {
            if (detection.confidence() < minConfidence) {
                LOGGER.debug("Dropping {} with confidence {} below {}", detection.label(), detection.confidence(), minConfidence);
            } else if (ignoredLabels.contains(detection.label())) {
                LOGGER.debug("Dropping ignored label {}", detection.label());
            } else {
                kept.add(detection);
            }
        }
        return DetectionSet.of(kept.build());
    }

    /** Never fails: a failed or slow description degrades to a summary of the labels. */
    public Description describe(Frame frame, DetectionSet detections) throws InterruptedException {
        String fallback = FALLBACK_PREFIX + Joiner.on(", ").join(detections.labels());
        DescriptionService describer = descriptionService;
        if (describer == null) {
            return new Description(fallback, 0L, true);
        }

        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            String text = callWithTimeout(() -> describer.describe(frame, detections), descriptionTimeout, "description");
            long millis = stopwatch.elapsed(TimeUnit.MILLISECONDS);
            metrics.record(MetricsAggregator.Timer.DESCRIPTION, millis);
            if (text == null || text.isBlank()) {
                return new Description(fallback, millis, true);
            }
            return new Description(text.trim(), millis, false);
        } catch (InferenceException e) {
            long millis = stopwatch.elapsed(TimeUnit.MILLISECONDS);
            metrics.record(MetricsAggregator.Timer.DESCRIPTION, millis);
            metrics.increment(MetricsAggregator.Counter.INFERENCE_FAILURES);
            LOGGER.warn("Description of frame {} failed, using label summary: {}", frame.sequence(), e.getMessage());
            return new Description(fallback, millis, true);
        }
    }

    <T> T callWithTimeout(Callable<T> call, Duration timeout, String what) throws InferenceException, InterruptedException {
        try {
            return timeLimiter.callWithTimeout(call, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new InferenceException(String.format("%s timed out after %s", what, timeout), e);
        } catch (ExecutionException | UncheckedExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof InferenceException) {
                throw (InferenceException) cause;
            }
            throw new InferenceException(String.format("%s failed: %s", what, cause), cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
