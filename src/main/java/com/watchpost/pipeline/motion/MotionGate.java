package com.watchpost.pipeline.motion;

import static com.google.common.base.Preconditions.checkArgument;

import com.watchpost.pipeline.acquisition.Frame;
import com.watchpost.pipeline.config.Config;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adaptive background subtraction over luminance. Each pixel keeps an exponentially weighted
 * mean and variance; a pixel is foreground when its squared deviation exceeds
 * {@code max(noise^2, varianceThreshold * variance)}. The first {@code learningFrames} frames only
 * train the model and never report motion.
 *
 * <p>Not thread-safe; owned by the pipeline's consumer thread.
 */
public class MotionGate {
    final static Logger LOGGER = LoggerFactory.getLogger(MotionGate.class);

    double motionThreshold;
    int learningFrames;
    int historyFrames;
    double noiseThreshold;
    double varianceThreshold;

    @Nullable float[] mean;
    @Nullable float[] variance;
    int width;
    int height;
    long framesSeen;

    public MotionGate(double motionThreshold, int learningFrames, int historyFrames,
                      double noiseThreshold, double varianceThreshold) {
        reconfigure(motionThreshold, learningFrames, historyFrames, noiseThreshold, varianceThreshold);
    }

    public static MotionGate fromConfig(Config config) {
        return new MotionGate(config.motionThreshold(), config.motionLearningFrames(), config.motionHistoryFrames(),
                config.motionPixelNoiseThreshold(), config.motionVarianceThreshold());
    }

    /** Applies new thresholds; the learned background is kept. */
    public void reconfigure(double motionThreshold, int learningFrames, int historyFrames,
                            double noiseThreshold, double varianceThreshold) {
        checkArgument(motionThreshold >= 0.0 && motionThreshold <= 1.0, "motionThreshold must be within [0, 1]");
        checkArgument(learningFrames >= 0, "learningFrames must not be negative");
        checkArgument(historyFrames > 0, "historyFrames must be positive");
        this.motionThreshold = motionThreshold;
        this.learningFrames = learningFrames;
        this.historyFrames = historyFrames;
        this.noiseThreshold = noiseThreshold;
        this.varianceThreshold = varianceThreshold;
    }

    public void resetBackground() {
        LOGGER.info("Resetting motion background model after {} frames", framesSeen);
        mean = null;
        variance = null;
        framesSeen = 0;
    }

    public boolean isLearning() {
        return framesSeen <= learningFrames;
    }

    public MotionResult evaluate(Frame frame) {
        if (mean != null && (frame.width() != width || frame.height() != height)) {
            LOGGER.info("Frame size changed from {}x{} to {}x{}", width, height, frame.width(), frame.height());
            resetBackground();
        }

        int pixelCount = frame.pixelCount();
        float[] currentMean = mean;
        float[] currentVariance = variance;
        if (currentMean == null || currentVariance == null) {
            currentMean = new float[pixelCount];
            currentVariance = new float[pixelCount];
            for (int i = 0; i < pixelCount; i++) {
                currentMean[i] = frame.luminance(i);
            }
            mean = currentMean;
            variance = currentVariance;
            width = frame.width();
            height = frame.height();
            framesSeen = 1;
            return new MotionResult(frame, false, 0.0);
        }

        framesSeen++;
        float alpha = (float) (1.0 / Math.min(framesSeen, historyFrames));
        float noiseSquared = (float) (noiseThreshold * noiseThreshold);
        float varianceFactor = (float) varianceThreshold;

        int foreground = 0;
        for (int i = 0; i < pixelCount; i++) {
            float delta = frame.luminance(i) - currentMean[i];
            float deltaSquared = delta * delta;
            if (deltaSquared > Math.max(noiseSquared, varianceFactor * currentVariance[i])) {
                foreground++;
            }
            currentMean[i] += alpha * delta;
            currentVariance[i] = (1.0f - alpha) * (currentVariance[i] + alpha * deltaSquared);
        }

        double confidence = (double) foreground / pixelCount;
        boolean hasMotion = !isLearning() && confidence >= motionThreshold;
        return new MotionResult(frame, hasMotion, confidence);
    }
}
