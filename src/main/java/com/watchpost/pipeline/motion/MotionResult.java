package com.watchpost.pipeline.motion;

import com.watchpost.pipeline.acquisition.Frame;

public final class MotionResult {
    final Frame frame;
    final boolean hasMotion;
    final double confidence;

    public MotionResult(Frame frame, boolean hasMotion, double confidence) {
        this.frame = frame;
        this.hasMotion = hasMotion;
        this.confidence = confidence;
    }

    public Frame frame() {
        return frame;
    }

    public boolean hasMotion() {
        return hasMotion;
    }

    /** Fraction of pixels that differ from the background model, in [0, 1] */
    public double confidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return String.format("MotionResult[frame=%d, motion=%s, confidence=%.4f]", frame.sequence(), hasMotion, confidence);
    }
}
