package com.watchpost.pipeline.motion;

import static com.google.common.base.Preconditions.checkArgument;

/** Forwards every k-th motion-positive frame to inference. */
public class SamplingPolicy {
    int samplingRate;
    long motionFrameCount;

    public SamplingPolicy(int samplingRate) {
        setSamplingRate(samplingRate);
    }

    public void setSamplingRate(int samplingRate) {
        checkArgument(samplingRate >= 1, "samplingRate must be at least 1, got %s", samplingRate);
        this.samplingRate = samplingRate;
    }

    public int samplingRate() {
        return samplingRate;
    }

    public boolean shouldSample(long frameCount) {
        return frameCount % samplingRate == 0;
    }

    /** Counts one more motion-positive frame (1-based) and decides whether it is sampled. */
    public boolean onMotionFrame() {
        return shouldSample(++motionFrameCount);
    }
}
