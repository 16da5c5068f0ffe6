package com.watchpost.pipeline.acquisition;

import java.time.Instant;
import java.util.Arrays;

public class TestFrames {
    /** Uniform grey frame. */
    public static Frame gray(int width, int height, int level, long sequence) {
        byte[] pixels = new byte[width * height];
        Arrays.fill(pixels, (byte) level);
        return new Frame(pixels, width, height, PixelFormat.GRAY8, Instant.ofEpochMilli(1_700_000_000_000L + sequence), sequence);
    }

    /** Uniform frame with the first {@code changedPixels} pixels set to {@code changedLevel}. */
    public static Frame withChange(int width, int height, int level, int changedPixels, int changedLevel, long sequence) {
        Frame frame = gray(width, height, level, sequence);
        Arrays.fill(frame.pixels(), 0, changedPixels, (byte) changedLevel);
        return frame;
    }
}
