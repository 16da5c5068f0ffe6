package com.watchpost.pipeline.acquisition;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Instant;

/**
 * One decoded frame. The pixel buffer is owned by whichever stage currently holds the frame;
 * the constructor takes the array as-is and nothing copies it afterwards.
 */
public final class Frame {
    final byte[] pixels;
    final int width;
    final int height;
    final PixelFormat format;
    final Instant captureTime;
    final long sequence;

    public Frame(byte[] pixels, int width, int height, PixelFormat format, Instant captureTime, long sequence) {
        checkArgument(width > 0 && height > 0, "Frame dimensions must be positive: %sx%s", width, height);
        checkArgument(pixels.length == width * height * format.bytesPerPixel(),
                "Buffer size %s doesn't match %sx%s %s", pixels.length, width, height, format);
        this.pixels = pixels;
        this.width = width;
        this.height = height;
        this.format = checkNotNull(format);
        this.captureTime = checkNotNull(captureTime);
        this.sequence = sequence;
    }

    public byte[] pixels() {
        return pixels;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public PixelFormat format() {
        return format;
    }

    public Instant captureTime() {
        return captureTime;
    }

    public long sequence() {
        return sequence;
    }

    public int pixelCount() {
        return width * height;
    }

    /** Luminance of pixel {@code index} (row-major), 0..255. */
    public int luminance(int index) {
        if (format == PixelFormat.GRAY8) {
            return pixels[index] & 0xFF;
        }
        int offset = index * 3;
        int b = pixels[offset] & 0xFF;
        int g = pixels[offset + 1] & 0xFF;
        int r = pixels[offset + 2] & 0xFF;
        //BT.601 integer approximation
        return (29 * b + 150 * g + 77 * r) >> 8;
    }

    @Override
    public String toString() {
        return String.format("Frame#%d[%dx%d %s @%s]", sequence, width, height, format, captureTime);
    }
}
