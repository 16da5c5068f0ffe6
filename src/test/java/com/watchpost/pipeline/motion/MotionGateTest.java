package com.watchpost.pipeline.motion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.watchpost.pipeline.acquisition.Frame;
import com.watchpost.pipeline.acquisition.PixelFormat;
import com.watchpost.pipeline.acquisition.TestFrames;
import java.time.Instant;
import org.junit.jupiter.api.Test;

public class MotionGateTest {
    static final int WIDTH = 40;
    static final int HEIGHT = 25;

    static MotionGate defaultGate() {
        return new MotionGate(0.02, 100, 500, 15.0, 16.0);
    }

    @Test
    public void learningPhaseNeverReportsMotion() {
        MotionGate gate = defaultGate();
        for (int i = 1; i <= 100; i++) {
            //Alternate between very different frames, which would be motion after learning
            int level = i % 2 == 0 ? 0 : 255;
            MotionResult result = gate.evaluate(TestFrames.gray(WIDTH, HEIGHT, level, i));
            assertFalse(result.hasMotion(), "frame " + i);
        }
    }

    @Test
    public void fivePercentChangeAfterStaticBackgroundIsMotion() {
        MotionGate gate = defaultGate();
        for (int i = 1; i <= 100; i++) {
            assertFalse(gate.evaluate(TestFrames.gray(WIDTH, HEIGHT, 100, i)).hasMotion());
        }

        int changed = WIDTH * HEIGHT * 5 / 100;
        MotionResult result = gate.evaluate(TestFrames.withChange(WIDTH, HEIGHT, 100, changed, 220, 101));

        assertTrue(result.hasMotion());
        assertEquals(0.05, result.confidence(), 1e-9);
    }

    @Test
    public void changeBelowThresholdIsNotMotion() {
        MotionGate gate = defaultGate();
        for (int i = 1; i <= 100; i++) {
            gate.evaluate(TestFrames.gray(WIDTH, HEIGHT, 100, i));
        }
        int changed = WIDTH * HEIGHT / 100;
        MotionResult result = gate.evaluate(TestFrames.withChange(WIDTH, HEIGHT, 100, changed, 220, 101));
        assertFalse(result.hasMotion());
        assertEquals(0.01, result.confidence(), 1e-9);
    }

    @Test
    public void sensorNoiseIsIgnored() {
        MotionGate gate = defaultGate();
        for (int i = 1; i <= 100; i++) {
            gate.evaluate(TestFrames.gray(WIDTH, HEIGHT, 100, i));
        }
        //Every pixel off by 10 grey levels, under the 15 level noise floor
        MotionResult result = gate.evaluate(TestFrames.gray(WIDTH, HEIGHT, 110, 101));
        assertFalse(result.hasMotion());
        assertEquals(0.0, result.confidence());
    }

    @Test
    public void resetAndSizeChangeReenterLearning() {
        MotionGate gate = new MotionGate(0.02, 3, 500, 15.0, 16.0);
        for (int i = 1; i <= 3; i++) {
            gate.evaluate(TestFrames.gray(WIDTH, HEIGHT, 0, i));
        }
        assertTrue(gate.evaluate(TestFrames.gray(WIDTH, HEIGHT, 255, 4)).hasMotion());

        gate.resetBackground();
        assertTrue(gate.isLearning());
        assertFalse(gate.evaluate(TestFrames.gray(WIDTH, HEIGHT, 0, 5)).hasMotion());

        for (int i = 6; i <= 8; i++) {
            gate.evaluate(TestFrames.gray(WIDTH, HEIGHT, 0, i));
        }
        assertFalse(gate.isLearning());
        assertFalse(gate.evaluate(TestFrames.gray(WIDTH * 2, HEIGHT, 255, 9)).hasMotion());
        assertTrue(gate.isLearning());
    }

    @Test
    public void bgrFramesUseLuminance() {
        MotionGate gate = new MotionGate(0.02, 1, 500, 15.0, 16.0);
        byte[] dark = new byte[WIDTH * HEIGHT * 3];
        gate.evaluate(new Frame(dark, WIDTH, HEIGHT, PixelFormat.BGR24, Instant.EPOCH, 1));
        gate.evaluate(new Frame(new byte[WIDTH * HEIGHT * 3], WIDTH, HEIGHT, PixelFormat.BGR24, Instant.EPOCH, 2));

        byte[] green = new byte[WIDTH * HEIGHT * 3];
        for (int i = 1; i < green.length; i += 3) {
            green[i] = (byte) 200;
        }
        MotionResult result = gate.evaluate(new Frame(green, WIDTH, HEIGHT, PixelFormat.BGR24, Instant.EPOCH, 3));
        assertTrue(result.hasMotion());
        assertEquals(1.0, result.confidence());
    }

    @Test
    public void processes640x360WellUnder50Millis() {
        MotionGate gate = defaultGate();
        for (int i = 1; i <= 120; i++) {
            gate.evaluate(TestFrames.gray(640, 360, i % 7, i));
        }
        long start = System.nanoTime();
        int frames = 20;
        for (int i = 0; i < frames; i++) {
            gate.evaluate(TestFrames.gray(640, 360, i % 7, 200 + i));
        }
        long averageMillis = (System.nanoTime() - start) / frames / 1_000_000L;
        assertTrue(averageMillis < 50, "average " + averageMillis + "ms");
    }
}
