package com.watchpost.pipeline.acquisition;

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;
import com.watchpost.pipeline.config.Config;
import com.watchpost.pipeline.config.FfmpegCommandCreator;
import com.watchpost.pipeline.core.CollaboratorUnavailableException;
import com.watchpost.pipeline.core.FrameSourceException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Camera stream decoded by an ffmpeg child process into raw GRAY8 frames on its stdout.
 * Partial frames survive across {@link #read} calls; stderr output is kept in a short buffer
 * that ends up in the close reason.
 */
public class FfmpegFrameSource implements FrameSource {
    final static Logger LOGGER = LoggerFactory.getLogger(FfmpegFrameSource.class);

    static final long POLL_INTERVAL_MILLIS = 10L;
    static final long HEALTH_CHECK_TIMEOUT_SECONDS = 5L;
    static final int MAX_LOG_BUFFER_SIZE = 512;

    final String cameraName;
    final Config.Camera camera;
    final Long socketTimeout_us;
    final int frameSize;
    final StringBuilder lastLogLines = new StringBuilder();
    final AtomicLong sequence = new AtomicLong();

    @Nullable Process process;
    @Nullable InputStream stdout;
    @Nullable BufferedReader stderr;
    @Nullable byte[] pending;
    int pendingBytes;

    public FfmpegFrameSource(String cameraName, Config.Camera camera, Long socketTimeout_us) {
        this.cameraName = cameraName;
        this.camera = camera;
        this.socketTimeout_us = socketTimeout_us;
        this.frameSize = camera.frameWidth() * camera.frameHeight() * PixelFormat.GRAY8.bytesPerPixel();
    }

    @Override
    public String name() {
        return "ffmpeg-source[" + cameraName + "]";
    }

    @Override
    public void checkHealth() throws CollaboratorUnavailableException {
        try {
            Process versionProcess = new ProcessBuilder(FfmpegCommandCreator.FFMPEG, "-version")
                    .redirectErrorStream(true)
                    .start();
            ByteStreams.exhaust(versionProcess.getInputStream());
            if (!versionProcess.waitFor(HEALTH_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                versionProcess.destroyForcibly();
                throw new CollaboratorUnavailableException(name(), "ffmpeg -version didn't finish in time");
            }
            if (versionProcess.exitValue() != 0) {
                throw new CollaboratorUnavailableException(name(),
                        "ffmpeg -version exited with " + versionProcess.exitValue());
            }
        } catch (IOException e) {
            throw new CollaboratorUnavailableException(name(), "ffmpeg is not runnable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorUnavailableException(name(), "Interrupted while checking ffmpeg", e);
        }
    }

    @Override
    public void connect() throws FrameSourceException {
        close();
        ImmutableList<String> command;
        try {
            command = FfmpegCommandCreator.createFfmpegCommand(camera, socketTimeout_us);
        } catch (URISyntaxException e) {
            throw new FrameSourceException("Invalid camera url: " + e.getMessage(), e);
        }

        LOGGER.info("Starting process, cmd: {}", String.join(" ", command));
        try {
            Process newProcess = new ProcessBuilder(command).start();
            stdout = newProcess.getInputStream();
            stderr = new BufferedReader(new InputStreamReader(newProcess.getErrorStream(), StandardCharsets.UTF_8));
            process = newProcess;
            pending = new byte[frameSize];
            pendingBytes = 0;
        } catch (IOException e) {
            throw new FrameSourceException("Error starting ffmpeg process: " + e.getMessage(), e);
        }
    }

    @Override
    public FrameRead read(Duration timeout) throws FrameSourceException, InterruptedException {
        Process currentProcess = process;
        InputStream currentStdout = stdout;
        byte[] buffer = pending;
        if (currentProcess == null || currentStdout == null || buffer == null) {
            throw new FrameSourceException("Source is not connected");
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                drainStderr();
                int available = currentStdout.available();
                if (available > 0) {
                    int read = currentStdout.read(buffer, pendingBytes, Math.min(available, frameSize - pendingBytes));
                    if (read < 0) {
                        return FrameRead.closed("end of stream. " + lastLogLines);
                    }
                    pendingBytes += read;
                    if (pendingBytes == frameSize) {
                        Frame frame = new Frame(buffer, camera.frameWidth(), camera.frameHeight(),
                                PixelFormat.GRAY8, Instant.now(), sequence.incrementAndGet());
                        //Frame now owns the buffer
                        pending = new byte[frameSize];
                        pendingBytes = 0;
                        return FrameRead.frame(frame);
                    }
                    continue;
                }
                if (!currentProcess.isAlive()) {
                    return FrameRead.closed(String.format("process exited with %d. %s",
                            currentProcess.exitValue(), lastLogLines));
                }
                if (System.nanoTime() >= deadline) {
                    return FrameRead.timeout();
                }
                Thread.sleep(POLL_INTERVAL_MILLIS);
            }
        } catch (IOException e) {
            throw new FrameSourceException("Error reading from ffmpeg process: " + e.getMessage(), e);
        }
    }

    void drainStderr() throws IOException {
        BufferedReader reader = stderr;
        if (reader == null || !reader.ready()) {
            return;
        }
        StringBuilder newLogs = new StringBuilder();
        int value;
        while (reader.ready() && (value = reader.read()) != -1) {
            newLogs.append((char)value);
        }
        LOGGER.info("STDERR [{}]: {}", cameraName, newLogs);

        lastLogLines.append(newLogs);
        if (lastLogLines.length() > MAX_LOG_BUFFER_SIZE) {
            lastLogLines.delete(0, lastLogLines.length() - MAX_LOG_BUFFER_SIZE);
        }
    }

    @Override
    public void close() {
        Process currentProcess = process;
        if (currentProcess != null) {
            if (currentProcess.isAlive()) {
                LOGGER.info("Killing ffmpeg process for camera [{}]", cameraName);
                currentProcess.destroyForcibly();
            }
            process = null;
        }
        stdout = null;
        stderr = null;
        pending = null;
        pendingBytes = 0;
        lastLogLines.setLength(0);
    }
}
