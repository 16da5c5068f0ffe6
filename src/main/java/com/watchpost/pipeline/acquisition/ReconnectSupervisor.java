package com.watchpost.pipeline.acquisition;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.watchpost.pipeline.config.Config;
import com.watchpost.pipeline.core.FatalPipelineException;
import com.watchpost.pipeline.core.FatalReason;
import com.watchpost.pipeline.core.FrameSourceException;
import com.watchpost.pipeline.core.PipelineEventNotifier;
import com.watchpost.pipeline.core.PipelineEventType;
import com.watchpost.pipeline.core.Sleeper;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the frame source on the acquisition thread: connects, reads frames into the queue and
 * reconnects with exponential backoff. Connect failures, read timeouts and closed streams each
 * count as one consecutive failure; only a received frame resets the count.
 */
public class ReconnectSupervisor {
    final static Logger LOGGER = LoggerFactory.getLogger(ReconnectSupervisor.class);
    final static String REPORTER = "ReconnectSupervisor";

    public interface TransitionListener {
        void onTransition(ConnectionState from, ConnectionState to, int consecutiveFailures, String reason);
    }

    final String cameraName;
    final FrameSource source;
    final BoundedFrameQueue queue;
    final ExponentialBackoff backoff;
    final Duration readTimeout;
    final int maxConsecutiveFailures;
    final boolean keepRetrying;
    final PipelineEventNotifier eventNotifier;
    final Sleeper sleeper;

    final ReentrantLock stepLock = new ReentrantLock();
    final CountDownLatch stopLatch = new CountDownLatch(1);
    final List<TransitionListener> transitionListeners = new CopyOnWriteArrayList<>();

    volatile ConnectionState state = ConnectionState.DISCONNECTED;
    volatile boolean stopped = false;
    int consecutiveFailures = 0;
    int backoffAttempt = 0;
    boolean fatalSignalled = false;
    @Nullable Consumer<FatalPipelineException> fatalListener;
    @Nullable ExecutorService executor;

    public ReconnectSupervisor(String cameraName, FrameSource source, BoundedFrameQueue queue,
                               ExponentialBackoff backoff, Duration readTimeout, int maxConsecutiveFailures,
                               boolean keepRetrying, PipelineEventNotifier eventNotifier,
                               @Nullable Sleeper sleeper) {
        checkArgument(maxConsecutiveFailures > 0, "maxConsecutiveFailures must be positive");
        this.cameraName = cameraName;
        this.source = source;
        this.queue = queue;
        this.backoff = backoff;
        this.readTimeout = readTimeout;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.keepRetrying = keepRetrying;
        this.eventNotifier = eventNotifier;
        //Production waits end early once acquisition is stopped
        this.sleeper = sleeper != null ? sleeper : duration -> stopLatch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** @param sleeper null for the production sleeper */
    public static ReconnectSupervisor fromConfig(Config config, FrameSource source, BoundedFrameQueue queue,
                                                 PipelineEventNotifier eventNotifier, @Nullable Sleeper sleeper) {
        return new ReconnectSupervisor(config.cameraName(), source, queue,
                new ExponentialBackoff(Duration.ofSeconds(config.reconnectInitialDelaySeconds()),
                        Duration.ofSeconds(config.reconnectMaxDelaySeconds())),
                Duration.ofSeconds(config.readTimeoutSeconds()),
                config.maxConsecutiveReconnectFailures(),
                config.keepRetryingAfterReconnectFailure(),
                eventNotifier, sleeper);
    }

    public void setFatalListener(Consumer<FatalPipelineException> fatalListener) {
        this.fatalListener = fatalListener;
    }

    public void addTransitionListener(TransitionListener listener) {
        transitionListeners.add(listener);
    }

    public ConnectionState state() {
        return state;
    }

    /** Fixed for the lifetime of this supervisor; a reload doesn't change it. */
    public boolean keepRetrying() {
        return keepRetrying;
    }

    public int consecutiveFailures() {
        stepLock.lock();
        try {
            return consecutiveFailures;
        } finally {
            stepLock.unlock();
        }
    }

    /** Starts the acquisition thread. */
    public void start() {
        checkState(executor == null, "Acquisition already started");
        executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("acquisition-" + cameraName + "-%d")
                .setDaemon(true)
                .build());
        executor.submit(this::runLoop);
    }

    void runLoop() {
        LOGGER.info("Acquisition started for camera [{}]", cameraName);
        try {
            while (!stopped) {
                ConnectionState newState = step();
                if (newState == ConnectionState.FATAL && !keepRetrying) {
                    LOGGER.error("Acquisition for camera [{}] gave up after {} consecutive failures",
                            cameraName, maxConsecutiveFailures);
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("Acquisition for camera [{}] interrupted", cameraName);
        } catch (RuntimeException e) {
            LOGGER.error("Acquisition for camera [{}] failed", cameraName, e);
            signalFatal("Acquisition thread failed: " + e);
        } finally {
            source.close();
            LOGGER.info("Acquisition stopped for camera [{}]", cameraName);
        }
    }

    /**
     * Runs one transition of the state machine while holding the step lock, so no two
     * connection attempts ever overlap.
     */
    public ConnectionState step() throws InterruptedException {
        stepLock.lock();
        try {
            switch (state) {
                case DISCONNECTED:
                    if (consecutiveFailures > 0) {
                        sleeper.sleep(backoff.delay(backoffAttempt++));
                        if (stopped) {
                            return state;
                        }
                    }
                    tryConnect();
                    break;
                case CONNECTED:
                    readFrame();
                    break;
                case FATAL:
                    if (keepRetrying) {
                        sleeper.sleep(backoff.maxDelay());
                        if (stopped) {
                            return state;
                        }
                        tryConnect();
                    }
                    break;
                default:
                    throw new IllegalStateException("Unexpected state between steps: " + state);
            }
            return state;
        } finally {
            stepLock.unlock();
        }
    }

    void tryConnect() {
        transition(ConnectionState.CONNECTING, "connecting");
        try {
            source.connect();
        } catch (FrameSourceException | RuntimeException e) {
            LOGGER.warn("Connect to camera [{}] failed: {}", cameraName, e.getMessage());
            source.close();
            onFailure("connect failed: " + e.getMessage());
            return;
        }
        backoffAttempt = 0;
        transition(ConnectionState.CONNECTED, "connected");
        eventNotifier.notifyEvent(REPORTER, PipelineEventType.CAMERA_CONNECTED, cameraName,
                "Camera stream connected", null);
    }

    void readFrame() throws InterruptedException {
        FrameRead read;
        try {
            read = source.read(readTimeout);
        } catch (FrameSourceException | RuntimeException e) {
            read = FrameRead.closed("read failed: " + e.getMessage());
        }

        switch (read.status()) {
            case FRAME:
                if (consecutiveFailures > 0) {
                    LOGGER.info("Camera [{}] delivering frames again after {} consecutive failures",
                            cameraName, consecutiveFailures);
                }
                consecutiveFailures = 0;
                fatalSignalled = false;
                queue.push(read.frame());
                break;
            case TIMEOUT:
                source.close();
                onFailure(String.format("no frame within %s", readTimeout));
                break;
            case CLOSED:
                source.close();
                onFailure("stream closed: " + read.reason());
                break;
        }
    }

    void onFailure(String reason) {
        consecutiveFailures++;
        if (consecutiveFailures >= maxConsecutiveFailures) {
            transition(ConnectionState.FATAL, reason);
            signalFatal(String.format("Camera [%s] failed %d consecutive times, last: %s",
                    cameraName, consecutiveFailures, reason));
        } else {
            transition(ConnectionState.DISCONNECTED, reason);
            eventNotifier.notifyEvent(REPORTER, PipelineEventType.CAMERA_DISCONNECTED, cameraName,
                    "Camera stream lost", String.format("%s; consecutive failures: %d", reason, consecutiveFailures));
        }
    }

    void signalFatal(String message) {
        if (fatalSignalled) {
            return;
        }
        fatalSignalled = true;
        eventNotifier.notifyEvent(REPORTER, PipelineEventType.CAMERA_RECONNECT_EXHAUSTED, cameraName,
                "Reconnect attempts exhausted", message);
        Consumer<FatalPipelineException> listener = fatalListener;
        if (listener != null) {
            listener.accept(new FatalPipelineException(FatalReason.RECONNECT_EXHAUSTED, message));
        }
    }

    void transition(ConnectionState newState, String reason) {
        ConnectionState oldState = state;
        state = newState;
        LOGGER.info("Camera [{}] {} -> {} ({}); consecutive failures: {}",
                cameraName, oldState, newState, reason, consecutiveFailures);
        for (TransitionListener listener : transitionListeners) {
            listener.onTransition(oldState, newState, consecutiveFailures, reason);
        }
    }

    /** Stops acquisition; pending backoff waits return immediately. */
    public void stop(Duration timeout) throws InterruptedException {
        stopped = true;
        stopLatch.countDown();
        ExecutorService currentExecutor = executor;
        if (currentExecutor != null) {
            currentExecutor.shutdown();
            if (!currentExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Acquisition thread didn't stop within {}, interrupting", timeout);
                currentExecutor.shutdownNow();
            }
        }
    }
}
