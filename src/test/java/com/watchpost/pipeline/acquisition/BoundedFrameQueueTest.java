package com.watchpost.pipeline.acquisition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.watchpost.pipeline.metrics.MetricsAggregator;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

public class BoundedFrameQueueTest {
    @Test
    public void keepsMostRecentFramesWhenFull() throws InterruptedException {
        MetricsAggregator metrics = new MetricsAggregator();
        BoundedFrameQueue queue = new BoundedFrameQueue(100, metrics);

        for (long i = 1; i <= 150; i++) {
            BoundedFrameQueue.PushOutcome outcome = queue.push(TestFrames.gray(4, 4, 0, i));
            assertEquals(i <= 100 ? BoundedFrameQueue.PushOutcome.ACCEPTED : BoundedFrameQueue.PushOutcome.EVICTED_OLDEST, outcome);
            assertEquals(Math.min(i, 100), queue.size());
        }
        assertEquals(50, metrics.count(MetricsAggregator.Counter.FRAMES_DROPPED));

        for (long expected = 51; expected <= 150; expected++) {
            Frame frame = queue.pop(Duration.ZERO);
            assertEquals(expected, frame.sequence());
        }
        assertNull(queue.pop(Duration.ofMillis(10)));
        assertEquals(0, queue.size());
    }

    @Test
    public void popWaitsForProducer() throws InterruptedException {
        BoundedFrameQueue queue = new BoundedFrameQueue(2, new MetricsAggregator());
        ExecutorService producer = Executors.newSingleThreadExecutor();
        CountDownLatch started = new CountDownLatch(1);
        try {
            producer.submit(() -> {
                started.countDown();
                Thread.sleep(50);
                queue.push(TestFrames.gray(4, 4, 0, 7));
                return null;
            });
            started.await(1, TimeUnit.SECONDS);
            Frame frame = queue.pop(Duration.ofSeconds(5));
            assertEquals(7, frame.sequence());
        } finally {
            producer.shutdownNow();
        }
    }

    @Test
    public void concurrentPushesNeverExceedCapacityOrDuplicate() throws InterruptedException {
        int capacity = 10;
        MetricsAggregator metrics = new MetricsAggregator();
        BoundedFrameQueue queue = new BoundedFrameQueue(capacity, metrics);
        ExecutorService producers = Executors.newFixedThreadPool(4);
        for (int p = 0; p < 4; p++) {
            int base = p * 1000;
            producers.submit(() -> {
                for (int i = 1; i <= 500; i++) {
                    queue.push(TestFrames.gray(2, 2, 0, base + i));
                }
            });
        }
        producers.shutdown();
        producers.awaitTermination(10, TimeUnit.SECONDS);

        assertEquals(capacity, queue.size());
        assertEquals(2000 - capacity, metrics.count(MetricsAggregator.Counter.FRAMES_DROPPED));
        assertEquals(capacity, queue.clear());
    }
}
