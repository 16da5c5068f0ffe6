package com.watchpost.pipeline.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.watchpost.pipeline.core.PipelineEventType;
import com.watchpost.pipeline.core.RecordingPipelineEventNotifier;
import com.watchpost.pipeline.metrics.MetricsAggregator;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class EventFanoutTest {
    static class RecordingSink implements EventSink {
        final String name;
        final boolean failing;
        final List<Event> written = new ArrayList<>();
        boolean closed;

        RecordingSink(String name, boolean failing) {
            this.name = name;
            this.failing = failing;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void write(Event event) throws IOException {
            if (failing) {
                throw new IOException("disk full");
            }
            written.add(event);
        }

        @Override
        public void flush() throws IOException {
            if (failing) {
                throw new IOException("disk full");
            }
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    final MetricsAggregator metrics = new MetricsAggregator();
    final RecordingPipelineEventNotifier notifier = new RecordingPipelineEventNotifier();
    final Event event = TestEvents.event("evt_1", Instant.parse("2024-07-05T10:00:00Z"));

    @Test
    public void secondarySinkFailureDoesNotBlockEmission() {
        RecordingSink primary = new RecordingSink("primary", false);
        RecordingSink secondary = new RecordingSink("secondary", true);
        EventFanout fanout = new EventFanout(List.of(primary, secondary), metrics, notifier);

        DeliveryReport report = fanout.deliver(event);

        assertTrue(report.primaryDelivered());
        assertEquals(List.of("secondary"), report.failedSinks());
        assertEquals(List.of(event), primary.written);
        assertEquals(1, metrics.count(MetricsAggregator.Counter.SINK_FAILURES));
        assertEquals(1, notifier.count(PipelineEventType.EVENT_SINK_FAILED));
    }

    @Test
    public void primaryFailureMeansNotDeliveredButOthersStillWrite() {
        RecordingSink primary = new RecordingSink("primary", true);
        RecordingSink secondary = new RecordingSink("secondary", false);
        EventFanout fanout = new EventFanout(List.of(primary, secondary), metrics, notifier);

        DeliveryReport report = fanout.deliver(event);

        assertFalse(report.primaryDelivered());
        assertEquals(List.of(event), secondary.written);
        assertEquals(1, metrics.count(MetricsAggregator.Counter.SINK_FAILURES));
    }

    @Test
    public void flushAndCloseReachesEverySink() {
        RecordingSink failing = new RecordingSink("failing", true);
        RecordingSink healthy = new RecordingSink("healthy", false);
        new EventFanout(List.of(failing, healthy), metrics, notifier).flushAndClose();
        assertTrue(failing.closed);
        assertTrue(healthy.closed);
    }
}
