package com.watchpost.pipeline.sink;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.watchpost.pipeline.core.PipelineEventNotifier;
import com.watchpost.pipeline.core.PipelineEventType;
import com.watchpost.pipeline.metrics.MetricsAggregator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to all sinks in order. The first sink is primary: if it fails the event
 * is not emitted. Failures of the other sinks are logged and reported, never propagated.
 */
public class EventFanout {
    final static Logger LOGGER = LoggerFactory.getLogger(EventFanout.class);
    final static String REPORTER = "EventFanout";

    final ImmutableList<EventSink> sinks;
    final MetricsAggregator metrics;
    final PipelineEventNotifier eventNotifier;

    public EventFanout(List<EventSink> sinks, MetricsAggregator metrics, PipelineEventNotifier eventNotifier) {
        checkArgument(!sinks.isEmpty(), "At least one event sink is required");
        this.sinks = ImmutableList.copyOf(sinks);
        this.metrics = metrics;
        this.eventNotifier = eventNotifier;
    }

    public ImmutableList<EventSink> sinks() {
        return sinks;
    }

    public DeliveryReport deliver(Event event) {
        boolean primaryDelivered = false;
        List<String> failedSinks = new ArrayList<>();
        for (int i = 0; i < sinks.size(); i++) {
            EventSink sink = sinks.get(i);
            boolean primary = i == 0;
            try {
                sink.write(event);
                if (primary) {
                    primaryDelivered = true;
                }
            } catch (IOException | RuntimeException e) {
                metrics.increment(MetricsAggregator.Counter.SINK_FAILURES);
                failedSinks.add(sink.name());
                if (primary) {
                    LOGGER.error("Primary sink {} failed to write event {}", sink.name(), event.eventId(), e);
                } else {
                    LOGGER.warn("Sink {} failed to write event {}: {}", sink.name(), event.eventId(), e.toString());
                    eventNotifier.notifyEvent(REPORTER, PipelineEventType.EVENT_SINK_FAILED, event.cameraName(),
                            String.format("Sink [%s] failed to write event %s", sink.name(), event.eventId()), e.toString());
                }
            }
        }
        return new DeliveryReport(primaryDelivered, failedSinks);
    }

    /** Flushes and closes every sink; one failing sink doesn't stop the others. */
    public void flushAndClose() {
        for (EventSink sink : sinks) {
            try {
                sink.flush();
            } catch (IOException | RuntimeException e) {
                LOGGER.error("Error flushing sink {}", sink.name(), e);
            }
            try {
                sink.close();
            } catch (IOException | RuntimeException e) {
                LOGGER.error("Error closing sink {}", sink.name(), e);
            }
        }
    }
}
