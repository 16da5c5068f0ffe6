package com.watchpost.pipeline.dedup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.watchpost.pipeline.core.ManualTicker;
import com.watchpost.pipeline.inference.BoundingBox;
import com.watchpost.pipeline.inference.Detection;
import com.watchpost.pipeline.inference.DetectionSet;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DeduplicatorTest {
    final ManualTicker ticker = new ManualTicker();

    Deduplicator deduplicator(SuppressionRefreshPolicy policy) {
        return new Deduplicator(Duration.ofSeconds(30), 0.8, 5, policy, ticker);
    }

    static DetectionSet labels(String... labels) {
        List<Detection> detections = new ArrayList<>();
        for (String label : labels) {
            detections.add(Detection.of(label, 0.9, BoundingBox.of(0, 0, 5, 5)));
        }
        return DetectionSet.of(detections);
    }

    @Test
    public void identicalLabelsWithinWindowAreSuppressed() {
        Deduplicator deduplicator = deduplicator(SuppressionRefreshPolicy.REFRESH_ON_EMIT);
        assertTrue(deduplicator.shouldEmit(labels("person")));
        ticker.advance(Duration.ofSeconds(10));
        assertFalse(deduplicator.shouldEmit(labels("person")));
    }

    @Test
    public void identicalLabelsFurtherApartThanWindowAreEmitted() {
        Deduplicator deduplicator = deduplicator(SuppressionRefreshPolicy.REFRESH_ON_EMIT);
        assertTrue(deduplicator.shouldEmit(labels("person")));
        ticker.advance(Duration.ofSeconds(31));
        assertTrue(deduplicator.shouldEmit(labels("person")));
    }

    @Test
    public void lowOverlapIsADifferentEvent() {
        Deduplicator deduplicator = deduplicator(SuppressionRefreshPolicy.REFRESH_ON_EMIT);
        assertTrue(deduplicator.shouldEmit(labels("person", "package")));
        ticker.advance(Duration.ofSeconds(10));
        //Jaccard 1/2 is below 0.8
        assertTrue(deduplicator.shouldEmit(labels("person")));
    }

    @Test
    public void duplicateLabelsDoNotChangeTheSignature() {
        Deduplicator deduplicator = deduplicator(SuppressionRefreshPolicy.REFRESH_ON_EMIT);
        assertTrue(deduplicator.shouldEmit(labels("car", "person")));
        ticker.advance(Duration.ofSeconds(1));
        assertFalse(deduplicator.shouldEmit(labels("person", "car", "person")));
    }

    @Test
    public void emptyDetectionsAreNeverEmitted() {
        Deduplicator deduplicator = deduplicator(SuppressionRefreshPolicy.REFRESH_ON_EMIT);
        assertFalse(deduplicator.shouldEmit(DetectionSet.empty()));
        assertEquals(0, deduplicator.historySize());
    }

    @Test
    public void stationaryObjectYieldsOneEventPerWindowOnEmitRefresh() {
        Deduplicator deduplicator = deduplicator(SuppressionRefreshPolicy.REFRESH_ON_EMIT);
        int emitted = 0;
        //A person seen every 5 seconds for 90 seconds
        for (int second = 0; second < 90; second += 5) {
            if (deduplicator.shouldEmit(labels("person"))) {
                emitted++;
            }
            ticker.advance(Duration.ofSeconds(5));
        }
        assertEquals(3, emitted);
    }

    @Test
    public void stationaryObjectYieldsOneEventOnSuppressRefresh() {
        Deduplicator deduplicator = deduplicator(SuppressionRefreshPolicy.REFRESH_ON_SUPPRESS);
        int emitted = 0;
        for (int second = 0; second < 90; second += 5) {
            if (deduplicator.shouldEmit(labels("person"))) {
                emitted++;
            }
            ticker.advance(Duration.ofSeconds(5));
        }
        assertEquals(1, emitted);
    }

    @Test
    public void historyIsBoundedAndExpiredEntriesAreEvicted() {
        Deduplicator deduplicator = deduplicator(SuppressionRefreshPolicy.REFRESH_ON_EMIT);
        String[] distinct = {"a", "b", "c", "d", "e", "f", "g"};
        for (String label : distinct) {
            assertTrue(deduplicator.shouldEmit(labels(label)));
        }
        assertEquals(5, deduplicator.historySize());
        //"a" fell out of the ring, so it is new again
        assertTrue(deduplicator.shouldEmit(labels("a")));

        ticker.advance(Duration.ofSeconds(61));
        assertTrue(deduplicator.shouldEmit(labels("z")));
        assertEquals(1, deduplicator.historySize());
    }

    @Test
    public void jaccardOverlap() {
        assertEquals(1.0, Deduplicator.jaccard(labels("a", "b").labels(), labels("b", "a").labels()));
        assertEquals(0.5, Deduplicator.jaccard(labels("a", "b").labels(), labels("a").labels()));
        assertEquals(0.0, Deduplicator.jaccard(labels("a").labels(), labels("b").labels()));
    }
}
