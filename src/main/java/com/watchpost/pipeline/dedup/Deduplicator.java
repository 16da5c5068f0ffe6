package com.watchpost.pipeline.dedup;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import com.watchpost.pipeline.config.Config;
import com.watchpost.pipeline.inference.DetectionSet;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Iterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Suppresses events whose label set overlaps (Jaccard) a recently emitted one.
 * History is a small ring shared by the whole system, newest last.
 */
public class Deduplicator {
    final static Logger LOGGER = LoggerFactory.getLogger(Deduplicator.class);

    final Ticker ticker;
    final ArrayDeque<SuppressionEntry> history = new ArrayDeque<>();

    long windowNanos;
    double overlapThreshold;
    int historySize;
    SuppressionRefreshPolicy refreshPolicy;

    public Deduplicator(Duration window, double overlapThreshold, int historySize,
                        SuppressionRefreshPolicy refreshPolicy, Ticker ticker) {
        this.ticker = ticker;
        reconfigure(window, overlapThreshold, historySize, refreshPolicy);
    }

    public static Deduplicator fromConfig(Config config, Ticker ticker) {
        return new Deduplicator(Duration.ofSeconds(config.suppressionWindowSeconds()), config.labelOverlapThreshold(),
                config.suppressionHistorySize(), config.suppressionRefreshPolicy(), ticker);
    }

    public synchronized void reconfigure(Duration window, double overlapThreshold, int historySize,
                                         SuppressionRefreshPolicy refreshPolicy) {
        checkArgument(!window.isNegative() && !window.isZero(), "window must be positive");
        checkArgument(overlapThreshold > 0.0 && overlapThreshold <= 1.0, "overlapThreshold must be within (0, 1]");
        checkArgument(historySize > 0, "historySize must be positive");
        this.windowNanos = window.toNanos();
        this.overlapThreshold = overlapThreshold;
        this.historySize = historySize;
        this.refreshPolicy = refreshPolicy;
        while (history.size() > historySize) {
            history.pollFirst();
        }
    }

    /** @return true if an event should be emitted for these detections; records it if so */
    public synchronized boolean shouldEmit(DetectionSet detections) {
        ImmutableSortedSet<String> signature = detections.labels();
        if (signature.isEmpty()) {
            return false;
        }
        long now = ticker.read();
        evictExpired(now);

        Iterator<SuppressionEntry> newestFirst = history.descendingIterator();
        while (newestFirst.hasNext()) {
            SuppressionEntry entry = newestFirst.next();
            double overlap = jaccard(signature, entry.labelSetSignature);
            if (overlap >= overlapThreshold && now - entry.lastSeenAtNanos < windowNanos) {
                LOGGER.debug("Event {} suppressed: overlaps {} by {} within {}s",
                        signature, entry.labelSetSignature, overlap, Duration.ofNanos(windowNanos).getSeconds());
                if (refreshPolicy == SuppressionRefreshPolicy.REFRESH_ON_SUPPRESS) {
                    entry.lastSeenAtNanos = now;
                }
                return false;
            }
        }

        if (history.size() >= historySize) {
            history.pollFirst();
        }
        history.addLast(new SuppressionEntry(signature, now));
        return true;
    }

    void evictExpired(long now) {
        long retention = 2 * windowNanos;
        history.removeIf(entry -> now - entry.lastSeenAtNanos > retention);
    }

    public synchronized int historySize() {
        return history.size();
    }

    static double jaccard(ImmutableSortedSet<String> a, ImmutableSortedSet<String> b) {
        int union = Sets.union(a, b).size();
        if (union == 0) {
            return 0.0;
        }
        return (double) Sets.intersection(a, b).size() / union;
    }
}
