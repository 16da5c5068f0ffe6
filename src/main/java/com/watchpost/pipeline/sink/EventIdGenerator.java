package com.watchpost.pipeline.sink;

import java.time.Clock;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

/**
 * Issues {@code evt_<epochMillis>_<4 hex>} ids. Ids drawn within the same millisecond are
 * remembered and re-drawn on collision, so no id repeats during the process lifetime.
 */
public class EventIdGenerator {
    static final int SUFFIX_SPACE = 0x10000;

    final Clock clock;
    final Random random;
    final Set<Integer> issuedThisMillis = new HashSet<>();
    long currentMillis = -1L;

    public EventIdGenerator(Clock clock) {
        this(clock, new Random());
    }

    public EventIdGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    public synchronized String nextId() {
        long millis = clock.millis();
        if (millis != currentMillis) {
            currentMillis = millis;
            issuedThisMillis.clear();
        }
        if (issuedThisMillis.size() >= SUFFIX_SPACE) {
            throw new IllegalStateException("Event id space exhausted for millisecond " + millis);
        }
        int suffix;
        do {
            suffix = random.nextInt(SUFFIX_SPACE);
        } while (!issuedThisMillis.add(suffix));
        return String.format("evt_%d_%04x", millis, suffix);
    }
}
