package com.watchpost.pipeline.acquisition;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;

/** initial, 2*initial, 4*initial ... capped at max. */
public class ExponentialBackoff {
    static final int MAX_POWER_OF_2 = 30;

    final Duration initialDelay;
    final Duration maxDelay;

    public ExponentialBackoff(Duration initialDelay, Duration maxDelay) {
        checkArgument(!initialDelay.isNegative() && !initialDelay.isZero(), "initialDelay must be positive");
        checkArgument(maxDelay.compareTo(initialDelay) >= 0, "maxDelay must be >= initialDelay");
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    /** @param attempt 0-based index of the retry */
    public Duration delay(int attempt) {
        int power = Math.min(Math.max(attempt, 0), MAX_POWER_OF_2);
        Duration delay = initialDelay.multipliedBy(1L << power);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }
}
