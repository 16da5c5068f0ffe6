package com.watchpost.pipeline.sink;

import com.google.common.collect.ImmutableList;
import java.util.List;

public final class DeliveryReport {
    final boolean primaryDelivered;
    final ImmutableList<String> failedSinks;

    public DeliveryReport(boolean primaryDelivered, List<String> failedSinks) {
        this.primaryDelivered = primaryDelivered;
        this.failedSinks = ImmutableList.copyOf(failedSinks);
    }

    /** The event counts as emitted only when the primary sink took it */
    public boolean primaryDelivered() {
        return primaryDelivered;
    }

    public ImmutableList<String> failedSinks() {
        return failedSinks;
    }
}
