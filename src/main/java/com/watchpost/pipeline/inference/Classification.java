package com.watchpost.pipeline.inference;

public final class Classification {
    final DetectionSet detections;
    final long millis;

    public Classification(DetectionSet detections, long millis) {
        this.detections = detections;
        this.millis = millis;
    }

    /** Detections left after confidence and label filtering */
    public DetectionSet detections() {
        return detections;
    }

    public long millis() {
        return millis;
    }
}
