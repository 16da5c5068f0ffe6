package com.watchpost.pipeline.inference;

public final class Description {
    final String text;
    final long millis;
    final boolean fallback;

    public Description(String text, long millis, boolean fallback) {
        this.text = text;
        this.millis = millis;
        this.fallback = fallback;
    }

    public String text() {
        return text;
    }

    public long millis() {
        return millis;
    }

    /** True when the text was built from the labels because the description service failed */
    public boolean fallback() {
        return fallback;
    }
}
