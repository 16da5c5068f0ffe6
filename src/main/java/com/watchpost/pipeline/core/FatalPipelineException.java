package com.watchpost.pipeline.core;

public class FatalPipelineException extends WatchpostException {
    final FatalReason reason;

    public FatalPipelineException(FatalReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public FatalPipelineException(FatalReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FatalReason getReason() {
        return reason;
    }

    /** Single-line diagnostic printed before exit. */
    public String diagnostic() {
        String details = String.valueOf(getMessage()).replace('\n', ' ').replace('\r', ' ');
        return String.format("FATAL [%s] %s: %s", reason, reason.invariant(), details);
    }
}
