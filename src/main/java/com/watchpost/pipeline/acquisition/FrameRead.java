package com.watchpost.pipeline.acquisition;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import javax.annotation.Nullable;

/** Result of {@link FrameSource#read}: a frame, no data within the timeout, or end of stream. */
public final class FrameRead {
    public enum Status {
        FRAME,
        TIMEOUT,
        CLOSED
    }

    static final FrameRead TIMEOUT = new FrameRead(Status.TIMEOUT, null, null);

    final Status status;
    @Nullable final Frame frame;
    @Nullable final String reason;

    FrameRead(Status status, @Nullable Frame frame, @Nullable String reason) {
        this.status = status;
        this.frame = frame;
        this.reason = reason;
    }

    public static FrameRead frame(Frame frame) {
        return new FrameRead(Status.FRAME, checkNotNull(frame), null);
    }

    public static FrameRead timeout() {
        return TIMEOUT;
    }

    public static FrameRead closed(String reason) {
        return new FrameRead(Status.CLOSED, null, reason);
    }

    public Status status() {
        return status;
    }

    public Frame frame() {
        checkState(status == Status.FRAME, "No frame in a %s read", status);
        return checkNotNull(frame);
    }

    @Nullable
    public String reason() {
        return reason;
    }
}
