package com.watchpost.pipeline.pipeline;

import com.watchpost.pipeline.core.FatalPipelineException;
import javax.annotation.Nullable;

/** How a pipeline run ended. */
public final class PipelineOutcome {
    static final PipelineOutcome CLEAN = new PipelineOutcome(null);

    @Nullable final FatalPipelineException fatal;

    PipelineOutcome(@Nullable FatalPipelineException fatal) {
        this.fatal = fatal;
    }

    public static PipelineOutcome clean() {
        return CLEAN;
    }

    public static PipelineOutcome fatal(FatalPipelineException fatal) {
        return new PipelineOutcome(fatal);
    }

    public boolean isClean() {
        return fatal == null;
    }

    @Nullable
    public FatalPipelineException fatal() {
        return fatal;
    }

    public int exitCode() {
        return fatal == null ? 0 : fatal.getReason().exitCode();
    }

    /** Single-line diagnostic, or "OK" for a clean stop */
    public String diagnostic() {
        return fatal == null ? "OK" : fatal.diagnostic();
    }

    @Override
    public String toString() {
        return "PipelineOutcome[" + diagnostic() + "]";
    }
}
