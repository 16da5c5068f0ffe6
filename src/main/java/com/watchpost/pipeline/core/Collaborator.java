package com.watchpost.pipeline.core;

/** Something outside the pipeline that is health-checked before the first frame is consumed. */
public interface Collaborator {
    String name();

    default void checkHealth() throws CollaboratorUnavailableException {
    }
}
