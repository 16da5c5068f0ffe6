package com.watchpost.pipeline.core;

public class CollaboratorUnavailableException extends WatchpostException {
    final String collaboratorName;

    public CollaboratorUnavailableException(String collaboratorName, String message) {
        super(String.format("[%s] %s", collaboratorName, message));
        this.collaboratorName = collaboratorName;
    }

    public CollaboratorUnavailableException(String collaboratorName, String message, Throwable cause) {
        super(String.format("[%s] %s", collaboratorName, message), cause);
        this.collaboratorName = collaboratorName;
    }

    public String getCollaboratorName() {
        return collaboratorName;
    }
}
