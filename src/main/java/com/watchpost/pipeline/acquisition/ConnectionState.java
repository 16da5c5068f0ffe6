package com.watchpost.pipeline.acquisition;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /** Consecutive failures reached the limit */
    FATAL
}
