package com.mindtrends.monitor.model;

public enum FailureKind {
    RATE_LIMITED(true),
    NETWORK(true),
    SERVER_ERROR(true),
    NO_DATA(true),
    TIMEOUT(true),
    INVALID_CONSTRUCT(false),
    MALFORMED_WINDOW(false),
    CLIENT_ERROR(false);

    private final boolean retriable;

    FailureKind(boolean retriable) {
        this.retriable = retriable;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
