package com.mindtrends.monitor.model;

/**
 * A window that could not be fetched.
 *
 * @param retriable true when a later run may succeed (rate limit, network, timeout);
 *                  false for requests the upstream will never accept
 * @param attempts  number of requests actually issued, 0 when rejected before sending
 */
public record FetchFailure(ChunkWindow window,
                           FailureKind kind,
                           boolean retriable,
                           String message,
                           int attempts) implements ChunkResult {

    public static FetchFailure of(ChunkWindow window, FailureKind kind, String message, int attempts) {
        return new FetchFailure(window, kind, kind.isRetriable(), message, attempts);
    }

    @Override
    public boolean isSuccess() {
        return false;
    }
}
