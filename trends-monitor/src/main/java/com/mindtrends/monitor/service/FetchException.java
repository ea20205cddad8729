package com.mindtrends.monitor.service;

import com.mindtrends.monitor.model.FailureKind;
import lombok.Getter;

/**
 * Raised by a {@link TrendsQueryClient} when a query does not produce values.
 * Never escapes {@link RateLimitedFetcher}, which turns it into a FetchFailure.
 */
@Getter
public abstract class FetchException extends RuntimeException {

    private final FailureKind kind;

    protected FetchException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
