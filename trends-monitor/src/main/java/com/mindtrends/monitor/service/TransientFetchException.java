package com.mindtrends.monitor.service;

import com.mindtrends.monitor.model.FailureKind;

/** Worth retrying: rate limits, network trouble, upstream 5xx, empty responses. */
public class TransientFetchException extends FetchException {

    public TransientFetchException(FailureKind kind, String message) {
        this(kind, message, null);
    }

    public TransientFetchException(FailureKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
