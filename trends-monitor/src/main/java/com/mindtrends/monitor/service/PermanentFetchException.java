package com.mindtrends.monitor.service;

import com.mindtrends.monitor.model.FailureKind;

/** The upstream will never answer this request; retrying is pointless. */
public class PermanentFetchException extends FetchException {

    public PermanentFetchException(FailureKind kind, String message) {
        this(kind, message, null);
    }

    public PermanentFetchException(FailureKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
