package com.mindtrends.monitor.model;

public enum GapReason {
    /** The upstream rejected the window outright. */
    PERMANENT_FETCH_FAILURE,
    /** Retries ran out, or the run timed out, before the window was fetched. */
    RETRIES_EXHAUSTED,
    /** No chunk supplied a value for these dates, so nothing anchors them to the series scale. */
    NO_COVERAGE
}
