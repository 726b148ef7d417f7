package com.whereq.memori.retry;

/**
 * The two failure channels of a classification call. They have unrelated
 * retry policies and never share a counter.
 */
public enum FailureKind {
    /**
     * The call returned, but the output was malformed or incomplete
     */
    INVALID_RESPONSE,

    /**
     * The call could not be completed: refused, timed out, 5xx
     */
    UNAVAILABLE
}
