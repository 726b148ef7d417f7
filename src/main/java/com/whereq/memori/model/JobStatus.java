package com.whereq.memori.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Job lifecycle states
 *
 * State transitions:
 * QUEUED → PROCESSING → {COMPLETED, FAILED, EXPIRED}
 * PROCESSING → PROCESSING while a retry is pending
 */
public enum JobStatus {
    /**
     * Committed to the broker, not consumed yet
     */
    QUEUED,

    /**
     * Picked up by the consumer (also kept while waiting for a retry)
     */
    PROCESSING,

    /**
     * Handler produced a result
     */
    COMPLETED,

    /**
     * Invalid-response budget exhausted or no handler for the kind
     */
    FAILED,

    /**
     * Service stayed unavailable past the hard expiry
     */
    EXPIRED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EXPIRED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static JobStatus fromWireValue(String value) {
        return JobStatus.valueOf(value.trim().toUpperCase());
    }
}
