package com.whereq.memori.queue;

import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.QueuedJob;
import lombok.Value;

/**
 * One entry read from a job stream
 */
@Value
public class BrokerEntry {

    JobKind kind;

    /**
     * Stream record id, used for acknowledgement
     */
    String recordId;

    /**
     * Decoded job, null when the entry could not be decoded
     */
    QueuedJob job;

    /**
     * Raw {@code data} field, kept for logging undecodable entries
     */
    String raw;

    public boolean isDecodable() {
        return job != null && job.getJobId() != null && !job.getJobId().isBlank();
    }

    public String getUserId() {
        return job == null ? null : job.getUserId();
    }
}
