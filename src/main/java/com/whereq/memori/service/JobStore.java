package com.whereq.memori.service;

import com.whereq.memori.dto.JobStatusUpdate;
import com.whereq.memori.model.JobRecord;
import reactor.core.publisher.Mono;

/**
 * Authoritative record of job status, owned by the core service.
 * Only the job consumer writes to it; nothing is ever deleted.
 */
public interface JobStore {

    /**
     * Apply a status transition
     *
     * @param jobId job identifier
     * @param update new status with result, error or attempt count
     * @return Mono that completes when the store accepted the update
     */
    Mono<Void> updateStatus(String jobId, JobStatusUpdate update);

    /**
     * Get a job record
     *
     * @param jobId job identifier
     * @return Mono with the record, empty when the store does not know the job
     */
    Mono<JobRecord> get(String jobId);
}
