package com.whereq.memori.handler;

import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.QueuedJob;
import reactor.core.publisher.Mono;

/**
 * Processes one kind of job
 */
public interface JobHandler {

    /**
     * Kind of job this handler processes
     */
    JobKind kind();

    /**
     * Process a job.
     *
     * Errors are classified by the caller: an unusable model answer should
     * surface as {@link com.whereq.memori.exception.InvalidLlmResponseException},
     * an unreachable service as
     * {@link com.whereq.memori.exception.LlmUnavailableException}.
     *
     * @param job the queued job
     * @return Mono with the result to persist and announce
     */
    Mono<HandlerResult> handle(QueuedJob job);
}
