package com.whereq.memori.service;

import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.dto.JobStatusUpdate;
import com.whereq.memori.exception.CoreApiException;
import com.whereq.memori.model.JobRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

/**
 * Job store backed by the core service's {@code /llm_jobs} resource
 */
@Slf4j
@Service
public class HttpJobStore implements JobStore {

    @Autowired
    @Qualifier("coreWebClient")
    private WebClient coreWebClient;

    @Autowired
    private MemoriProperties properties;

    @Override
    public Mono<Void> updateStatus(String jobId, JobStatusUpdate update) {
        return coreWebClient.patch()
            .uri("/llm_jobs/{id}", jobId)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(update)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toException("PATCH", jobId, response))
            .toBodilessEntity()
            .timeout(properties.getCoreApi().getTimeout())
            .onErrorMap(WebClientRequestException.class,
                e -> new CoreApiException("PATCH /llm_jobs/" + jobId + " failed", e))
            .doOnSuccess(v -> log.info("Job {} status updated → {}", jobId, update.getStatus()))
            .then();
    }

    @Override
    public Mono<JobRecord> get(String jobId) {
        return coreWebClient.get()
            .uri("/llm_jobs/{id}", jobId)
            .<JobRecord>exchangeToMono(response -> {
                if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                    return response.releaseBody().then(Mono.<JobRecord>empty());
                }
                if (response.statusCode().isError()) {
                    return toException("GET", jobId, response).flatMap(error -> Mono.<JobRecord>error(error));
                }
                return response.bodyToMono(JobRecord.class);
            })
            .timeout(properties.getCoreApi().getTimeout())
            .onErrorMap(WebClientRequestException.class,
                e -> new CoreApiException("GET /llm_jobs/" + jobId + " failed", e));
    }

    private Mono<? extends Throwable> toException(String method, String jobId, ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> new CoreApiException(
                method + " /llm_jobs/" + jobId + " returned " + status + ": " + body, status));
    }
}
