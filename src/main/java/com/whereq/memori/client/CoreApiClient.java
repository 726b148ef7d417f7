package com.whereq.memori.client;

import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.exception.CoreApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the core REST service that owns memories, tasks and events
 */
@Slf4j
@Service
public class CoreApiClient {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
        new ParameterizedTypeReference<>() { };

    private static final ParameterizedTypeReference<List<Map<String, Object>>> LIST_TYPE =
        new ParameterizedTypeReference<>() { };

    @Autowired
    @Qualifier("coreWebClient")
    private WebClient coreWebClient;

    @Autowired
    private MemoriProperties properties;

    /**
     * Save a text memory
     *
     * @param content memory text
     * @param ownerUserId owner
     * @return Mono with the new memory id
     */
    public Mono<String> createMemory(String content, String ownerUserId) {
        Map<String, Object> body = new HashMap<>();
        body.put("content", content);
        body.put("owner_user_id", ownerUserId);

        return coreWebClient.post()
            .uri("/memories")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toException("POST /memories", response))
            .bodyToMono(MAP_TYPE)
            .timeout(properties.getCoreApi().getTimeout())
            .onErrorMap(WebClientRequestException.class, e -> new CoreApiException("POST /memories failed", e))
            .map(response -> {
                Object id = response.containsKey("memory_id") ? response.get("memory_id") : response.get("id");
                if (id == null) {
                    throw new CoreApiException("POST /memories returned no id", 200);
                }
                return id.toString();
            })
            .doOnSuccess(id -> log.info("Created memory {} for user {}", id, ownerUserId));
    }

    /**
     * Attach tags to a memory
     */
    public Mono<Void> addTags(String memoryId, List<String> tags, String status) {
        String path = "/memories/" + memoryId + "/tags";
        return coreWebClient.post()
            .uri("/memories/{id}/tags", memoryId)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("tags", tags, "status", status))
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toException("POST " + path, response))
            .toBodilessEntity()
            .timeout(properties.getCoreApi().getTimeout())
            .onErrorMap(WebClientRequestException.class, e -> new CoreApiException("POST " + path + " failed", e))
            .then();
    }

    /**
     * Full-text search over a user's memories
     */
    public Mono<List<Map<String, Object>>> search(String query, String ownerUserId) {
        return coreWebClient.get()
            .uri(uri -> uri.path("/search").queryParam("q", query).queryParam("owner", ownerUserId).build())
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toException("GET /search", response))
            .bodyToMono(LIST_TYPE)
            .timeout(properties.getCoreApi().getTimeout())
            .onErrorMap(WebClientRequestException.class, e -> new CoreApiException("GET /search failed", e))
            .defaultIfEmpty(List.of());
    }

    /**
     * Tasks of a user that are not done yet
     */
    public Mono<List<Map<String, Object>>> getOpenTasks(String ownerUserId) {
        return coreWebClient.get()
            .uri(uri -> uri.path("/tasks")
                .queryParam("owner_user_id", ownerUserId)
                .queryParam("state", "NOT_DONE")
                .build())
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toException("GET /tasks", response))
            .bodyToMono(LIST_TYPE)
            .timeout(properties.getCoreApi().getTimeout())
            .onErrorMap(WebClientRequestException.class, e -> new CoreApiException("GET /tasks failed", e))
            .defaultIfEmpty(List.of());
    }

    /**
     * Create a pending event
     *
     * @return Mono with the created event
     */
    public Mono<Map<String, Object>> createEvent(Map<String, Object> eventData) {
        return coreWebClient.post()
            .uri("/events")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(eventData)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toException("POST /events", response))
            .bodyToMono(MAP_TYPE)
            .timeout(properties.getCoreApi().getTimeout())
            .onErrorMap(WebClientRequestException.class, e -> new CoreApiException("POST /events failed", e))
            .defaultIfEmpty(Map.of());
    }

    private Mono<? extends Throwable> toException(String call, ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> new CoreApiException(call + " returned " + status + ": " + body, status));
    }
}
