package com.whereq.memori.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.exception.InvalidLlmResponseException;
import com.whereq.memori.exception.LlmUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Client for an OpenAI-compatible chat-completions endpoint.
 *
 * Failures come out as one of two exceptions: {@link LlmUnavailableException}
 * when the call could not be completed (connection refused, timeout, 5xx,
 * 429), {@link InvalidLlmResponseException} when the service answered with
 * something unusable.
 */
@Slf4j
@Service
public class LlmClient {

    private static final double TEMPERATURE = 0.3;

    @Autowired
    @Qualifier("llmWebClient")
    private WebClient llmWebClient;

    @Autowired
    private MemoriProperties properties;

    /**
     * Text completion
     *
     * @param model model name
     * @param prompt user prompt
     * @return Mono with the assistant's reply text
     */
    public Mono<String> complete(String model, String prompt) {
        Map<String, Object> request = Map.of(
            "model", model,
            "messages", List.of(Map.of("role", "user", "content", prompt)),
            "temperature", TEMPERATURE
        );
        return chat(model, request, properties.getLlm().getTimeout());
    }

    /**
     * Vision completion with a base64-encoded JPEG
     */
    public Mono<String> completeWithImage(String model, String prompt, String imageBase64) {
        Map<String, Object> request = Map.of(
            "model", model,
            "messages", List.of(Map.of(
                "role", "user",
                "content", List.of(
                    Map.of("type", "text", "text", prompt),
                    Map.of("type", "image_url",
                        "image_url", Map.of("url", "data:image/jpeg;base64," + imageBase64))
                )
            )),
            "temperature", TEMPERATURE
        );
        return chat(model, request, properties.getLlm().getVisionTimeout());
    }

    private Mono<String> chat(String model, Map<String, Object> request, Duration timeout) {
        long startTime = System.currentTimeMillis();
        log.debug("LLM request | model={}", model);

        return llmWebClient.post()
            .uri("/chat/completions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .onStatus(HttpStatusCode::isError, this::mapErrorStatus)
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .onErrorMap(TimeoutException.class,
                e -> new LlmUnavailableException("LLM call timed out after " + timeout, e))
            .onErrorMap(WebClientRequestException.class,
                e -> new LlmUnavailableException("LLM endpoint unreachable: " + e.getMessage(), e))
            .map(this::extractContent)
            .doOnSuccess(content -> log.info("LLM response | model={} | durationMs={} | length={}",
                model, System.currentTimeMillis() - startTime, content.length()))
            .doOnError(e -> log.warn("LLM call failed | model={} | durationMs={} | error={}",
                model, System.currentTimeMillis() - startTime, e.getMessage()));
    }

    private Mono<? extends Throwable> mapErrorStatus(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> {
                String message = String.format("LLM API error: %d %s", status, abbreviate(body));
                if (status == 429 || status >= 500) {
                    return new LlmUnavailableException(message);
                }
                return new InvalidLlmResponseException(message);
            });
    }

    private String extractContent(JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull() || content.asText().isBlank()) {
            throw new InvalidLlmResponseException("LLM response has no message content");
        }
        return content.asText();
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
