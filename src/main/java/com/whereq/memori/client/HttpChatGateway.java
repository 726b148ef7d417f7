package com.whereq.memori.client;

import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.notification.ChoiceOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Chat gateway reached over HTTP. Errors are passed to the caller, which
 * owns the retry policy.
 */
@Slf4j
@Service
public class HttpChatGateway implements ChatGateway {

    @Autowired
    @Qualifier("gatewayWebClient")
    private WebClient gatewayWebClient;

    @Autowired
    private MemoriProperties properties;

    @Override
    public Mono<Void> sendText(String userId, String text) {
        return post("/messages/text", userId, Map.of(
            "user_id", userId,
            "text", text
        ));
    }

    @Override
    public Mono<Void> sendChoice(String userId, String text, List<ChoiceOption> options) {
        List<Map<String, String>> buttons = options.stream()
            .map(option -> Map.of("id", option.getId(), "label", option.getLabel()))
            .collect(Collectors.toList());

        return post("/messages/choice", userId, Map.of(
            "user_id", userId,
            "text", text,
            "options", buttons
        ));
    }

    @Override
    public Mono<Void> sendPlainPrompt(String userId, String text) {
        return post("/messages/prompt", userId, Map.of(
            "user_id", userId,
            "text", text
        ));
    }

    private Mono<Void> post(String path, String userId, Map<String, ?> payload) {
        return gatewayWebClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .timeout(properties.getGateway().getTimeout())
            .doOnSuccess(response -> log.debug("Gateway {} for user {}: {}",
                path, userId, response.getStatusCode()))
            .doOnError(error -> log.debug("Gateway {} for user {} failed: {}",
                path, userId, error.getMessage()))
            .then();
    }
}
