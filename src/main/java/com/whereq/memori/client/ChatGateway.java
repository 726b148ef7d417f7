package com.whereq.memori.client;

import com.whereq.memori.notification.ChoiceOption;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Chat-delivery gateway. Renders messages to the end user; button presses
 * and free-text replies come back through the conversation API.
 */
public interface ChatGateway {

    /**
     * Send a plain message
     *
     * @param userId recipient
     * @param text message text
     * @return Mono that completes when the gateway accepted the message
     */
    Mono<Void> sendText(String userId, String text);

    /**
     * Send a message with buttons. The selected option id is reported back
     * asynchronously.
     */
    Mono<Void> sendChoice(String userId, String text, List<ChoiceOption> options);

    /**
     * Send a question that awaits a free-text reply
     */
    Mono<Void> sendPlainPrompt(String userId, String text);
}
