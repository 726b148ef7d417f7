package com.whereq.memori.controller;

import com.whereq.memori.dto.ButtonPressRequest;
import com.whereq.memori.dto.ButtonPressResponse;
import com.whereq.memori.dto.ConversationStatusResponse;
import com.whereq.memori.dto.ReplyRequest;
import com.whereq.memori.dto.ReplyResponse;
import com.whereq.memori.service.ConversationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Entry point for user input that belongs to an open conversation.
 * The chat gateway calls it before turning a message into a new job.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/conversations")
@Tag(name = "Conversations", description = "Follow-up replies and button presses")
public class ConversationController {

    @Autowired
    private ConversationService conversationService;

    /**
     * Offer a free-text message as the answer to a pending follow-up question
     *
     * @param userId user who sent the text
     * @param request message text
     * @return Mono with 200; {@code consumed=false} tells the caller to submit a new job
     */
    @PostMapping("/{userId}/replies")
    @Operation(summary = "Free-text reply", description = "Re-classify a pending ambiguous message with the user's answer")
    public Mono<ResponseEntity<ReplyResponse>> reply(
            @PathVariable String userId,
            @Valid @RequestBody ReplyRequest request) {

        log.debug("Reply from user {}", userId);

        return conversationService.onTextReply(userId, request.getText())
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("Unexpected error handling reply from user {}", userId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ReplyResponse.builder()
                        .consumed(false)
                        .errorMessage("Internal server error: " + e.getMessage())
                        .build()));
            });
    }

    /**
     * Conclude a choice conversation
     *
     * @param userId user who pressed the button
     * @param request option pressed
     * @return Mono with 200 and whether a conversation was closed
     */
    @PostMapping("/{userId}/buttons")
    @Operation(summary = "Button press", description = "Close the conversation a choice message opened")
    public Mono<ResponseEntity<ButtonPressResponse>> buttonPress(
            @PathVariable String userId,
            @Valid @RequestBody ButtonPressRequest request) {

        return Mono.fromCallable(() ->
                conversationService.onButtonPress(userId, request.getAnchorJobId(), request.getOptionId()))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{userId}")
    @Operation(summary = "Conversation state", description = "Current conversation mode of a user")
    public Mono<ResponseEntity<ConversationStatusResponse>> status(@PathVariable String userId) {
        return Mono.fromCallable(() -> conversationService.status(userId))
            .map(ResponseEntity::ok);
    }
}
