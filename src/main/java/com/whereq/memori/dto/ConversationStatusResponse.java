package com.whereq.memori.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.memori.conversation.ConversationMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A user's conversation state
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationStatusResponse {

    private String userId;

    private ConversationMode mode;

    private String anchorJobId;

    private String memoryId;

    /**
     * Pending follow-up question, only while awaiting a reply
     */
    private String question;

    private Instant openedAt;

    private Instant expiresAt;
}
