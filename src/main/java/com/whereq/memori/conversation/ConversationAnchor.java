package com.whereq.memori.conversation;

import lombok.Builder;
import lombok.Value;

/**
 * The job and saved record a paused conversation is about
 */
@Value
@Builder(toBuilder = true)
public class ConversationAnchor {

    String jobId;

    String memoryId;

    /**
     * Text of the user's original message
     */
    String originalMessage;

    /**
     * Creation time of the original message, kept for re-classification
     */
    String originalTimestamp;

    /**
     * Question asked while waiting for a follow-up reply
     */
    String question;
}
