package com.whereq.memori.handler;

import com.whereq.memori.conversation.ConversationAnchor;
import com.whereq.memori.conversation.ConversationMode;
import lombok.Value;

/**
 * Conversation a handler wants opened once its result has been delivered
 */
@Value
public class ConversationDirective {

    ConversationMode mode;

    ConversationAnchor anchor;

    public static ConversationDirective awaitButton(ConversationAnchor anchor) {
        return new ConversationDirective(ConversationMode.AWAITING_BUTTON, anchor);
    }

    public static ConversationDirective awaitReply(ConversationAnchor anchor) {
        return new ConversationDirective(ConversationMode.AWAITING_FOLLOWUP_REPLY, anchor);
    }
}
