package com.whereq.memori.conversation;

/**
 * Waiting modes of a user's conversation.
 *
 * Only {@link #AWAITING_FOLLOWUP_REPLY} treats the user's next text as an
 * answer; while {@link #AWAITING_BUTTON} new text is a new job.
 */
public enum ConversationMode {
    IDLE,
    AWAITING_BUTTON,
    AWAITING_FOLLOWUP_REPLY
}
