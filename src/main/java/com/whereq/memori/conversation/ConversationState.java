package com.whereq.memori.conversation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A user's open conversation. Users without one are idle.
 */
@Value
@Builder
public class ConversationState {

    String userId;

    ConversationMode mode;

    ConversationAnchor anchor;

    Instant openedAt;

    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public String getAnchorJobId() {
        return anchor == null ? null : anchor.getJobId();
    }
}
