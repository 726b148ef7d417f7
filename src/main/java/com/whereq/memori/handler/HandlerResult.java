package com.whereq.memori.handler;

import com.whereq.memori.notification.content.NoAction;
import com.whereq.memori.notification.content.NotificationContent;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of a successful handler run
 */
@Value
@Builder
public class HandlerResult {

    /**
     * Persisted to the job store with the completed status
     */
    @Builder.Default
    Map<String, Object> result = Map.of();

    /**
     * Exactly one notification per completed job, {@link NoAction} when
     * there is nothing to tell
     */
    NotificationContent notification;

    /**
     * Conversation to open, null to leave the user idle
     */
    ConversationDirective directive;

    public static HandlerResult noAction(Map<String, Object> result, String reason) {
        return HandlerResult.builder()
            .result(result)
            .notification(new NoAction(reason))
            .build();
    }
}
