package com.whereq.memori.notification;

import com.whereq.memori.notification.content.NotificationContent;
import lombok.Builder;
import lombok.Value;

/**
 * One outbound message for one user
 */
@Value
@Builder
public class Notification {

    String userId;

    NotificationContent content;

    /**
     * Originating job, null for messages not tied to a job
     */
    NotificationReference reference;

    public NotificationKind getKind() {
        return content.getKind();
    }

    public String getReferenceJobId() {
        return reference == null ? null : reference.getJobId();
    }
}
