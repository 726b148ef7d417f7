package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Builder;
import lombok.Value;

/**
 * A reminder or task whose resolved time already lies in the past by the
 * time the job was processed
 */
@Value
@Builder
public class StaleReschedule implements NotificationContent {

    /**
     * Creation time of the user's original message
     */
    String originalDate;

    String resolvedDate;

    String description;

    String memoryId;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.STALE_RESCHEDULE;
    }
}
