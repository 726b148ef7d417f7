package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReminderProposal implements NotificationContent {

    /**
     * What the user wants to be reminded about
     */
    String action;

    /**
     * Absolute ISO-8601 time resolved against the original message timestamp
     */
    String resolvedTime;

    String memoryId;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.REMINDER_PROPOSAL;
    }
}
