package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Value;

@Value
public class InvalidResponseFailure implements NotificationContent {

    String jobKind;

    /**
     * Saved record the failed job was about, empty when there is none
     */
    String anchorRecordId;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.INVALID_RESPONSE_FAILURE;
    }
}
