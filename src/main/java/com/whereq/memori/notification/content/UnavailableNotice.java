package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Value;

/**
 * One-time notice that processing is delayed because the model service is down
 */
@Value
public class UnavailableNotice implements NotificationContent {

    String jobKind;

    String anchorRecordId;

    String originalDate;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.UNAVAILABLE_NOTICE;
    }
}
