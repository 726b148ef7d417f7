package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Value;

@Value
public class ExpiredNotice implements NotificationContent {

    String jobKind;

    String anchorRecordId;

    String originalDate;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.EXPIRED_NOTICE;
    }
}
