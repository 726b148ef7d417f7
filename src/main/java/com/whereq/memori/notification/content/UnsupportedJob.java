package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Value;

@Value
public class UnsupportedJob implements NotificationContent {

    String jobType;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.UNSUPPORTED_JOB;
    }
}
