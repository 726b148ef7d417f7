package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Value;

@Value
public class NoAction implements NotificationContent {

    String reason;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.NO_ACTION;
    }
}
