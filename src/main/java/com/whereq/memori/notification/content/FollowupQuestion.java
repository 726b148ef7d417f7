package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Value;

@Value
public class FollowupQuestion implements NotificationContent {

    String question;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.FOLLOWUP_QUESTION;
    }
}
