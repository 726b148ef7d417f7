package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EventProposal implements NotificationContent {

    String eventId;

    String description;

    String eventTime;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.EVENT_PROPOSAL;
    }
}
