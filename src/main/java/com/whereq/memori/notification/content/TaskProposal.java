package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TaskProposal implements NotificationContent {

    String description;

    String resolvedDueTime;

    String memoryId;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.TASK_PROPOSAL;
    }
}
