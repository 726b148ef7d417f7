package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Builder;
import lombok.Value;

/**
 * A newly saved memory looks like it completes one of the user's open tasks
 */
@Value
@Builder
public class TaskMatchProposal implements NotificationContent {

    String taskId;

    String taskDescription;

    String memoryId;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.TASK_MATCH_PROPOSAL;
    }
}
