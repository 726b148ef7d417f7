package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NoteSaved implements NotificationContent {

    String memoryId;

    @Singular
    List<String> suggestedTags;

    /**
     * One-sentence description, set for images
     */
    String description;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.NOTE_SAVED;
    }
}
