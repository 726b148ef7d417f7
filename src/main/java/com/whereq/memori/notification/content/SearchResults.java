package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SearchResults implements NotificationContent {

    String query;

    /**
     * Ranked best first
     */
    @Singular
    List<Hit> results;

    @Override
    public NotificationKind getKind() {
        return NotificationKind.SEARCH_RESULTS;
    }

    @Value
    public static class Hit {
        String memoryId;
        String title;
    }
}
