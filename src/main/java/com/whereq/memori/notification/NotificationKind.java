package com.whereq.memori.notification;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of outbound message kinds. New kinds are added here, never by
 * reusing the payload shape of an existing one.
 */
public enum NotificationKind {

    REMINDER_PROPOSAL("reminder-proposal"),

    TASK_PROPOSAL("task-proposal"),

    SEARCH_RESULTS("search-results"),

    NOTE_SAVED("note-saved"),

    FOLLOWUP_QUESTION("followup-question"),

    STALE_RESCHEDULE("stale-reschedule"),

    INVALID_RESPONSE_FAILURE("invalid-response-failure"),

    UNAVAILABLE_NOTICE("unavailable-notice"),

    EXPIRED_NOTICE("expired-notice"),

    TASK_MATCH_PROPOSAL("task-match-proposal"),

    EVENT_PROPOSAL("event-proposal"),

    UNSUPPORTED_JOB("unsupported-job"),

    /**
     * Handler found nothing worth telling the user; never sent to the gateway
     */
    NO_ACTION("no-action");

    private final String wireName;

    NotificationKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
