package com.whereq.memori.notification;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Notification turned into gateway-ready text
 */
@Value
@Builder(toBuilder = true)
public class RenderedMessage {

    public enum Style {
        /**
         * Plain message, nothing expected back
         */
        TEXT,

        /**
         * Message with buttons
         */
        CHOICE,

        /**
         * Question awaiting a free-text reply
         */
        PROMPT
    }

    Style style;

    String text;

    @Singular
    List<ChoiceOption> options;
}
