package com.whereq.memori.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of LLM work types.
 *
 * Each kind owns exactly one broker partition (a Redis stream) that a
 * single consumer loop drains.
 */
public enum JobKind {

    INTENT_CLASSIFY("intent_classify", "llm:intent"),

    IMAGE_TAG("image_tag", "llm:image_tag"),

    TASK_MATCH("task_match", "llm:task_match"),

    EMAIL_EXTRACT("email_extract", "llm:email_extract"),

    FOLLOWUP("followup", "llm:followup");

    private final String wireName;
    private final String streamKey;

    JobKind(String wireName, String streamKey) {
        this.wireName = wireName;
        this.streamKey = streamKey;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getStreamKey() {
        return streamKey;
    }

    /**
     * Resolve a kind from the {@code job_type} field carried by a broker entry
     */
    public static Optional<JobKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(kind -> kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
            .findFirst();
    }
}
