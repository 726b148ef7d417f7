package com.whereq.memori.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A job as it sits on a broker partition
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueuedJob {
    /**
     * Unique job identifier, assigned at submission
     */
    @JsonProperty("job_id")
    private String jobId;

    /**
     * Raw job type; may name a kind this worker has no handler for
     */
    @JsonProperty("job_type")
    @JsonAlias("kind")
    private String jobType;

    /**
     * User who submitted the originating message
     */
    @JsonProperty("user_id")
    private String userId;

    /**
     * Kind-specific payload
     */
    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    /**
     * Submission time, the origin of the hard expiry
     */
    @JsonProperty("created_at")
    private Instant createdAt;

    /**
     * Redis Stream record ID (for acknowledgment)
     */
    @JsonIgnore
    private String recordId;

    @JsonIgnore
    public Optional<JobKind> getKind() {
        return JobKind.fromWireName(jobType);
    }

    @JsonIgnore
    public String payloadString(String key) {
        Object value = payload == null ? null : payload.get(key);
        return value == null ? null : value.toString();
    }

    /**
     * Saved record this job is about, empty string when there is none yet
     */
    @JsonIgnore
    public String anchorMemoryId() {
        String memoryId = payloadString("memory_id");
        return memoryId == null ? "" : memoryId;
    }

    /**
     * Original message text, used for "earlier message" framing
     */
    @JsonIgnore
    public String originalMessage() {
        String message = payloadString("message");
        if (message == null) {
            message = payloadString("original_message");
        }
        if (message == null) {
            message = payloadString("memory_content");
        }
        return message;
    }

    /**
     * Creation time of the user's original message; falls back to job creation
     */
    @JsonIgnore
    public String originalTimestamp() {
        String timestamp = payloadString("original_timestamp");
        if (timestamp == null && createdAt != null) {
            timestamp = createdAt.toString();
        }
        return timestamp;
    }
}
