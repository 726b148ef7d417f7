package com.whereq.memori.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Job as held by the job store
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobRecord {

    private String id;

    @JsonProperty("job_type")
    private String jobType;

    private JobStatus status;

    @JsonProperty("attempt_count")
    private int attemptCount;

    private Map<String, Object> result;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
