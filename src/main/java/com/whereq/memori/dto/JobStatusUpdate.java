package com.whereq.memori.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.whereq.memori.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of a job store status transition
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusUpdate {

    private JobStatus status;

    private Map<String, Object> result;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("attempt_count")
    private Integer attemptCount;
}
