package com.whereq.memori.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of offering a free-text message to the conversation gate
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplyResponse {

    /**
     * True if the text answered a pending follow-up question. When false the
     * caller submits the text as a new job.
     */
    private boolean consumed;

    /**
     * Job the answered question belonged to
     */
    private String anchorJobId;

    /**
     * Wire name of the notification produced by the re-classification
     */
    private String notificationKind;

    private String errorMessage;

    public static ReplyResponse notConsumed() {
        return ReplyResponse.builder().consumed(false).build();
    }
}
