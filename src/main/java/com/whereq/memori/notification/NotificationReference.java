package com.whereq.memori.notification;

import com.whereq.memori.model.QueuedJob;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Pointer back to the message a notification answers
 */
@Value
@Builder
public class NotificationReference {

    String jobId;

    String jobType;

    String originalMessage;

    /**
     * When the originating job was submitted
     */
    Instant submittedAt;

    public static NotificationReference of(QueuedJob job) {
        return NotificationReference.builder()
            .jobId(job.getJobId())
            .jobType(job.getJobType())
            .originalMessage(job.originalMessage())
            .submittedAt(job.getCreatedAt())
            .build();
    }
}
