package com.whereq.memori.handler;

import com.whereq.memori.client.CoreApiClient;
import com.whereq.memori.client.LlmClient;
import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.conversation.ConversationAnchor;
import com.whereq.memori.model.QueuedJob;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Base for handlers that call the model and the core service
 */
public abstract class AbstractLlmHandler implements JobHandler {

    @Autowired
    protected LlmClient llmClient;

    @Autowired
    protected CoreApiClient coreApi;

    @Autowired
    protected MemoriProperties properties;

    protected String textModel() {
        return properties.getLlm().getTextModel();
    }

    /**
     * Payload field that must be present for the job to make sense
     *
     * @throws IllegalArgumentException if the field is missing or blank
     */
    protected static String requirePayload(QueuedJob job, String key) {
        String value = job.payloadString(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job " + job.getJobId() + " payload missing '" + key + "'");
        }
        return value;
    }

    protected static ConversationAnchor anchor(QueuedJob job, String memoryId, String message, String question) {
        return ConversationAnchor.builder()
            .jobId(job.getJobId())
            .memoryId(memoryId)
            .originalMessage(message)
            .originalTimestamp(job.originalTimestamp())
            .question(question)
            .build();
    }
}
