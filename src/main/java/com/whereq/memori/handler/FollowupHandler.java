package com.whereq.memori.handler;

import com.whereq.memori.exception.InvalidLlmResponseException;
import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.notification.content.FollowupQuestion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Generates a clarifying question for a search that found little
 */
@Slf4j
@Component
public class FollowupHandler extends AbstractLlmHandler {

    static final String NO_CONTEXT = "No additional context available.";

    @Override
    public JobKind kind() {
        return JobKind.FOLLOWUP;
    }

    @Override
    public Mono<HandlerResult> handle(QueuedJob job) {
        String message = requirePayload(job, "message");
        String context = job.payloadString("context");
        if (context == null || context.isBlank()) {
            context = NO_CONTEXT;
        }

        String prompt = Prompts.render(Prompts.FOLLOWUP, "message", message, "context", context);

        return llmClient.complete(textModel(), prompt)
            .map(raw -> {
                String question = raw.strip();
                if (question.isEmpty()) {
                    throw new InvalidLlmResponseException("Model returned an empty follow-up question");
                }
                log.info("Generated follow-up question for job {}: {}", job.getJobId(),
                    question.length() > 80 ? question.substring(0, 80) : question);

                return HandlerResult.builder()
                    .result(Map.of("question", question))
                    .notification(new FollowupQuestion(question))
                    .directive(ConversationDirective.awaitReply(
                        anchor(job, job.anchorMemoryId(), message, question)))
                    .build();
            });
    }
}
