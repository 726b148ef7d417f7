package com.whereq.memori.handler;

import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.notification.content.TaskMatchProposal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Checks whether a newly saved memory completes one of the user's open tasks
 */
@Slf4j
@Component
public class TaskMatchHandler extends AbstractLlmHandler {

    static final double MIN_CONFIDENCE = 0.7;

    @Override
    public JobKind kind() {
        return JobKind.TASK_MATCH;
    }

    @Override
    public Mono<HandlerResult> handle(QueuedJob job) {
        String memoryId = requirePayload(job, "memory_id");
        String memoryContent = requirePayload(job, "memory_content");

        return coreApi.getOpenTasks(job.getUserId())
            .flatMap(tasks -> {
                if (tasks.isEmpty()) {
                    log.info("No open tasks for user {}, skipping match for memory {}", job.getUserId(), memoryId);
                    return Mono.just(HandlerResult.noAction(Map.of("matched", false), "no open tasks"));
                }
                String prompt = Prompts.render(Prompts.TASK_MATCH,
                    "memory_content", memoryContent,
                    "tasks_list", Prompts.taskList(tasks));

                return llmClient.complete(textModel(), prompt)
                    .map(LlmResponseParser::extractJson)
                    .map(parsed -> match(job, memoryId, tasks, parsed));
            });
    }

    private HandlerResult match(QueuedJob job, String memoryId, List<Map<String, Object>> tasks,
                                Map<String, Object> parsed) {
        String matchedId = LlmResponseParser.optionalString(parsed, "matched_task_id");
        double confidence = LlmResponseParser.doubleValue(parsed, "confidence", 0.0);

        if (matchedId == null || "null".equalsIgnoreCase(matchedId) || confidence <= MIN_CONFIDENCE) {
            log.info("No confident task match for memory {} (best: {} at {})", memoryId, matchedId, confidence);
            return HandlerResult.noAction(Map.of("matched", false), "no confident task match");
        }

        String description = tasks.stream()
            .filter(task -> matchedId.equals(String.valueOf(task.get("id"))))
            .map(task -> String.valueOf(task.get("description")))
            .findFirst()
            .orElse("");
        log.info("Matched memory {} to task {} (confidence {})", memoryId, matchedId, confidence);

        return HandlerResult.builder()
            .result(Map.of(
                "matched", true,
                "task_id", matchedId,
                "task_description", description,
                "memory_id", memoryId))
            .notification(TaskMatchProposal.builder()
                .taskId(matchedId)
                .taskDescription(description)
                .memoryId(memoryId)
                .build())
            .directive(ConversationDirective.awaitButton(anchor(job, memoryId, null, null)))
            .build();
    }
}
