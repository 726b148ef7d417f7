package com.whereq.memori.handler;

import com.whereq.memori.exception.InvalidLlmResponseException;
import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.notification.content.FollowupQuestion;
import com.whereq.memori.notification.content.NoteSaved;
import com.whereq.memori.notification.content.NotificationContent;
import com.whereq.memori.notification.content.ReminderProposal;
import com.whereq.memori.notification.content.SearchResults;
import com.whereq.memori.notification.content.StaleReschedule;
import com.whereq.memori.notification.content.TaskProposal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies a user message into reminder, task, search, note or a
 * clarifying question.
 *
 * A job carrying {@code followup_context} is a re-classification of an
 * earlier ambiguous message using the user's answer.
 */
@Slf4j
@Component
public class IntentClassifyHandler extends AbstractLlmHandler {

    public static final String FOLLOWUP_CONTEXT = "followup_context";

    static final String REMINDER = "reminder";
    static final String TASK = "task";
    static final String SEARCH = "search";
    static final String GENERAL_NOTE = "general_note";
    static final String AMBIGUOUS = "ambiguous";

    private static final Set<String> INTENTS = Set.of(REMINDER, TASK, SEARCH, GENERAL_NOTE, AMBIGUOUS);

    /**
     * Intents whose message is kept as a memory; a search is self-contained
     */
    private static final Set<String> SAVES_MEMORY = Set.of(REMINDER, TASK, GENERAL_NOTE, AMBIGUOUS);

    @Autowired
    private Clock clock;

    @Override
    public JobKind kind() {
        return JobKind.INTENT_CLASSIFY;
    }

    @Override
    public Mono<HandlerResult> handle(QueuedJob job) {
        String message = job.payloadString("message") != null ? job.payloadString("message") : job.payloadString("query");
        if (message == null || message.isBlank()) {
            return Mono.error(new IllegalArgumentException("Job " + job.getJobId() + " has no message"));
        }

        Map<?, ?> followup = followupContext(job);
        String prompt;
        if (followup != null) {
            prompt = Prompts.render(Prompts.RECLASSIFY,
                "original_message", message,
                "followup_question", asString(followup.get("followup_question")),
                "user_answer", asString(followup.get("user_answer")),
                "original_timestamp", job.originalTimestamp());
        } else {
            prompt = Prompts.render(Prompts.INTENT_CLASSIFY,
                "message", message,
                "original_timestamp", job.originalTimestamp());
        }

        log.info("Intent classify request | job={} | memory={} | followup={}",
            job.getJobId(), job.anchorMemoryId(), followup != null);
        log.debug("Intent classify prompt:\n{}", prompt);

        return llmClient.complete(textModel(), prompt)
            .map(LlmResponseParser::extractJson)
            .flatMap(parsed -> classify(job, message, parsed));
    }

    private Mono<HandlerResult> classify(QueuedJob job, String message, Map<String, Object> parsed) {
        String intent = LlmResponseParser.requireString(parsed, "intent").strip().toLowerCase();
        if (!INTENTS.contains(intent)) {
            throw new InvalidLlmResponseException("Unknown intent: " + intent);
        }
        validate(intent, parsed);
        log.info("Classified job {} as {}", job.getJobId(), intent);

        Mono<String> memoryId = SAVES_MEMORY.contains(intent) ? resolveMemory(job, message) : Mono.just("");
        return memoryId.flatMap(id -> {
            Map<String, Object> result = new LinkedHashMap<>(parsed);
            result.put("query", message);
            result.put("intent", intent);
            result.put("memory_id", id.isEmpty() ? null : id);

            switch (intent) {
                case REMINDER:
                    return Mono.just(reminder(job, message, parsed, id, result));
                case TASK:
                    return Mono.just(task(job, message, parsed, id, result));
                case SEARCH:
                    return search(job, message, parsed, result);
                case GENERAL_NOTE:
                    return Mono.just(note(job, message, parsed, id, result));
                default:
                    return Mono.just(ambiguous(job, message, parsed, id, result));
            }
        });
    }

    /**
     * Check required fields before anything is written to the core service
     */
    private void validate(String intent, Map<String, Object> parsed) {
        switch (intent) {
            case REMINDER -> {
                LlmResponseParser.requireString(parsed, "action");
                LlmResponseParser.requireString(parsed, "resolved_time");
            }
            case TASK -> LlmResponseParser.requireString(parsed, "description");
            case AMBIGUOUS -> LlmResponseParser.requireString(parsed, "followup_question");
            default -> {
            }
        }
    }

    private Mono<String> resolveMemory(QueuedJob job, String message) {
        String existing = job.anchorMemoryId();
        if (!existing.isEmpty()) {
            return Mono.just(existing);
        }
        return coreApi.createMemory(message, job.getUserId());
    }

    private HandlerResult reminder(QueuedJob job, String message, Map<String, Object> parsed,
                                   String memoryId, Map<String, Object> result) {
        String action = LlmResponseParser.requireString(parsed, "action");
        String resolvedTime = LlmResponseParser.requireString(parsed, "resolved_time");

        NotificationContent content;
        if (isStale(resolvedTime)) {
            result.put("stale", true);
            content = StaleReschedule.builder()
                .originalDate(job.originalTimestamp())
                .resolvedDate(resolvedTime)
                .description(action)
                .memoryId(memoryId)
                .build();
        } else {
            content = ReminderProposal.builder()
                .action(action)
                .resolvedTime(resolvedTime)
                .memoryId(memoryId)
                .build();
        }
        return HandlerResult.builder()
            .result(result)
            .notification(content)
            .directive(ConversationDirective.awaitButton(anchor(job, memoryId, message, null)))
            .build();
    }

    private HandlerResult task(QueuedJob job, String message, Map<String, Object> parsed,
                               String memoryId, Map<String, Object> result) {
        String description = LlmResponseParser.requireString(parsed, "description");
        String resolvedDue = LlmResponseParser.optionalString(parsed, "resolved_due_time");

        NotificationContent content;
        if (resolvedDue != null && isStale(resolvedDue)) {
            result.put("stale", true);
            content = StaleReschedule.builder()
                .originalDate(job.originalTimestamp())
                .resolvedDate(resolvedDue)
                .description(description)
                .memoryId(memoryId)
                .build();
        } else {
            content = TaskProposal.builder()
                .description(description)
                .resolvedDueTime(resolvedDue)
                .memoryId(memoryId)
                .build();
        }
        return HandlerResult.builder()
            .result(result)
            .notification(content)
            .directive(ConversationDirective.awaitButton(anchor(job, memoryId, message, null)))
            .build();
    }

    private Mono<HandlerResult> search(QueuedJob job, String message, Map<String, Object> parsed,
                                       Map<String, Object> result) {
        List<String> keywords = LlmResponseParser.stringList(parsed, "keywords");
        String searchQuery;
        if (!keywords.isEmpty()) {
            searchQuery = String.join(" ", keywords);
        } else if (LlmResponseParser.optionalString(parsed, "query") != null) {
            searchQuery = LlmResponseParser.optionalString(parsed, "query");
        } else {
            searchQuery = message;
        }
        log.info("Search | job={} | query={} | user={}", job.getJobId(), searchQuery, job.getUserId());

        return coreApi.search(searchQuery, job.getUserId())
            .map(raw -> {
                List<SearchResults.Hit> hits = normalize(raw);
                List<Map<String, Object>> stored = new ArrayList<>();
                for (SearchResults.Hit hit : hits) {
                    stored.add(Map.of("memory_id", hit.getMemoryId(), "title", hit.getTitle()));
                }
                result.put("results", stored);
                log.info("Search for job {} returned {} result(s)", job.getJobId(), hits.size());

                return HandlerResult.builder()
                    .result(result)
                    .notification(SearchResults.builder()
                        .query(message)
                        .results(hits)
                        .build())
                    .build();
            });
    }

    private HandlerResult note(QueuedJob job, String message, Map<String, Object> parsed,
                               String memoryId, Map<String, Object> result) {
        List<String> tags = LlmResponseParser.stringList(parsed, "suggested_tags");
        HandlerResult.HandlerResultBuilder builder = HandlerResult.builder()
            .result(result)
            .notification(NoteSaved.builder()
                .memoryId(memoryId)
                .suggestedTags(tags)
                .build());
        if (!tags.isEmpty()) {
            builder.directive(ConversationDirective.awaitButton(anchor(job, memoryId, message, null)));
        }
        return builder.build();
    }

    private HandlerResult ambiguous(QueuedJob job, String message, Map<String, Object> parsed,
                                    String memoryId, Map<String, Object> result) {
        String question = LlmResponseParser.requireString(parsed, "followup_question");
        return HandlerResult.builder()
            .result(result)
            .notification(new FollowupQuestion(question))
            .directive(ConversationDirective.awaitReply(anchor(job, memoryId, message, question)))
            .build();
    }

    /**
     * Flatten core search results into id/title pairs. Image memories without
     * text are titled by their first tags.
     */
    @SuppressWarnings("unchecked")
    static List<SearchResults.Hit> normalize(List<Map<String, Object>> raw) {
        List<SearchResults.Hit> hits = new ArrayList<>();
        for (Map<String, Object> entry : raw) {
            Object memory = entry.get("memory");
            if (!(memory instanceof Map)) {
                hits.add(new SearchResults.Hit(asString(entry.get("memory_id")), asString(entry.get("title"))));
                continue;
            }
            Map<String, Object> mem = (Map<String, Object>) memory;
            String title = asString(mem.get("content"));
            Object tags = mem.get("tags");
            if (title.isEmpty() && tags instanceof List && !((List<?>) tags).isEmpty()) {
                List<String> names = new ArrayList<>();
                for (Object tag : (List<?>) tags) {
                    names.add(tag instanceof Map ? asString(((Map<?, ?>) tag).get("tag")) : asString(tag));
                }
                title = String.join(", ", names.subList(0, Math.min(3, names.size())));
                if (names.size() > 3) {
                    title += " (+" + (names.size() - 3) + " more)";
                }
            }
            if (title.isEmpty()) {
                title = "Untitled";
            }
            if ("image".equals(mem.get("media_type"))) {
                title = "[Image] " + title;
            }
            hits.add(new SearchResults.Hit(asString(mem.get("id")), title));
        }
        return hits;
    }

    /**
     * Check if a resolved time already lies in the past. Unparseable times are never stale.
     */
    boolean isStale(String time) {
        if (time == null || time.isBlank()) {
            return false;
        }
        String cleaned = time.strip().replace("UTC", "+00:00");
        Instant resolved;
        try {
            resolved = OffsetDateTime.parse(cleaned).toInstant();
        } catch (DateTimeParseException e) {
            try {
                resolved = LocalDateTime.parse(cleaned).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException inner) {
                log.debug("Cannot parse resolved time '{}', treating as not stale", time);
                return false;
            }
        }
        return resolved.isBefore(clock.instant());
    }

    private static Map<?, ?> followupContext(QueuedJob job) {
        Object context = job.getPayload() == null ? null : job.getPayload().get(FOLLOWUP_CONTEXT);
        return context instanceof Map ? (Map<?, ?>) context : null;
    }

    private static String asString(Object value) {
        return value == null ? "" : value.toString();
    }
}
