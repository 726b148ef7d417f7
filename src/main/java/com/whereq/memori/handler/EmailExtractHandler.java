package com.whereq.memori.handler;

import com.whereq.memori.exception.InvalidLlmResponseException;
import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.notification.content.EventProposal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts calendar events from an email and creates the confident ones
 * as pending events in the core service
 */
@Slf4j
@Component
public class EmailExtractHandler extends AbstractLlmHandler {

    static final double MIN_CONFIDENCE = 0.7;

    @Override
    public JobKind kind() {
        return JobKind.EMAIL_EXTRACT;
    }

    @Override
    public Mono<HandlerResult> handle(QueuedJob job) {
        String subject = requirePayload(job, "subject");
        String body = requirePayload(job, "body");

        String prompt = Prompts.render(Prompts.EMAIL_EXTRACT, "subject", subject, "body", body);

        return llmClient.complete(textModel(), prompt)
            .map(LlmResponseParser::extractJson)
            .map(parsed -> confidentEvents(parsed))
            .flatMap(events -> Flux.fromIterable(events)
                .concatMap(event -> coreApi.createEvent(eventRequest(job, subject, event))
                    .map(created -> withId(event, created)))
                .collectList())
            .map(created -> summarize(job, subject, created));
    }

    /**
     * Events above the confidence threshold, validated before anything is created
     */
    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> confidentEvents(Map<String, Object> parsed) {
        Object events = parsed.get("events");
        if (events == null) {
            throw new InvalidLlmResponseException("Model response missing required field: events");
        }
        if (!(events instanceof List)) {
            throw new InvalidLlmResponseException("Field events is not a list");
        }
        List<Map<String, Object>> confident = new ArrayList<>();
        for (Object item : (List<?>) events) {
            if (!(item instanceof Map)) {
                throw new InvalidLlmResponseException("Event entry is not an object: " + item);
            }
            Map<String, Object> event = (Map<String, Object>) item;
            if (LlmResponseParser.doubleValue(event, "confidence", 0.0) <= MIN_CONFIDENCE) {
                continue;
            }
            LlmResponseParser.requireString(event, "description");
            LlmResponseParser.requireString(event, "event_time");
            confident.add(event);
        }
        return confident;
    }

    private Map<String, Object> eventRequest(QueuedJob job, String subject, Map<String, Object> event) {
        Map<String, Object> request = new HashMap<>();
        request.put("owner_user_id", job.getUserId());
        request.put("event_time", event.get("event_time"));
        request.put("description", event.get("description"));
        request.put("source_type", "email");
        request.put("source_detail", subject);
        return request;
    }

    private Map<String, Object> withId(Map<String, Object> event, Map<String, Object> created) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("description", event.get("description"));
        merged.put("event_time", event.get("event_time"));
        merged.put("event_id", created.get("id") == null ? "" : created.get("id").toString());
        return merged;
    }

    private HandlerResult summarize(QueuedJob job, String subject, List<Map<String, Object>> created) {
        String shortSubject = subject.length() > 50 ? subject.substring(0, 50) : subject;
        if (created.isEmpty()) {
            log.info("No high-confidence events in email '{}'", shortSubject);
            return HandlerResult.noAction(Map.of("events", List.of()), "no confident events");
        }
        log.info("Extracted {} event(s) from email '{}'", created.size(), shortSubject);

        Map<String, Object> first = created.get(0);
        return HandlerResult.builder()
            .result(Map.of("events", created))
            .notification(EventProposal.builder()
                .eventId(first.get("event_id").toString())
                .description(first.get("description").toString())
                .eventTime(first.get("event_time").toString())
                .build())
            .directive(ConversationDirective.awaitButton(anchor(job, "", subject, null)))
            .build();
    }
}
