package com.whereq.memori.handler;

import com.whereq.memori.client.CoreApiClient;
import com.whereq.memori.client.LlmClient;
import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.conversation.ConversationMode;
import com.whereq.memori.exception.InvalidLlmResponseException;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.notification.NotificationKind;
import com.whereq.memori.notification.content.FollowupQuestion;
import com.whereq.memori.notification.content.NoteSaved;
import com.whereq.memori.notification.content.ReminderProposal;
import com.whereq.memori.notification.content.SearchResults;
import com.whereq.memori.notification.content.StaleReschedule;
import com.whereq.memori.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for IntentClassifyHandler.
 *
 * The model and the core service are mocked; each test feeds a canned model
 * response and checks the notification, the conversation directive and
 * which core calls were made.
 */
@ExtendWith(MockitoExtension.class)
class IntentClassifyHandlerTest {

    @Mock LlmClient llmClient;
    @Mock CoreApiClient coreApi;

    IntentClassifyHandler handler;

    @BeforeEach
    void setUp() {
        handler = new IntentClassifyHandler();
        ReflectionTestUtils.setField(handler, "llmClient", llmClient);
        ReflectionTestUtils.setField(handler, "coreApi", coreApi);
        ReflectionTestUtils.setField(handler, "properties", new MemoriProperties());
        ReflectionTestUtils.setField(handler, "clock", new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
    }

    // ------------------------------------------------------------------
    // intents
    // ------------------------------------------------------------------

    @Test
    void handle_reminder_createsMemoryAndProposesReminder() {
        modelSays("```json\n{\"intent\": \"reminder\", \"action\": \"call mom\", \"time\": \"tonight\","
            + " \"resolved_time\": \"2026-03-01T18:00:00Z\"}\n```");
        when(coreApi.createMemory("remind me to call mom tonight", "u1")).thenReturn(Mono.just("mem-1"));

        StepVerifier.create(handler.handle(job("remind me to call mom tonight")))
            .assertNext(result -> {
                assertThat(result.getNotification()).isInstanceOf(ReminderProposal.class);
                ReminderProposal proposal = (ReminderProposal) result.getNotification();
                assertThat(proposal.getAction()).isEqualTo("call mom");
                assertThat(proposal.getMemoryId()).isEqualTo("mem-1");
                assertThat(result.getDirective().getMode()).isEqualTo(ConversationMode.AWAITING_BUTTON);
                assertThat(result.getDirective().getAnchor().getJobId()).isEqualTo("j1");
                assertThat(result.getResult()).containsEntry("memory_id", "mem-1");
            })
            .verifyComplete();
    }

    @Test
    void handle_reminderInThePast_proposesReschedule() {
        modelSays("{\"intent\": \"reminder\", \"action\": \"pay rent\", \"resolved_time\": \"2026-02-27T09:00:00\"}");
        when(coreApi.createMemory(anyString(), eq("u1"))).thenReturn(Mono.just("mem-2"));

        HandlerResult result = handler.handle(job("pay rent on friday")).block();

        assertThat(result.getNotification()).isInstanceOf(StaleReschedule.class);
        assertThat(((StaleReschedule) result.getNotification()).getDescription()).isEqualTo("pay rent");
        assertThat(result.getResult()).containsEntry("stale", true);
    }

    @Test
    void handle_reminderWithoutTime_invalidAndNothingSaved() {
        modelSays("{\"intent\": \"reminder\", \"action\": \"call mom\"}");

        StepVerifier.create(handler.handle(job("call mom")))
            .expectError(InvalidLlmResponseException.class)
            .verify();

        verify(coreApi, never()).createMemory(anyString(), anyString());
    }

    @Test
    void handle_noteWithoutTags_savedWithoutConversation() {
        modelSays("{\"intent\": \"general_note\", \"suggested_tags\": []}");
        when(coreApi.createMemory(anyString(), eq("u1"))).thenReturn(Mono.just("mem-3"));

        HandlerResult result = handler.handle(job("the wifi password is on the fridge")).block();

        assertThat(result.getNotification().getKind()).isEqualTo(NotificationKind.NOTE_SAVED);
        assertThat(result.getDirective()).isNull();
    }

    @Test
    void handle_noteWithTags_awaitsTagChoice() {
        modelSays("{\"intent\": \"general_note\", \"suggested_tags\": [\"home\", \"wifi\"]}");
        when(coreApi.createMemory(anyString(), eq("u1"))).thenReturn(Mono.just("mem-3"));

        HandlerResult result = handler.handle(job("the wifi password is on the fridge")).block();

        assertThat(((NoteSaved) result.getNotification()).getSuggestedTags()).containsExactly("home", "wifi");
        assertThat(result.getDirective().getMode()).isEqualTo(ConversationMode.AWAITING_BUTTON);
    }

    @Test
    void handle_ambiguous_asksQuestionAndAwaitsReply() {
        modelSays("{\"intent\": \"ambiguous\", \"followup_question\": \"Should I remind you?\"}");
        when(coreApi.createMemory(anyString(), eq("u1"))).thenReturn(Mono.just("mem-4"));

        HandlerResult result = handler.handle(job("dentist")).block();

        assertThat(((FollowupQuestion) result.getNotification()).getQuestion()).isEqualTo("Should I remind you?");
        assertThat(result.getDirective().getMode()).isEqualTo(ConversationMode.AWAITING_FOLLOWUP_REPLY);
        assertThat(result.getDirective().getAnchor().getMemoryId()).isEqualTo("mem-4");
        assertThat(result.getDirective().getAnchor().getOriginalMessage()).isEqualTo("dentist");
    }

    @Test
    void handle_search_usesKeywordsAndSavesNothing() {
        modelSays("{\"intent\": \"search\", \"query\": \"wifi\", \"keywords\": [\"wifi\", \"password\"]}");
        when(coreApi.search("wifi password", "u1")).thenReturn(Mono.just(List.<Map<String, Object>>of(
            Map.of("memory", Map.of("id", "mem-9", "content", "wifi password is on the fridge")))));

        HandlerResult result = handler.handle(job("what was the wifi password")).block();

        SearchResults results = (SearchResults) result.getNotification();
        assertThat(results.getQuery()).isEqualTo("what was the wifi password");
        assertThat(results.getResults()).extracting(SearchResults.Hit::getMemoryId).containsExactly("mem-9");
        assertThat(result.getDirective()).isNull();
        verify(coreApi, never()).createMemory(anyString(), anyString());
    }

    @Test
    void handle_unknownIntent_invalid() {
        modelSays("{\"intent\": \"shopping\"}");

        StepVerifier.create(handler.handle(job("milk")))
            .expectErrorMatches(e -> e instanceof InvalidLlmResponseException
                && e.getMessage().contains("shopping"))
            .verify();
    }

    @Test
    void handle_missingMessage_rejected() {
        QueuedJob job = QueuedJob.builder().jobId("j1").jobType("intent_classify").userId("u1").build();

        StepVerifier.create(handler.handle(job))
            .expectError(IllegalArgumentException.class)
            .verify();
    }

    // ------------------------------------------------------------------
    // follow-up re-classification
    // ------------------------------------------------------------------

    @Test
    void handle_followupContext_usesAnswerAndKeepsMemory() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("message", "dentist");
        payload.put("memory_id", "mem-4");
        payload.put(IntentClassifyHandler.FOLLOWUP_CONTEXT, Map.of(
            "followup_question", "Should I remind you?",
            "user_answer", "yes, tomorrow at 9"));
        QueuedJob job = QueuedJob.builder().jobId("j1").jobType("intent_classify").userId("u1").payload(payload).build();
        modelSays("{\"intent\": \"reminder\", \"action\": \"dentist\", \"resolved_time\": \"2026-03-02T09:00:00Z\"}");

        HandlerResult result = handler.handle(job).block();

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmClient).complete(anyString(), prompt.capture());
        assertThat(prompt.getValue())
            .contains("The user answered: yes, tomorrow at 9")
            .contains("A clarifying question was asked: Should I remind you?");
        assertThat(((ReminderProposal) result.getNotification()).getMemoryId()).isEqualTo("mem-4");
        verify(coreApi, never()).createMemory(anyString(), anyString());
    }

    // ------------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------------

    @Test
    void normalize_imageWithoutText_titledByTags() {
        List<SearchResults.Hit> hits = IntentClassifyHandler.normalize(List.<Map<String, Object>>of(Map.of("memory", Map.of(
            "id", "mem-5",
            "media_type", "image",
            "tags", List.of(Map.of("tag", "beach"), Map.of("tag", "sunset"), "dog", "family")))));

        assertThat(hits).containsExactly(new SearchResults.Hit("mem-5", "[Image] beach, sunset, dog (+1 more)"));
    }

    @Test
    void isStale_unparseableTime_notStale() {
        assertThat(handler.isStale("next tuesday-ish")).isFalse();
        assertThat(handler.isStale("2026-02-01T10:00:00UTC")).isTrue();
        assertThat(handler.isStale("2026-03-05T10:00:00+01:00")).isFalse();
    }

    private void modelSays(String response) {
        when(llmClient.complete(anyString(), anyString())).thenReturn(Mono.just(response));
    }

    private static QueuedJob job(String message) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("message", message);
        payload.put("original_timestamp", "2026-03-01T09:58:00Z");
        return QueuedJob.builder()
            .jobId("j1")
            .jobType("intent_classify")
            .userId("u1")
            .createdAt(Instant.parse("2026-03-01T09:58:05Z"))
            .payload(payload)
            .build();
    }
}
