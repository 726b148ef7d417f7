package com.whereq.memori.handler;

import com.whereq.memori.client.CoreApiClient;
import com.whereq.memori.client.LlmClient;
import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.conversation.ConversationMode;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.notification.NotificationKind;
import com.whereq.memori.notification.content.TaskMatchProposal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TaskMatchHandler
 */
@ExtendWith(MockitoExtension.class)
class TaskMatchHandlerTest {

    private static final List<Map<String, Object>> TASKS = List.of(
        Map.of("id", "t1", "description", "buy a birthday present"),
        Map.of("id", "t2", "description", "renew passport"));

    @Mock LlmClient llmClient;
    @Mock CoreApiClient coreApi;

    TaskMatchHandler handler;

    @BeforeEach
    void setUp() {
        handler = new TaskMatchHandler();
        ReflectionTestUtils.setField(handler, "llmClient", llmClient);
        ReflectionTestUtils.setField(handler, "coreApi", coreApi);
        ReflectionTestUtils.setField(handler, "properties", new MemoriProperties());
    }

    @Test
    void handle_confidentMatch_proposesCompletion() {
        when(coreApi.getOpenTasks("u1")).thenReturn(Mono.just(TASKS));
        when(llmClient.complete(anyString(), anyString()))
            .thenReturn(Mono.just("{\"matched_task_id\": \"t2\", \"confidence\": 0.92, \"reason\": \"new passport\"}"));

        HandlerResult result = handler.handle(job()).block();

        TaskMatchProposal proposal = (TaskMatchProposal) result.getNotification();
        assertThat(proposal.getTaskId()).isEqualTo("t2");
        assertThat(proposal.getTaskDescription()).isEqualTo("renew passport");
        assertThat(result.getDirective().getMode()).isEqualTo(ConversationMode.AWAITING_BUTTON);
        assertThat(result.getResult()).containsEntry("matched", true);
    }

    @Test
    void handle_confidenceAtThreshold_noAction() {
        when(coreApi.getOpenTasks("u1")).thenReturn(Mono.just(TASKS));
        when(llmClient.complete(anyString(), anyString()))
            .thenReturn(Mono.just("{\"matched_task_id\": \"t2\", \"confidence\": 0.7}"));

        HandlerResult result = handler.handle(job()).block();

        assertThat(result.getNotification().getKind()).isEqualTo(NotificationKind.NO_ACTION);
        assertThat(result.getDirective()).isNull();
    }

    @Test
    void handle_noOpenTasks_skipsModel() {
        when(coreApi.getOpenTasks("u1")).thenReturn(Mono.just(List.of()));

        StepVerifier.create(handler.handle(job()))
            .assertNext(result -> assertThat(result.getResult()).containsEntry("matched", false))
            .verifyComplete();

        verify(llmClient, never()).complete(anyString(), anyString());
    }

    @Test
    void handle_missingMemoryContent_rejected() {
        QueuedJob job = QueuedJob.builder().jobId("j1").jobType("task_match").userId("u1")
            .payload(new HashMap<>(Map.of("memory_id", "mem-1")))
            .build();

        assertThatThrownBy(() -> handler.handle(job))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("memory_content");
    }

    private static QueuedJob job() {
        return QueuedJob.builder()
            .jobId("j1")
            .jobType("task_match")
            .userId("u1")
            .payload(new HashMap<>(Map.of("memory_id", "mem-1", "memory_content", "picked up my new passport")))
            .build();
    }
}
