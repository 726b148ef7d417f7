package com.whereq.memori.service;

import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.conversation.ConversationAnchor;
import com.whereq.memori.conversation.ConversationGate;
import com.whereq.memori.conversation.ConversationMode;
import com.whereq.memori.dto.ButtonPressResponse;
import com.whereq.memori.dto.ConversationStatusResponse;
import com.whereq.memori.dto.ReplyResponse;
import com.whereq.memori.exception.InvalidLlmResponseException;
import com.whereq.memori.exception.LlmUnavailableException;
import com.whereq.memori.handler.ConversationDirective;
import com.whereq.memori.handler.HandlerResult;
import com.whereq.memori.handler.IntentClassifyHandler;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.notification.Notification;
import com.whereq.memori.notification.NotificationDispatcher;
import com.whereq.memori.notification.NotificationKind;
import com.whereq.memori.notification.content.FollowupQuestion;
import com.whereq.memori.notification.content.ReminderProposal;
import com.whereq.memori.retry.FailureClassifier;
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
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ConversationService.
 *
 * The gate is real and driven by a MutableClock; the intent classifier and
 * the notification dispatcher are mocked. Inline retries use millisecond
 * backoff so the tests do not sleep for the production intervals; background
 * retries run on a VirtualTimeScheduler.
 */
@ExtendWith(MockitoExtension.class)
class ConversationServiceTest {

    private static final String USER = "u1";

    @Mock IntentClassifyHandler intentClassifyHandler;
    @Mock NotificationDispatcher notificationDispatcher;

    MutableClock clock;
    ConversationGate gate;
    ConversationService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        gate = new ConversationGate(clock, Duration.ofDays(7));

        MemoriProperties properties = new MemoriProperties();
        properties.getRetry().getInvalidResponse().setInitialInterval(Duration.ofMillis(5));
        properties.getRetry().getInvalidResponse().setMaxInterval(Duration.ofMillis(20));

        service = new ConversationService();
        ReflectionTestUtils.setField(service, "conversationGate", gate);
        ReflectionTestUtils.setField(service, "intentClassifyHandler", intentClassifyHandler);
        ReflectionTestUtils.setField(service, "notificationDispatcher", notificationDispatcher);
        ReflectionTestUtils.setField(service, "failureClassifier", new FailureClassifier());
        ReflectionTestUtils.setField(service, "properties", properties);
    }

    // ------------------------------------------------------------------
    // free-text replies
    // ------------------------------------------------------------------

    @Test
    void onTextReply_noFollowupPending_notConsumed() {
        StepVerifier.create(service.onTextReply(USER, "buy milk"))
            .assertNext(response -> assertThat(response.isConsumed()).isFalse())
            .verifyComplete();

        verify(intentClassifyHandler, never()).handle(any());
    }

    @Test
    void onTextReply_userAwaitingButton_notConsumed() {
        gate.open(USER, ConversationMode.AWAITING_BUTTON, anchor("j1", null));

        ReplyResponse response = service.onTextReply(USER, "hello").block();

        assertThat(response.isConsumed()).isFalse();
        assertThat(gate.modeOf(USER)).isEqualTo(ConversationMode.AWAITING_BUTTON);
    }

    @Test
    void onTextReply_pendingFollowup_reclassifiesWithAnswerAndReleasesUser() {
        gate.open(USER, ConversationMode.AWAITING_FOLLOWUP_REPLY, anchor("j1", "Reminder or note?"));
        when(intentClassifyHandler.handle(any())).thenReturn(Mono.just(reminder("j1")));

        ReplyResponse response = service.onTextReply(USER, "remind me at 6pm").block();

        assertThat(response.isConsumed()).isTrue();
        assertThat(response.getAnchorJobId()).isEqualTo("j1");
        assertThat(response.getNotificationKind()).isEqualTo(NotificationKind.REMINDER_PROPOSAL.getWireName());

        ArgumentCaptor<QueuedJob> jobCaptor = ArgumentCaptor.forClass(QueuedJob.class);
        verify(intentClassifyHandler).handle(jobCaptor.capture());
        QueuedJob job = jobCaptor.getValue();
        assertThat(job.getJobId()).isEqualTo("j1");
        assertThat(job.getUserId()).isEqualTo(USER);
        assertThat(job.payloadString("message")).isEqualTo("call mom");
        assertThat(job.payloadString("memory_id")).isEqualTo("mem-j1");
        @SuppressWarnings("unchecked")
        Map<String, Object> followupContext = (Map<String, Object>) job.getPayload().get(IntentClassifyHandler.FOLLOWUP_CONTEXT);
        assertThat(followupContext)
            .containsEntry("followup_question", "Reminder or note?")
            .containsEntry("user_answer", "remind me at 6pm");

        // reminder proposal opens a button conversation on the same anchor
        assertThat(gate.modeOf(USER)).isEqualTo(ConversationMode.AWAITING_BUTTON);
        assertThat(gate.current(USER).orElseThrow().getAnchorJobId()).isEqualTo("j1");
        assertThat(gate.tryAcquire(USER, "j2")).isFalse();

        gate.closeOnButton(USER, "j1");
        assertThat(gate.tryAcquire(USER, "j2")).isTrue();
    }

    @Test
    void onTextReply_stillAmbiguous_reopensFollowupWithFreshHorizon() {
        gate.open(USER, ConversationMode.AWAITING_FOLLOWUP_REPLY, anchor("j1", "Reminder or note?"));
        clock.advance(Duration.ofDays(3));
        ConversationAnchor again = anchor("j1", "When should I remind you?");
        when(intentClassifyHandler.handle(any())).thenReturn(Mono.just(HandlerResult.builder()
            .result(Map.of("intent", "ambiguous"))
            .notification(new FollowupQuestion(again.getQuestion()))
            .directive(ConversationDirective.awaitReply(again))
            .build()));

        service.onTextReply(USER, "not sure").block();

        assertThat(gate.modeOf(USER)).isEqualTo(ConversationMode.AWAITING_FOLLOWUP_REPLY);
        assertThat(gate.current(USER).orElseThrow().getExpiresAt())
            .isEqualTo(clock.instant().plus(Duration.ofDays(7)));
        assertThat(service.status(USER).getQuestion()).isEqualTo("When should I remind you?");
    }

    @Test
    void onTextReply_invalidResponseTwice_retriedInlineThenDelivered() {
        gate.open(USER, ConversationMode.AWAITING_FOLLOWUP_REPLY, anchor("j1", "Reminder or note?"));
        when(intentClassifyHandler.handle(any()))
            .thenReturn(Mono.error(new InvalidLlmResponseException("no JSON")))
            .thenReturn(Mono.error(new InvalidLlmResponseException("no JSON")))
            .thenReturn(Mono.just(reminder("j1")));

        ReplyResponse response = service.onTextReply(USER, "a reminder").block(Duration.ofSeconds(5));

        assertThat(response.getErrorMessage()).isNull();
        verify(intentClassifyHandler, times(3)).handle(any());
        assertThat(sentKind()).isEqualTo(NotificationKind.REMINDER_PROPOSAL);
    }

    @Test
    void onTextReply_invalidResponseEveryTime_failureDeliveredAndUserIdle() {
        gate.open(USER, ConversationMode.AWAITING_FOLLOWUP_REPLY, anchor("j1", "Reminder or note?"));
        when(intentClassifyHandler.handle(any())).thenReturn(Mono.error(new InvalidLlmResponseException("garbled")));

        ReplyResponse response = service.onTextReply(USER, "a reminder").block(Duration.ofSeconds(5));

        assertThat(response.isConsumed()).isTrue();
        assertThat(response.getErrorMessage()).isEqualTo("garbled");
        verify(intentClassifyHandler, times(5)).handle(any());
        assertThat(sentKind()).isEqualTo(NotificationKind.INVALID_RESPONSE_FAILURE);
        assertThat(gate.modeOf(USER)).isEqualTo(ConversationMode.IDLE);
        assertThat(gate.isBlocked(USER)).isFalse();
    }

    @Test
    void onTextReply_serviceUnavailable_delayNoticeThenRetriedUntilModelReturns() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        service.setRetryScheduler(scheduler);
        gate.open(USER, ConversationMode.AWAITING_FOLLOWUP_REPLY, anchor("j1", "Reminder or note?"));
        when(intentClassifyHandler.handle(any()))
            .thenReturn(Mono.error(new LlmUnavailableException("connection refused")))
            .thenReturn(Mono.error(new LlmUnavailableException("connection refused")))
            .thenReturn(Mono.just(reminder("j1")));

        ReplyResponse response = service.onTextReply(USER, "a reminder").block();

        assertThat(response.isConsumed()).isTrue();
        assertThat(response.getNotificationKind()).isEqualTo(NotificationKind.UNAVAILABLE_NOTICE.getWireName());
        assertThat(service.pendingRetries()).isEqualTo(1);
        // queued jobs of the user keep waiting for the reply
        assertThat(gate.tryAcquire(USER, "j2")).isFalse();

        scheduler.advanceTimeBy(Duration.ofMinutes(30));
        verify(intentClassifyHandler, times(2)).handle(any());
        assertThat(gate.isBlocked(USER)).isTrue();

        scheduler.advanceTimeBy(Duration.ofMinutes(30));

        verify(intentClassifyHandler, times(3)).handle(any());
        assertThat(sentKinds()).containsExactly(NotificationKind.UNAVAILABLE_NOTICE, NotificationKind.REMINDER_PROPOSAL);
        assertThat(gate.modeOf(USER)).isEqualTo(ConversationMode.AWAITING_BUTTON);
        assertThat(service.pendingRetries()).isZero();
    }

    @Test
    void onTextReply_serviceUnavailableForHardExpiry_expiredNoticeAndUserReleased() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        service.setRetryScheduler(scheduler);
        gate.open(USER, ConversationMode.AWAITING_FOLLOWUP_REPLY, anchor("j1", "Reminder or note?"));
        when(intentClassifyHandler.handle(any())).thenReturn(Mono.error(new LlmUnavailableException("connection refused")));

        service.onTextReply(USER, "a reminder").block();
        scheduler.advanceTimeBy(Duration.ofDays(14));

        // the reply itself plus one attempt every 30 minutes for 14 days
        verify(intentClassifyHandler, times(1 + 14 * 48)).handle(any());
        assertThat(sentKinds()).containsExactly(NotificationKind.UNAVAILABLE_NOTICE, NotificationKind.EXPIRED_NOTICE);
        assertThat(gate.isBlocked(USER)).isFalse();
        assertThat(service.pendingRetries()).isZero();
    }

    @Test
    void shutdown_backgroundRetryPending_abandonedAndUserReleased() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        service.setRetryScheduler(scheduler);
        gate.open(USER, ConversationMode.AWAITING_FOLLOWUP_REPLY, anchor("j1", "Reminder or note?"));
        when(intentClassifyHandler.handle(any())).thenReturn(Mono.error(new LlmUnavailableException("connection refused")));
        service.onTextReply(USER, "a reminder").block();

        service.shutdown();
        scheduler.advanceTimeBy(Duration.ofHours(1));

        verify(intentClassifyHandler, times(1)).handle(any());
        assertThat(service.pendingRetries()).isZero();
        assertThat(gate.isBlocked(USER)).isFalse();
    }

    @Test
    void onTextReply_secondReplyWhileFirstInProgress_notConsumed() {
        gate.open(USER, ConversationMode.AWAITING_FOLLOWUP_REPLY, anchor("j1", "Reminder or note?"));
        when(intentClassifyHandler.handle(any())).thenReturn(Mono.never());

        service.onTextReply(USER, "first").subscribe();
        ReplyResponse second = service.onTextReply(USER, "second").block();

        assertThat(second.isConsumed()).isFalse();
        verify(intentClassifyHandler, times(1)).handle(any());
    }

    // ------------------------------------------------------------------
    // button presses
    // ------------------------------------------------------------------

    @Test
    void onButtonPress_matchingAnchor_closesConversation() {
        gate.open(USER, ConversationMode.AWAITING_BUTTON, anchor("j1", null));

        ButtonPressResponse response = service.onButtonPress(USER, null, "confirm_reminder:j1");

        assertThat(response.isClosed()).isTrue();
        assertThat(response.getAction()).isEqualTo("confirm_reminder");
        assertThat(response.getAnchorJobId()).isEqualTo("j1");
        assertThat(gate.modeOf(USER)).isEqualTo(ConversationMode.IDLE);
    }

    @Test
    void onButtonPress_secondPress_noEffect() {
        gate.open(USER, ConversationMode.AWAITING_BUTTON, anchor("j1", null));
        service.onButtonPress(USER, "j1", "dismiss");

        ButtonPressResponse second = service.onButtonPress(USER, "j1", "dismiss");

        assertThat(second.isClosed()).isFalse();
    }

    @Test
    void onButtonPress_staleAnchor_leavesCurrentConversationOpen() {
        gate.open(USER, ConversationMode.AWAITING_BUTTON, anchor("j2", null));

        ButtonPressResponse response = service.onButtonPress(USER, null, "confirm_task:j1");

        assertThat(response.isClosed()).isFalse();
        assertThat(gate.modeOf(USER)).isEqualTo(ConversationMode.AWAITING_BUTTON);
    }

    // ------------------------------------------------------------------
    // status
    // ------------------------------------------------------------------

    @Test
    void status_idleUser_onlyMode() {
        ConversationStatusResponse status = service.status(USER);

        assertThat(status.getMode()).isEqualTo(ConversationMode.IDLE);
        assertThat(status.getAnchorJobId()).isNull();
    }

    @Test
    void status_afterHorizon_idle() {
        gate.open(USER, ConversationMode.AWAITING_BUTTON, anchor("j1", null));
        clock.advance(Duration.ofDays(7));

        assertThat(service.status(USER).getMode()).isEqualTo(ConversationMode.IDLE);
    }

    // ------------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------------

    private List<NotificationKind> sentKinds() {
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationDispatcher, atLeast(0)).submit(captor.capture());
        return captor.getAllValues().stream().map(Notification::getKind).collect(Collectors.toList());
    }

    private NotificationKind sentKind() {
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationDispatcher).submit(captor.capture());
        return captor.getValue().getKind();
    }

    private static ConversationAnchor anchor(String jobId, String question) {
        return ConversationAnchor.builder()
            .jobId(jobId)
            .memoryId("mem-" + jobId)
            .originalMessage("call mom")
            .originalTimestamp("2026-03-01T09:58:00Z")
            .question(question)
            .build();
    }

    private static HandlerResult reminder(String jobId) {
        return HandlerResult.builder()
            .result(Map.of("intent", "reminder"))
            .notification(ReminderProposal.builder()
                .action("call mom")
                .resolvedTime("2026-03-01T18:00:00Z")
                .memoryId("mem-" + jobId)
                .build())
            .directive(ConversationDirective.awaitButton(anchor(jobId, null)))
            .build();
    }
}
