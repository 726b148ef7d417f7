package com.whereq.memori.service;

import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.conversation.ConversationAnchor;
import com.whereq.memori.conversation.ConversationGate;
import com.whereq.memori.conversation.ConversationState;
import com.whereq.memori.dto.ButtonPressResponse;
import com.whereq.memori.dto.ConversationStatusResponse;
import com.whereq.memori.dto.ReplyResponse;
import com.whereq.memori.handler.HandlerResult;
import com.whereq.memori.handler.IntentClassifyHandler;
import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.notification.Notification;
import com.whereq.memori.notification.NotificationDispatcher;
import com.whereq.memori.notification.NotificationReference;
import com.whereq.memori.notification.content.ExpiredNotice;
import com.whereq.memori.notification.content.InvalidResponseFailure;
import com.whereq.memori.notification.content.NotificationContent;
import com.whereq.memori.notification.content.UnavailableNotice;
import com.whereq.memori.retry.FailureClassifier;
import com.whereq.memori.retry.FailureKind;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handles what users send back while a conversation is open: free-text
 * answers to a follow-up question and presses on choice buttons.
 *
 * A reply that cannot be re-classified because the model is unavailable is
 * kept: the user gets the one-time delay notice and the re-classification
 * is retried in the background on the unavailable schedule, with the user
 * still claimed, until it succeeds or the hard expiry is reached.
 */
@Slf4j
@Service
public class ConversationService {

    private static final String REPLY_TOKEN_PREFIX = "reply:";

    @Autowired
    private ConversationGate conversationGate;

    @Autowired
    private IntentClassifyHandler intentClassifyHandler;

    @Autowired
    private NotificationDispatcher notificationDispatcher;

    @Autowired
    private FailureClassifier failureClassifier;

    @Autowired
    private MemoriProperties properties;

    /**
     * Background re-classifications waiting for the model, by user
     */
    private final ConcurrentHashMap<String, Disposable> backgroundRetries = new ConcurrentHashMap<>();

    private Scheduler retryScheduler = Schedulers.parallel();

    /**
     * Offer a free-text message to the user's open conversation.
     *
     * If a follow-up question is pending, the conversation closes and the
     * original message is re-classified with the answer. The user stays
     * claimed until the result is known, so none of their queued jobs runs
     * in between. When the model is unavailable the reply is still consumed
     * and re-classified later, see {@link #retryInBackground}.
     *
     * @param userId user who sent the text
     * @param text message text
     * @return Mono with {@code consumed=false} when the text should become a new job
     */
    public Mono<ReplyResponse> onTextReply(String userId, String text) {
        return Mono.defer(() -> {
            String token = REPLY_TOKEN_PREFIX + userId;
            Optional<ConversationState> taken = conversationGate.takeFollowupReply(userId, token);
            if (taken.isEmpty()) {
                log.debug("No follow-up pending for user {}; text is a new message", userId);
                return Mono.just(ReplyResponse.notConsumed());
            }

            ConversationAnchor anchor = taken.get().getAnchor();
            QueuedJob job = reclassificationJob(userId, anchor, text);
            log.info("Re-classifying job {} for user {} with their answer", anchor.getJobId(), userId);

            AtomicBoolean handedOver = new AtomicBoolean(false);
            return reclassify(job)
                .map(result -> {
                    conclude(job, result);
                    return ReplyResponse.builder()
                        .consumed(true)
                        .anchorJobId(anchor.getJobId())
                        .notificationKind(result.getNotification().getKind().getWireName())
                        .build();
                })
                .onErrorResume(error -> {
                    FailureKind kind = failureClassifier.classify(error);
                    if (kind == FailureKind.UNAVAILABLE) {
                        log.warn("Model unavailable while re-classifying job {} for user {}, retrying every {}: {}",
                            anchor.getJobId(), userId, properties.getRetry().getUnavailable().getRetryInterval(),
                            error.getMessage());
                        UnavailableNotice notice = new UnavailableNotice(job.getJobType(), job.anchorMemoryId(),
                            job.originalTimestamp());
                        deliver(job, notice);
                        handedOver.set(true);
                        retryInBackground(job, token);
                        return Mono.just(ReplyResponse.builder()
                            .consumed(true)
                            .anchorJobId(anchor.getJobId())
                            .notificationKind(notice.getKind().getWireName())
                            .errorMessage(error.getMessage())
                            .build());
                    }
                    log.error("Re-classification of job {} for user {} failed ({}): {}",
                        anchor.getJobId(), userId, kind, error.getMessage());
                    InvalidResponseFailure failure = new InvalidResponseFailure(job.getJobType(), anchor.getMemoryId());
                    deliver(job, failure);
                    return Mono.just(ReplyResponse.builder()
                        .consumed(true)
                        .anchorJobId(anchor.getJobId())
                        .notificationKind(failure.getKind().getWireName())
                        .errorMessage(error.getMessage())
                        .build());
                })
                .doFinally(signal -> {
                    if (!handedOver.get()) {
                        conversationGate.release(userId, token);
                    }
                });
        });
    }

    /**
     * Number of replies waiting for the model to come back
     */
    public int pendingRetries() {
        return backgroundRetries.size();
    }

    /**
     * Drop background re-classifications. Their users were only claimed in
     * this process, so they are free again after a restart.
     */
    @PreDestroy
    public void shutdown() {
        if (backgroundRetries.isEmpty()) {
            return;
        }
        log.warn("Abandoning re-classification of replies for {} user(s): {}",
            backgroundRetries.size(), backgroundRetries.keySet());
        backgroundRetries.values().forEach(Disposable::dispose);
        backgroundRetries.clear();
    }

    void setRetryScheduler(Scheduler retryScheduler) {
        this.retryScheduler = retryScheduler;
    }

    /**
     * Conclude the user's choice conversation for {@code anchorJobId}
     *
     * @param userId user who pressed
     * @param anchorJobId job the button belongs to, null to take it from the option id
     * @param optionId option id, {@code action:anchorJobId}
     * @return whether a conversation was closed
     */
    public ButtonPressResponse onButtonPress(String userId, String anchorJobId, String optionId) {
        String action = optionId;
        String anchor = anchorJobId;
        int separator = optionId.indexOf(':');
        if (separator > 0) {
            action = optionId.substring(0, separator);
            if (anchor == null || anchor.isBlank()) {
                anchor = optionId.substring(separator + 1);
            }
        }

        boolean closed = conversationGate.closeOnButton(userId, anchor).isPresent();
        if (closed) {
            log.info("User {} chose '{}' for job {}", userId, action, anchor);
        } else {
            log.warn("Ignoring '{}' press by user {} for job {}: no matching conversation", action, userId, anchor);
        }
        return ButtonPressResponse.builder()
            .closed(closed)
            .anchorJobId(anchor)
            .action(action)
            .build();
    }

    /**
     * Current conversation of a user, IDLE when none is open
     */
    public ConversationStatusResponse status(String userId) {
        return conversationGate.current(userId)
            .map(state -> ConversationStatusResponse.builder()
                .userId(userId)
                .mode(state.getMode())
                .anchorJobId(state.getAnchorJobId())
                .memoryId(state.getAnchor().getMemoryId())
                .question(state.getAnchor().getQuestion())
                .openedAt(state.getOpenedAt())
                .expiresAt(state.getExpiresAt())
                .build())
            .orElseGet(() -> ConversationStatusResponse.builder()
                .userId(userId)
                .mode(conversationGate.modeOf(userId))
                .build());
    }

    /**
     * Retry a reply's re-classification every {@code retry-interval} while the
     * model stays unavailable, for at most {@code hard-expiry} counted from
     * the reply. The user stays claimed under {@code token} until then.
     */
    private void retryInBackground(QueuedJob job, String token) {
        String userId = job.getUserId();
        MemoriProperties.UnavailableConfig unavailable = properties.getRetry().getUnavailable();
        Duration interval = unavailable.getRetryInterval();
        long attempts = Math.max(1, unavailable.getHardExpiry().toMillis() / interval.toMillis());

        Disposable.Swap retry = Disposables.swap();
        backgroundRetries.put(userId, retry);
        retry.update(Mono.delay(interval, retryScheduler)
            .then(reclassify(job)
                .retryWhen(Retry.fixedDelay(attempts - 1, interval)
                    .scheduler(retryScheduler)
                    .filter(error -> failureClassifier.classify(error) == FailureKind.UNAVAILABLE)
                    .doBeforeRetry(signal -> log.debug("Model still unavailable for job {} of user {} (attempt {})",
                        job.getJobId(), userId, signal.totalRetries() + 2))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure())))
            .doFinally(signal -> {
                backgroundRetries.remove(userId, retry);
                conversationGate.release(userId, token);
            })
            .subscribe(
                result -> {
                    log.info("Re-classified job {} for user {} after the model came back", job.getJobId(), userId);
                    conclude(job, result);
                },
                error -> giveUp(job, error)));
    }

    private void giveUp(QueuedJob job, Throwable error) {
        FailureKind kind = failureClassifier.classify(error);
        log.error("Giving up on re-classifying job {} for user {} ({}): {}",
            job.getJobId(), job.getUserId(), kind, error.getMessage());
        if (kind == FailureKind.UNAVAILABLE) {
            deliver(job, new ExpiredNotice(job.getJobType(), job.anchorMemoryId(), job.originalTimestamp()));
        } else {
            deliver(job, new InvalidResponseFailure(job.getJobType(), job.anchorMemoryId()));
        }
    }

    private void conclude(QueuedJob job, HandlerResult result) {
        deliver(job, result.getNotification());
        if (result.getDirective() != null
            && !conversationGate.open(job.getUserId(), result.getDirective().getMode(), result.getDirective().getAnchor())) {
            log.warn("Could not re-open conversation for user {} after re-classifying job {}",
                job.getUserId(), job.getJobId());
        }
    }

    /**
     * Invalid responses are retried inline on the invalid-response schedule.
     * Any other failure ends the inline attempt.
     */
    private Mono<HandlerResult> reclassify(QueuedJob job) {
        MemoriProperties.InvalidResponseConfig retry = properties.getRetry().getInvalidResponse();
        return Mono.defer(() -> intentClassifyHandler.handle(job))
            .timeout(properties.getConsumer().getHandlerTimeout())
            .retryWhen(Retry.backoff(retry.getMaxAttempts() - 1, retry.getInitialInterval())
                .maxBackoff(retry.getMaxInterval())
                .filter(error -> failureClassifier.classify(error) == FailureKind.INVALID_RESPONSE)
                .doBeforeRetry(signal -> log.warn("Retrying re-classification of job {} (attempt {}): {}",
                    job.getJobId(), signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private QueuedJob reclassificationJob(String userId, ConversationAnchor anchor, String answer) {
        Map<String, Object> followup = new HashMap<>();
        followup.put("followup_question", anchor.getQuestion());
        followup.put("user_answer", answer);

        Map<String, Object> payload = new HashMap<>();
        payload.put("message", anchor.getOriginalMessage());
        payload.put(IntentClassifyHandler.FOLLOWUP_CONTEXT, followup);
        if (anchor.getOriginalTimestamp() != null) {
            payload.put("original_timestamp", anchor.getOriginalTimestamp());
        }
        if (anchor.getMemoryId() != null && !anchor.getMemoryId().isEmpty()) {
            payload.put("memory_id", anchor.getMemoryId());
        }

        return QueuedJob.builder()
            .jobId(anchor.getJobId())
            .jobType(JobKind.INTENT_CLASSIFY.getWireName())
            .userId(userId)
            .payload(payload)
            .build();
    }

    private void deliver(QueuedJob job, NotificationContent content) {
        notificationDispatcher.submit(Notification.builder()
            .userId(job.getUserId())
            .content(content)
            .reference(NotificationReference.of(job))
            .build());
    }
}
