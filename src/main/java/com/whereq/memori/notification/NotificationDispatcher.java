package com.whereq.memori.notification;

import com.whereq.memori.client.ChatGateway;
import com.whereq.memori.config.MemoriProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Delivers notifications to the chat gateway, one user at a time.
 *
 * Each user has a delivery chain: a notification starts only after the
 * previous one for the same user has been handed over (or given up on), and
 * not before {@code memori.notification.min-interval} has passed since then.
 * Different users never wait for each other.
 *
 * Pacing and submission bookkeeping of users who went quiet is evicted on a
 * timer ({@code memori.notification.eviction-interval}).
 */
@Slf4j
@Service
public class NotificationDispatcher {

    @Autowired
    private ChatGateway chatGateway;

    @Autowired
    private MessageRenderer renderer;

    @Autowired
    private MemoriProperties properties;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private Clock clock;

    private final ConcurrentHashMap<String, Mono<Void>> tails = new ConcurrentHashMap<>();

    /**
     * Scheduler time (ms) of the last delivery attempt per user
     */
    private final ConcurrentHashMap<String, Long> lastSentAt = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, Submission> latestSubmissions = new ConcurrentHashMap<>();

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private final Sinks.Empty<Void> shutdownSignal = Sinks.empty();

    private Scheduler scheduler = Schedulers.parallel();

    private Counter deliveredCounter;
    private Counter failedCounter;
    private Counter suppressedCounter;

    @PostConstruct
    public void initialize() {
        deliveredCounter = Counter.builder("memori.notifications.delivered")
            .description("Notifications handed to the chat gateway")
            .register(meterRegistry);

        failedCounter = Counter.builder("memori.notifications.failed")
            .description("Notifications given up on after transport retries")
            .register(meterRegistry);

        suppressedCounter = Counter.builder("memori.notifications.suppressed")
            .description("No-action results that were not sent")
            .register(meterRegistry);

        Gauge.builder("memori.notifications.pending", tails, ConcurrentHashMap::size)
            .description("Users with deliveries in progress")
            .register(meterRegistry);
    }

    /**
     * Remember a user's submission so later notifications about older
     * messages get "Re: your earlier message" framing. The newest submission
     * by creation time wins.
     */
    public void recordSubmission(String userId, String jobId, Instant createdAt) {
        if (userId == null || jobId == null) {
            return;
        }
        Instant now = clock.instant();
        latestSubmissions.merge(userId, new Submission(jobId, createdAt, now), (current, candidate) ->
            candidate.isNewerThan(current) ? candidate : current.seenAt(now));
    }

    /**
     * Queue a notification without waiting for it
     */
    public void submit(Notification notification) {
        deliver(notification);
    }

    /**
     * Queue a notification on its user's delivery chain.
     *
     * @param notification the notification
     * @return Mono that completes once this message was handed to the gateway,
     *         or errors once transport retries are exhausted
     */
    public Mono<Void> deliver(Notification notification) {
        if (notification.getKind() == NotificationKind.NO_ACTION) {
            log.debug("Not sending no-action result of job {} to user {}",
                notification.getReferenceJobId(), notification.getUserId());
            suppressedCounter.increment();
            return Mono.empty();
        }

        String userId = notification.getUserId();
        List<Mono<Void>> created = new ArrayList<>(1);
        tails.compute(userId, (id, tail) -> {
            Mono<Void> previous = tail == null ? Mono.empty() : tail.onErrorResume(e -> Mono.empty());
            Mono<Void> next = previous.then(Mono.defer(() -> send(notification))).cache();
            created.add(next);
            return next;
        });

        Mono<Void> delivery = created.get(0);
        delivery.subscribe(
            unused -> { },
            error -> tails.remove(userId, delivery),
            () -> tails.remove(userId, delivery));
        return delivery;
    }

    /**
     * Check if the notification answers a message older than the user's latest one
     */
    public boolean isAboutEarlierMessage(Notification notification) {
        NotificationReference reference = notification.getReference();
        if (reference == null || reference.getJobId() == null) {
            return false;
        }
        Submission latest = latestSubmissions.get(notification.getUserId());
        if (latest == null || latest.jobId.equals(reference.getJobId())) {
            return false;
        }
        return reference.getSubmittedAt() == null
            || latest.createdAt == null
            || latest.createdAt.isAfter(reference.getSubmittedAt());
    }

    /**
     * Number of users with deliveries in progress
     */
    public int pendingUsers() {
        return tails.size();
    }

    /**
     * Forget users with nothing in flight whose minimum interval has passed,
     * and submissions not seen for {@code submission-retention}
     *
     * @return number of entries removed
     */
    public int evictIdle() {
        long now = scheduler.now(TimeUnit.MILLISECONDS);
        long minInterval = properties.getNotification().getMinInterval().toMillis();
        int evicted = 0;
        for (Map.Entry<String, Long> entry : lastSentAt.entrySet()) {
            if (!tails.containsKey(entry.getKey())
                && now - entry.getValue() >= minInterval
                && lastSentAt.remove(entry.getKey(), entry.getValue())) {
                evicted++;
            }
        }

        Instant cutoff = clock.instant().minus(properties.getNotification().getSubmissionRetention());
        for (Map.Entry<String, Submission> entry : latestSubmissions.entrySet()) {
            if (entry.getValue().lastSeenAt.isBefore(cutoff)
                && latestSubmissions.remove(entry.getKey(), entry.getValue())) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} idle notification entries, tracking {} paced user(s) and {} submission(s)",
                evicted, lastSentAt.size(), latestSubmissions.size());
        }
        return evicted;
    }

    @Scheduled(fixedDelayString = "${memori.notification.eviction-interval:PT5M}")
    public void scheduledEviction() {
        evictIdle();
    }

    int trackedUsers() {
        return lastSentAt.size();
    }

    int trackedSubmissions() {
        return latestSubmissions.size();
    }

    /**
     * Stop pacing and give in-progress deliveries the shutdown grace period
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown.set(true);
        shutdownSignal.tryEmitEmpty();

        List<Mono<Void>> pending = new ArrayList<>(tails.values());
        if (pending.isEmpty()) {
            return;
        }
        Duration grace = properties.getConsumer().getShutdownGrace();
        log.info("Flushing notifications for {} user(s), waiting up to {}", pending.size(), grace);
        try {
            Mono.whenDelayError(pending)
                .onErrorResume(e -> Mono.empty())
                .block(grace);
        } catch (IllegalStateException e) {
            log.warn("Shutdown grace elapsed with notifications for {} user(s) undelivered: {}",
                tails.size(), tails.keySet());
        }
    }

    void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    private Mono<Void> send(Notification notification) {
        String userId = notification.getUserId();
        MemoriProperties.NotificationConfig config = properties.getNotification();

        return pause(userId)
            .then(Mono.defer(() -> {
                RenderedMessage message = renderer.render(notification, isAboutEarlierMessage(notification));
                return Mono.defer(() -> transmit(userId, message))
                    .retryWhen(Retry.backoff(config.getTransportRetries(), config.getTransportBackoff())
                        .scheduler(scheduler)
                        .doBeforeRetry(signal -> log.warn("Retrying {} notification for user {} (attempt {}): {}",
                            notification.getKind().getWireName(), userId, signal.totalRetries() + 1,
                            signal.failure().getMessage())));
            }))
            .doOnSuccess(v -> {
                deliveredCounter.increment();
                log.info("Delivered {} notification for job {} to user {}",
                    notification.getKind().getWireName(), notification.getReferenceJobId(), userId);
            })
            .doOnError(error -> {
                failedCounter.increment();
                log.error("Failed to deliver {} notification for job {} to user {} after {} retries: {}",
                    notification.getKind().getWireName(), notification.getReferenceJobId(), userId,
                    config.getTransportRetries(), error.getMessage(), error);
            })
            // before the terminal signal reaches the next delivery in the chain
            .doOnTerminate(() -> lastSentAt.put(userId, scheduler.now(TimeUnit.MILLISECONDS)));
    }

    private Mono<Void> transmit(String userId, RenderedMessage message) {
        switch (message.getStyle()) {
            case CHOICE:
                return chatGateway.sendChoice(userId, message.getText(), message.getOptions());
            case PROMPT:
                return chatGateway.sendPlainPrompt(userId, message.getText());
            default:
                return chatGateway.sendText(userId, message.getText());
        }
    }

    /**
     * Wait out the minimum interval since the user's previous message.
     * Skipped entirely once shutdown has begun.
     */
    private Mono<Void> pause(String userId) {
        Duration wait = pacingDelay(userId);
        if (wait.isZero()) {
            return Mono.empty();
        }
        log.debug("Pacing user {} for {}", userId, wait);
        return Mono.firstWithSignal(
            Mono.delay(wait, scheduler).then(),
            shutdownSignal.asMono());
    }

    private Duration pacingDelay(String userId) {
        Long last = lastSentAt.get(userId);
        if (last == null || shuttingDown.get()) {
            return Duration.ZERO;
        }
        long elapsed = scheduler.now(TimeUnit.MILLISECONDS) - last;
        long remaining = properties.getNotification().getMinInterval().toMillis() - elapsed;
        return remaining > 0 ? Duration.ofMillis(remaining) : Duration.ZERO;
    }

    private static final class Submission {
        private final String jobId;
        private final Instant createdAt;
        private final Instant lastSeenAt;

        private Submission(String jobId, Instant createdAt, Instant lastSeenAt) {
            this.jobId = jobId;
            this.createdAt = createdAt;
            this.lastSeenAt = lastSeenAt;
        }

        private Submission seenAt(Instant now) {
            return new Submission(jobId, createdAt, now);
        }

        private boolean isNewerThan(Submission other) {
            if (other.createdAt == null) {
                return true;
            }
            return createdAt != null && createdAt.isAfter(other.createdAt);
        }
    }
}
