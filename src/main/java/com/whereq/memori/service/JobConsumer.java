package com.whereq.memori.service;

import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.conversation.ConversationGate;
import com.whereq.memori.dto.JobStatusUpdate;
import com.whereq.memori.handler.ConversationDirective;
import com.whereq.memori.handler.HandlerRegistry;
import com.whereq.memori.handler.HandlerResult;
import com.whereq.memori.handler.JobHandler;
import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.JobRecord;
import com.whereq.memori.model.JobStatus;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.notification.Notification;
import com.whereq.memori.notification.NotificationDispatcher;
import com.whereq.memori.notification.NotificationReference;
import com.whereq.memori.notification.content.ExpiredNotice;
import com.whereq.memori.notification.content.InvalidResponseFailure;
import com.whereq.memori.notification.content.NotificationContent;
import com.whereq.memori.notification.content.UnavailableNotice;
import com.whereq.memori.notification.content.UnsupportedJob;
import com.whereq.memori.queue.BrokerEntry;
import com.whereq.memori.queue.JobBroker;
import com.whereq.memori.retry.AttemptLedger;
import com.whereq.memori.retry.FailureClassifier;
import com.whereq.memori.retry.FailureKind;
import com.whereq.memori.retry.RetryDecision;
import com.whereq.memori.retry.RetryManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background job processor, one loop per job kind.
 *
 * Each cycle re-examines this consumer's pending entries, claims entries
 * abandoned by other consumers and then reads new ones. An entry is only
 * acknowledged once its job reached a terminal status in the job store and
 * the user's notification was queued; everything else stays pending and is
 * looked at again in a later cycle.
 *
 * Within one cycle a user whose entry had to be skipped is held, so their
 * later entries are skipped as well and per-user order is kept. A job waiting
 * for a retry also holds its user in the {@link ConversationGate}, which keeps
 * the user's jobs on the other kinds' streams waiting too.
 */
@Slf4j
@Service
public class JobConsumer {

    @Autowired
    private JobBroker jobBroker;

    @Autowired
    private JobStore jobStore;

    @Autowired
    private HandlerRegistry handlerRegistry;

    @Autowired
    private RetryManager retryManager;

    @Autowired
    private AttemptLedger attemptLedger;

    @Autowired
    private FailureClassifier failureClassifier;

    @Autowired
    private ConversationGate conversationGate;

    @Autowired
    private NotificationDispatcher notificationDispatcher;

    @Autowired
    private MemoriProperties properties;

    @Autowired
    private Clock clock;

    @Autowired
    private MeterRegistry meterRegistry;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final AtomicInteger inFlight = new AtomicInteger();

    private final List<Disposable> loops = new CopyOnWriteArrayList<>();

    private Counter completedCounter;
    private Counter failedCounter;
    private Counter expiredCounter;
    private Counter retriedCounter;
    private Counter skippedCounter;
    private Timer handlerTimer;

    @PostConstruct
    public void initialize() {
        completedCounter = Counter.builder("memori.jobs.completed")
            .description("Jobs completed by a handler")
            .register(meterRegistry);

        failedCounter = Counter.builder("memori.jobs.failed")
            .description("Jobs failed permanently")
            .register(meterRegistry);

        expiredCounter = Counter.builder("memori.jobs.expired")
            .description("Jobs given up on after the hard expiry")
            .register(meterRegistry);

        retriedCounter = Counter.builder("memori.jobs.retried")
            .description("Failed attempts scheduled for another try")
            .register(meterRegistry);

        skippedCounter = Counter.builder("memori.jobs.skipped")
            .description("Entries left pending because their user was busy or not due")
            .register(meterRegistry);

        handlerTimer = Timer.builder("memori.jobs.handler.time")
            .description("Handler execution time")
            .register(meterRegistry);

        Gauge.builder("memori.jobs.in_flight", inFlight, AtomicInteger::get)
            .description("Handler invocations in progress")
            .register(meterRegistry);

        if (properties.getConsumer().isEnabled()) {
            start();
        } else {
            log.info("Job consumer disabled");
        }
    }

    /**
     * Start one consumer loop per configured kind
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        MemoriProperties.BrokerConfig broker = properties.getBroker();
        log.info("Starting job consumer {} in group {} for {}",
            broker.getConsumerName(), broker.getGroup(), broker.getKinds());

        for (JobKind kind : broker.getKinds()) {
            Disposable loop = jobBroker.ensureGroup(kind)
                .onErrorResume(e -> {
                    log.error("Could not create consumer group for {}: {}", kind.getStreamKey(), e.getMessage());
                    return Mono.empty();
                })
                .thenMany(Mono.defer(() -> cycle(kind)).repeat(running::get))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                    processed -> { },
                    error -> log.error("Fatal error in {} consumer loop", kind.getStreamKey(), error),
                    () -> log.info("Consumer loop for {} stopped", kind.getStreamKey()));
            loops.add(loop);
        }
    }

    /**
     * Stop taking new entries and give in-flight handlers the shutdown grace period
     */
    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Duration grace = properties.getConsumer().getShutdownGrace();
        log.info("Stopping job consumer, waiting up to {} for {} in-flight job(s)", grace, inFlight.get());

        long deadline = System.nanoTime() + grace.toNanos();
        try {
            while (inFlight.get() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(100);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for in-flight jobs");
        }
        if (inFlight.get() > 0) {
            log.warn("{} job(s) still in flight after {}; their entries stay pending", inFlight.get(), grace);
        }
        loops.forEach(Disposable::dispose);
        loops.clear();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * One cycle including its idle pause. Errors are logged and the loop goes on.
     */
    private Mono<Integer> cycle(JobKind kind) {
        MemoriProperties.BrokerConfig broker = properties.getBroker();
        return pollOnce(kind)
            .flatMap(processed -> processed == 0 && running.get()
                ? Mono.delay(broker.getIdleDelay()).thenReturn(processed)
                : Mono.just(processed))
            .onErrorResume(e -> {
                log.error("Error in {} consumer cycle: {}", kind.getStreamKey(), e.getMessage(), e);
                return jobBroker.ensureGroup(kind)
                    .onErrorResume(groupError -> Mono.empty())
                    .then(Mono.delay(broker.getStoreRetryInterval()))
                    .thenReturn(0);
            });
    }

    /**
     * Run a single consumer cycle for one kind
     *
     * @param kind job kind
     * @return Mono with the number of entries that were acted on (processed or acknowledged)
     */
    public Mono<Integer> pollOnce(JobKind kind) {
        MemoriProperties.BrokerConfig broker = properties.getBroker();
        Set<String> heldUsers = ConcurrentHashMap.newKeySet();

        Flux<BrokerEntry> candidates = Flux.concat(
            pendingEntries(kind, broker.getPendingBatchSize()),
            jobBroker.claimAbandoned(kind, broker.getVisibilityTimeout(), broker.getPendingBatchSize()),
            Flux.defer(() -> jobBroker.readNew(kind, broker.getBatchSize(), broker.getBlockTimeout())));

        return candidates
            .concatMap(entry -> process(entry, heldUsers))
            .filter(Boolean::booleanValue)
            .count()
            .map(Long::intValue);
    }

    /**
     * Every entry on this consumer's pending list, read page by page
     */
    private Flux<BrokerEntry> pendingEntries(JobKind kind, int pageSize) {
        return jobBroker.readPending(kind, JobBroker.PENDING_START, pageSize)
            .collectList()
            .expand(page -> page.size() < pageSize
                ? Mono.empty()
                : jobBroker.readPending(kind, page.get(page.size() - 1).getRecordId(), pageSize).collectList())
            .concatMapIterable(page -> page);
    }

    private Mono<Boolean> process(BrokerEntry entry, Set<String> heldUsers) {
        if (!entry.isDecodable()) {
            log.warn("Acknowledging undecodable entry {} on {}: {}",
                entry.getRecordId(), entry.getKind().getStreamKey(), entry.getRaw());
            return acknowledge(entry).thenReturn(true);
        }

        QueuedJob job = entry.getJob();
        String jobId = job.getJobId();
        String gateKey = gateKey(job);
        notificationDispatcher.recordSubmission(job.getUserId(), jobId, job.getCreatedAt());

        if (heldUsers.contains(gateKey)) {
            log.debug("Skipping job {}: an earlier job of {} is still pending", jobId, gateKey);
            skippedCounter.increment();
            return Mono.just(false);
        }
        if (!attemptLedger.isDue(jobId, clock.instant())) {
            heldUsers.add(gateKey);
            skippedCounter.increment();
            return Mono.just(false);
        }
        if (!conversationGate.tryAcquire(gateKey, jobId)) {
            log.debug("User {} is busy; job {} stays pending", gateKey, jobId);
            heldUsers.add(gateKey);
            skippedCounter.increment();
            return Mono.just(false);
        }

        return runAcquired(entry, job, heldUsers)
            .doFinally(signal -> conversationGate.release(gateKey, jobId))
            .thenReturn(true);
    }

    /**
     * Process a job whose user is claimed. Job store failures leave the entry
     * pending and hold the user until the store can be reached again.
     */
    private Mono<Void> runAcquired(BrokerEntry entry, QueuedJob job, Set<String> heldUsers) {
        String jobId = job.getJobId();

        return jobStore.get(jobId)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(record -> {
                if (record.isEmpty()) {
                    log.error("Job {} is unknown to the job store, dropping entry {}", jobId, entry.getRecordId());
                    settle(job);
                    return acknowledge(entry);
                }
                if (record.get().isTerminal()) {
                    log.info("Job {} already {}, acknowledging duplicate entry {}",
                        jobId, record.get().getStatus(), entry.getRecordId());
                    settle(job);
                    return acknowledge(entry);
                }

                Optional<HandlerResult> stored = attemptLedger.completedResult(jobId);
                if (stored.isPresent()) {
                    log.info("Job {} already handled, recording its result", jobId);
                    return complete(entry, job, stored.get());
                }

                Optional<JobHandler> handler = handlerRegistry.find(job.getJobType());
                if (handler.isEmpty()) {
                    return unsupported(entry, job);
                }
                return execute(entry, job, record.get(), handler.get(), heldUsers);
            })
            .onErrorResume(error -> {
                Instant retryAt = clock.instant().plus(properties.getBroker().getStoreRetryInterval());
                log.error("Could not record progress of job {}, retrying after {}: {}",
                    jobId, retryAt, error.getMessage());
                attemptLedger.defer(jobId, retryAt);
                conversationGate.holdForRetry(gateKey(job), jobId);
                heldUsers.add(gateKey(job));
                return Mono.empty();
            });
    }

    private Mono<Void> execute(BrokerEntry entry, QueuedJob job, JobRecord record,
                               JobHandler handler, Set<String> heldUsers) {
        String jobId = job.getJobId();
        int attempt = record.getAttemptCount() + 1;
        log.info("Starting job {} ({}), attempt {}", jobId, job.getJobType(), attempt);

        JobStatusUpdate processing = JobStatusUpdate.builder()
            .status(JobStatus.PROCESSING)
            .attemptCount(attempt)
            .build();

        return jobStore.updateStatus(jobId, processing)
            .then(invoke(handler, job))
            .flatMap(outcome -> outcome.result != null
                ? onSuccess(entry, job, outcome.result)
                : onFailure(entry, job, outcome.error, heldUsers));
    }

    /**
     * Run the handler and capture its outcome, so failures of the follow-up
     * job store writes are not mistaken for handler failures
     */
    private Mono<Outcome> invoke(JobHandler handler, QueuedJob job) {
        return Mono.defer(() -> {
            inFlight.incrementAndGet();
            Timer.Sample sample = Timer.start(meterRegistry);
            return Mono.defer(() -> handler.handle(job))
                .timeout(properties.getConsumer().getHandlerTimeout())
                .switchIfEmpty(Mono.error(new IllegalStateException(
                    handler.getClass().getSimpleName() + " produced no result")))
                .map(Outcome::success)
                .onErrorResume(error -> Mono.just(Outcome.failure(error)))
                .doFinally(signal -> {
                    sample.stop(handlerTimer);
                    inFlight.decrementAndGet();
                });
        });
    }

    private Mono<Void> onSuccess(BrokerEntry entry, QueuedJob job, HandlerResult result) {
        attemptLedger.recordResult(job.getJobId(), result);
        return complete(entry, job, result);
    }

    /**
     * Record a successful result, then notify and acknowledge. If the job
     * store fails here the result stays in the ledger for the next delivery.
     */
    private Mono<Void> complete(BrokerEntry entry, QueuedJob job, HandlerResult result) {
        String jobId = job.getJobId();
        JobStatusUpdate completed = JobStatusUpdate.builder()
            .status(JobStatus.COMPLETED)
            .result(result.getResult())
            .build();

        return jobStore.updateStatus(jobId, completed)
            .then(Mono.fromRunnable(() -> {
                settle(job);
                completedCounter.increment();
                log.info("Job {} completed with {}", jobId, result.getNotification().getKind().getWireName());
                notify(job, result.getNotification());
                applyDirective(job, result.getDirective());
            }))
            .then(acknowledge(entry));
    }

    private Mono<Void> onFailure(BrokerEntry entry, QueuedJob job, Throwable error, Set<String> heldUsers) {
        String jobId = job.getJobId();
        Instant now = clock.instant();
        FailureKind kind = failureClassifier.classify(error);
        AttemptLedger.Entry ledgerEntry = attemptLedger.recordFailure(jobId, kind, now);
        RetryDecision decision = retryManager.shouldRetry(job, ledgerEntry, kind, now);

        if (decision.isRetry()) {
            Instant nextAttempt = now.plus(decision.getDelay());
            log.warn("Job {} failed ({}, {} so far): {}; retrying at {}",
                jobId, kind, ledgerEntry.failuresOf(kind), error.getMessage(), nextAttempt);
            attemptLedger.scheduleNextAttempt(jobId, nextAttempt);
            retriedCounter.increment();
            conversationGate.holdForRetry(gateKey(job), jobId);
            heldUsers.add(gateKey(job));
            if (decision.isNotifyDelayed() && attemptLedger.markUnavailableNoticeSent(jobId)) {
                notify(job, new UnavailableNotice(job.getJobType(), job.anchorMemoryId(), job.originalTimestamp()));
            }
            return Mono.empty();
        }

        JobStatus status = decision.getTerminalStatus();
        log.error("Job {} {} after {} failure(s): {}", jobId, status.wireValue(),
            ledgerEntry.totalFailures(), error.getMessage(), error);

        JobStatusUpdate terminal = JobStatusUpdate.builder()
            .status(status)
            .errorMessage(decision.getReason() + ": " + error.getMessage())
            .build();

        return jobStore.updateStatus(jobId, terminal)
            .then(Mono.fromRunnable(() -> {
                settle(job);
                if (status == JobStatus.EXPIRED) {
                    expiredCounter.increment();
                    notify(job, new ExpiredNotice(job.getJobType(), job.anchorMemoryId(), job.originalTimestamp()));
                } else {
                    failedCounter.increment();
                    notify(job, new InvalidResponseFailure(job.getJobType(), job.anchorMemoryId()));
                }
            }))
            .then(acknowledge(entry));
    }

    private Mono<Void> unsupported(BrokerEntry entry, QueuedJob job) {
        log.error("No handler for job type '{}' (job {})", job.getJobType(), job.getJobId());
        JobStatusUpdate failed = JobStatusUpdate.builder()
            .status(JobStatus.FAILED)
            .errorMessage("No handler for job type: " + job.getJobType())
            .build();

        return jobStore.updateStatus(job.getJobId(), failed)
            .then(Mono.fromRunnable(() -> {
                settle(job);
                failedCounter.increment();
                notify(job, new UnsupportedJob(job.getJobType()));
            }))
            .then(acknowledge(entry));
    }

    /**
     * Forget the job's retry state once its outcome is recorded
     */
    private void settle(QueuedJob job) {
        attemptLedger.clear(job.getJobId());
        conversationGate.clearRetryHold(gateKey(job), job.getJobId());
    }

    private Mono<Void> acknowledge(BrokerEntry entry) {
        return jobBroker.acknowledge(entry.getKind(), entry.getRecordId())
            .doOnNext(removed -> {
                if (!removed) {
                    log.debug("Entry {} was already acknowledged", entry.getRecordId());
                }
            })
            .then();
    }

    private void notify(QueuedJob job, NotificationContent content) {
        if (job.getUserId() == null) {
            log.warn("Job {} has no user; dropping {} notification", job.getJobId(), content.getKind().getWireName());
            return;
        }
        notificationDispatcher.submit(Notification.builder()
            .userId(job.getUserId())
            .content(content)
            .reference(NotificationReference.of(job))
            .build());
    }

    private void applyDirective(QueuedJob job, ConversationDirective directive) {
        if (directive == null || job.getUserId() == null) {
            return;
        }
        if (!conversationGate.open(job.getUserId(), directive.getMode(), directive.getAnchor())) {
            log.warn("Could not open {} conversation for user {} after job {}",
                directive.getMode(), job.getUserId(), job.getJobId());
        }
    }

    /**
     * Jobs without a user are still serialized, each on its own key
     */
    private static String gateKey(QueuedJob job) {
        return job.getUserId() != null ? job.getUserId() : "job:" + job.getJobId();
    }

    private static final class Outcome {
        private final HandlerResult result;
        private final Throwable error;

        private Outcome(HandlerResult result, Throwable error) {
            this.result = result;
            this.error = error;
        }

        static Outcome success(HandlerResult result) {
            return new Outcome(result, null);
        }

        static Outcome failure(Throwable error) {
            return new Outcome(null, error);
        }
    }
}
