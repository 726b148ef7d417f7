package com.whereq.memori.retry;

import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.model.JobStatus;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.model.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides what happens to a job after a failed attempt.
 *
 * Invalid responses get a short exponential backoff and a small budget.
 * Unavailability gets a coarse fixed interval, a one-time "delayed" notice
 * and a hard wall-clock expiry counted from job creation. The two channels
 * are read from separate ledger counters.
 */
@Slf4j
@Component
public class RetryManager {

    private final RetryPolicy policy;

    @Autowired
    public RetryManager(MemoriProperties properties) {
        this(properties.getRetry().toPolicy());
    }

    public RetryManager(RetryPolicy policy) {
        this.policy = policy;
    }

    /**
     * Decide the fate of a job whose latest failure has already been recorded
     * in {@code entry}.
     *
     * @param job the failed job
     * @param entry ledger entry including the failure being decided
     * @param kind kind of the failure being decided
     * @param now current time
     * @return retry after a delay, or terminate
     */
    public RetryDecision shouldRetry(QueuedJob job, AttemptLedger.Entry entry, FailureKind kind, Instant now) {
        return switch (kind) {
            case INVALID_RESPONSE -> decideInvalidResponse(job, entry);
            case UNAVAILABLE -> decideUnavailable(job, entry, now);
        };
    }

    /**
     * Instant at which a job becomes expired
     */
    public Instant expiresAt(QueuedJob job, AttemptLedger.Entry entry) {
        Instant origin = job.getCreatedAt();
        if (origin == null) {
            origin = entry.getFirstFailureAt();
        }
        return origin.plus(policy.getHardExpiry());
    }

    /**
     * Calculate exponential backoff delay for the n-th invalid response
     */
    public Duration calculateBackoff(int failures) {
        long initialInterval = policy.getInitialInterval().toMillis();
        int multiplier = policy.getBackoffMultiplier();
        long maxInterval = policy.getMaxInterval().toMillis();

        int exponent = Math.max(0, failures - 1);
        long backoff = (long) (initialInterval * Math.pow(multiplier, exponent));
        return Duration.ofMillis(Math.min(backoff, maxInterval));
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private RetryDecision decideInvalidResponse(QueuedJob job, AttemptLedger.Entry entry) {
        int failures = entry.getInvalidResponseFailures();
        if (failures >= policy.getMaxAttempts()) {
            log.warn("Job {} exhausted invalid-response budget after {} failures",
                job.getJobId(), failures);
            return RetryDecision.terminate(JobStatus.FAILED,
                "Invalid response after " + failures + " attempts");
        }
        Duration delay = calculateBackoff(failures);
        log.info("Job {} invalid response {}/{}, retrying in {}",
            job.getJobId(), failures, policy.getMaxAttempts(), delay);
        return RetryDecision.retry(delay);
    }

    private RetryDecision decideUnavailable(QueuedJob job, AttemptLedger.Entry entry, Instant now) {
        Instant expiresAt = expiresAt(job, entry);
        if (!now.isBefore(expiresAt)) {
            log.warn("Job {} expired: service unavailable until {} (created {})",
                job.getJobId(), now, job.getCreatedAt());
            return RetryDecision.terminate(JobStatus.EXPIRED,
                "Service unavailable for " + policy.getHardExpiry().toDays() + " days");
        }
        Duration delay = policy.getUnavailableRetryInterval();
        if (!entry.isUnavailableNoticeSent()) {
            return RetryDecision.retryWithNotice(delay);
        }
        return RetryDecision.retry(delay);
    }
}
