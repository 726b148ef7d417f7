package com.whereq.memori.retry;

import com.whereq.memori.handler.HandlerResult;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory retry bookkeeping, one entry per job that has failed at least once
 * or whose handler result is still waiting to be recorded.
 *
 * The ledger is not persisted. A restart drops every entry, which only ever
 * grants a job more retry budget; the broker's pending list brings the job
 * back either way.
 */
@Slf4j
@Component
public class AttemptLedger {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Record one failure of the given kind and return the updated entry
     */
    public Entry recordFailure(String jobId, FailureKind kind, Instant now) {
        return entries.compute(jobId, (id, existing) -> {
            Entry base = existing != null ? existing : Entry.builder()
                .jobId(id)
                .firstFailureAt(now)
                .build();
            Entry.EntryBuilder next = base.toBuilder();
            if (base.getFirstFailureAt() == null) {
                next.firstFailureAt(now);
            }
            if (kind == FailureKind.INVALID_RESPONSE) {
                next.invalidResponseFailures(base.getInvalidResponseFailures() + 1);
            } else {
                next.unavailableFailures(base.getUnavailableFailures() + 1);
                if (base.getFirstUnavailableAt() == null) {
                    next.firstUnavailableAt(now);
                }
            }
            return next.build();
        });
    }

    /**
     * Set the earliest time the job may be attempted again
     */
    public void scheduleNextAttempt(String jobId, Instant nextAttemptAt) {
        entries.computeIfPresent(jobId, (id, entry) -> entry.toBuilder().nextAttemptAt(nextAttemptAt).build());
    }

    /**
     * Hold a job until {@code until} without counting a failure, e.g. while
     * its outcome cannot be recorded
     */
    public void defer(String jobId, Instant until) {
        entries.compute(jobId, (id, existing) -> existing != null
            ? existing.toBuilder().nextAttemptAt(until).build()
            : Entry.builder().jobId(id).nextAttemptAt(until).build());
    }

    /**
     * Keep a handler's successful result until the job store has recorded
     * it, so a redelivery finishes the job without running the handler again
     */
    public void recordResult(String jobId, HandlerResult result) {
        entries.compute(jobId, (id, existing) -> existing != null
            ? existing.toBuilder().completedResult(result).build()
            : Entry.builder().jobId(id).completedResult(result).build());
    }

    /**
     * Result of an earlier successful attempt that was never recorded
     */
    public Optional<HandlerResult> completedResult(String jobId) {
        return get(jobId).map(Entry::getCompletedResult);
    }

    /**
     * Mark the one-time "processing delayed" notice as sent.
     *
     * @return true if this call flipped the flag
     */
    public boolean markUnavailableNoticeSent(String jobId) {
        boolean[] flipped = {false};
        entries.computeIfPresent(jobId, (id, entry) -> {
            if (entry.isUnavailableNoticeSent()) {
                return entry;
            }
            flipped[0] = true;
            return entry.toBuilder().unavailableNoticeSent(true).build();
        });
        return flipped[0];
    }

    /**
     * Check whether a job may be attempted now. Unknown jobs are always due.
     */
    public boolean isDue(String jobId, Instant now) {
        Entry entry = entries.get(jobId);
        return entry == null || entry.getNextAttemptAt() == null || !now.isBefore(entry.getNextAttemptAt());
    }

    public Optional<Entry> get(String jobId) {
        return Optional.ofNullable(entries.get(jobId));
    }

    /**
     * Remove a job from the ledger (on success or terminal failure)
     */
    public void clear(String jobId) {
        if (entries.remove(jobId) != null) {
            log.debug("Cleared attempt ledger for job {}", jobId);
        }
    }

    public int size() {
        return entries.size();
    }

    /**
     * Snapshot of a job's retry bookkeeping
     */
    @Value
    @Builder(toBuilder = true)
    public static class Entry {
        String jobId;
        int invalidResponseFailures;
        int unavailableFailures;
        Instant firstFailureAt;
        Instant firstUnavailableAt;
        boolean unavailableNoticeSent;
        Instant nextAttemptAt;
        HandlerResult completedResult;

        public int totalFailures() {
            return invalidResponseFailures + unavailableFailures;
        }

        public int failuresOf(FailureKind kind) {
            return kind == FailureKind.INVALID_RESPONSE ? invalidResponseFailures : unavailableFailures;
        }
    }
}
