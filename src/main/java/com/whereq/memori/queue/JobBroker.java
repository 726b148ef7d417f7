package com.whereq.memori.queue;

import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.QueuedJob;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Consumer-group access to the per-kind job streams.
 *
 * Delivery is at-least-once and ordered per stream. An entry stays in the
 * consumer's pending list until acknowledged, so anything not acknowledged
 * is delivered again.
 */
public interface JobBroker {

    /**
     * Cursor that starts a pending read at the head of the pending list
     */
    String PENDING_START = "0";

    /**
     * Create the consumer group for a kind, creating the stream if missing.
     * An already existing group is not an error.
     *
     * @param kind job kind
     * @return Mono that completes when the group exists
     */
    Mono<Void> ensureGroup(JobKind kind);

    /**
     * Read entries never delivered to any consumer of the group
     *
     * @param kind job kind
     * @param count maximum number of entries
     * @param block how long to wait when the stream has nothing new
     * @return Flux of entries in stream order
     */
    Flux<BrokerEntry> readNew(JobKind kind, int count, Duration block);

    /**
     * Read one page of entries delivered to this consumer but not yet
     * acknowledged, oldest first. Pass the id of the last entry of the
     * previous page to get the next one.
     *
     * @param kind job kind
     * @param afterId only entries with a greater id are returned; {@link #PENDING_START} for the first page
     * @param count maximum number of entries
     * @return Flux of pending entries
     */
    Flux<BrokerEntry> readPending(JobKind kind, String afterId, int count);

    /**
     * Take over entries left pending on other consumers for longer than {@code minIdle}
     *
     * @param kind job kind
     * @param minIdle minimum idle time of an entry before it is claimed
     * @param count maximum number of entries examined
     * @return Flux of claimed entries
     */
    Flux<BrokerEntry> claimAbandoned(JobKind kind, Duration minIdle, int count);

    /**
     * Acknowledge an entry. Acknowledging twice is harmless.
     *
     * @param kind job kind
     * @param recordId stream record id
     * @return Mono with true if this call removed the entry from the pending list
     */
    Mono<Boolean> acknowledge(JobKind kind, String recordId);

    /**
     * Append a job to its kind's stream
     *
     * @param kind job kind
     * @param job the job to publish
     * @return Mono with the new record id
     */
    Mono<String> publish(JobKind kind, QueuedJob job);

    /**
     * Get current stream length
     *
     * @param kind job kind
     * @return Mono with number of entries in the stream
     */
    Mono<Long> size(JobKind kind);
}
