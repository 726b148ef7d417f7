package com.whereq.memori.support;

import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.QueuedJob;
import com.whereq.memori.queue.BrokerEntry;
import com.whereq.memori.queue.JobBroker;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Broker with consumer-group semantics kept in memory: entries are
 * delivered once as new, then stay on this consumer's pending list until
 * acknowledged. Entries pending on "another consumer" can be planted with
 * {@link #abandon} and are handed out by {@link #claimAbandoned}.
 */
public class InMemoryJobBroker implements JobBroker {

    private final AtomicLong sequence = new AtomicLong();

    private final Map<JobKind, Partition> partitions = new EnumMap<>(JobKind.class);

    public InMemoryJobBroker() {
        for (JobKind kind : JobKind.values()) {
            partitions.put(kind, new Partition());
        }
    }

    @Override
    public Mono<Void> ensureGroup(JobKind kind) {
        return Mono.empty();
    }

    @Override
    public synchronized Flux<BrokerEntry> readNew(JobKind kind, int count, Duration block) {
        Partition partition = partitions.get(kind);
        List<BrokerEntry> delivered = new ArrayList<>();
        while (partition.nextIndex < partition.stream.size() && delivered.size() < count) {
            BrokerEntry entry = partition.stream.get(partition.nextIndex++);
            partition.pending.put(entry.getRecordId(), entry);
            delivered.add(entry);
        }
        return Flux.fromIterable(delivered);
    }

    @Override
    public synchronized Flux<BrokerEntry> readPending(JobKind kind, String afterId, int count) {
        long after = sequenceOf(afterId);
        return Flux.fromIterable(partitions.get(kind).pending.values().stream()
            .filter(entry -> sequenceOf(entry.getRecordId()) > after)
            .sorted(Comparator.comparingLong(entry -> sequenceOf(entry.getRecordId())))
            .limit(count)
            .collect(Collectors.toList()));
    }

    @Override
    public synchronized Flux<BrokerEntry> claimAbandoned(JobKind kind, Duration minIdle, int count) {
        Partition partition = partitions.get(kind);
        List<BrokerEntry> claimed = new ArrayList<>();
        while (!partition.abandoned.isEmpty() && claimed.size() < count) {
            BrokerEntry entry = partition.abandoned.remove(0);
            partition.pending.put(entry.getRecordId(), entry);
            claimed.add(entry);
        }
        return Flux.fromIterable(claimed);
    }

    @Override
    public synchronized Mono<Boolean> acknowledge(JobKind kind, String recordId) {
        Partition partition = partitions.get(kind);
        boolean removed = partition.pending.remove(recordId) != null;
        if (removed) {
            partition.acknowledged.add(recordId);
        }
        return Mono.just(removed);
    }

    @Override
    public synchronized Mono<String> publish(JobKind kind, QueuedJob job) {
        String recordId = nextId();
        partitions.get(kind).stream.add(new BrokerEntry(kind, recordId, job.toBuilder().recordId(recordId).build(), null));
        return Mono.just(recordId);
    }

    @Override
    public synchronized Mono<Long> size(JobKind kind) {
        return Mono.just((long) partitions.get(kind).stream.size());
    }

    /**
     * Append an entry whose data field could not be decoded
     */
    public synchronized String publishUndecodable(JobKind kind, String raw) {
        String recordId = nextId();
        partitions.get(kind).stream.add(new BrokerEntry(kind, recordId, null, raw));
        return recordId;
    }

    /**
     * Plant an entry that is pending on a consumer that went away
     */
    public synchronized String abandon(JobKind kind, QueuedJob job) {
        String recordId = nextId();
        partitions.get(kind).abandoned.add(new BrokerEntry(kind, recordId, job.toBuilder().recordId(recordId).build(), null));
        return recordId;
    }

    public synchronized Set<String> pendingIds(JobKind kind) {
        return Set.copyOf(partitions.get(kind).pending.keySet());
    }

    public synchronized List<String> acknowledgedIds(JobKind kind) {
        return List.copyOf(partitions.get(kind).acknowledged);
    }

    /**
     * Entries not yet handed to any consumer
     */
    public synchronized int undelivered(JobKind kind) {
        Partition partition = partitions.get(kind);
        return partition.stream.size() - partition.nextIndex;
    }

    private static long sequenceOf(String recordId) {
        int dash = recordId.indexOf('-');
        return Long.parseLong(dash < 0 ? recordId : recordId.substring(0, dash));
    }

    private String nextId() {
        return (1_700_000_000_000L + sequence.incrementAndGet()) + "-0";
    }

    private static final class Partition {
        private final List<BrokerEntry> stream = new ArrayList<>();
        private final LinkedHashMap<String, BrokerEntry> pending = new LinkedHashMap<>();
        private final List<BrokerEntry> abandoned = new ArrayList<>();
        private final List<String> acknowledged = new ArrayList<>();
        private int nextIndex;
    }
}
