package com.whereq.memori.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.memori.config.MemoriProperties;
import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.QueuedJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveStreamOperations;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Job broker on Redis Streams with one consumer group per stream.
 *
 * Each entry carries the job JSON in a single {@code data} field.
 */
@Slf4j
@Service
public class RedisStreamJobBroker implements JobBroker {

    static final String DATA_FIELD = "data";

    @Autowired
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MemoriProperties properties;

    @Override
    public Mono<Void> ensureGroup(JobKind kind) {
        String key = kind.getStreamKey();
        String group = properties.getBroker().getGroup();
        ByteBuffer rawKey = redisTemplate.getSerializationContext().getKeySerializationPair().write(key);

        return redisTemplate.execute(connection ->
                connection.streamCommands().xGroupCreate(rawKey, group, ReadOffset.from("0"), true))
            .then()
            .doOnSuccess(v -> log.info("Created consumer group {} on stream {}", group, key))
            .onErrorResume(RedisStreamJobBroker::isBusyGroup, e -> {
                log.debug("Consumer group {} already exists on stream {}", group, key);
                return Mono.empty();
            });
    }

    @Override
    public Flux<BrokerEntry> readNew(JobKind kind, int count, Duration block) {
        return streams()
            .read(consumer(),
                StreamReadOptions.empty().count(count).block(block),
                StreamOffset.create(kind.getStreamKey(), ReadOffset.lastConsumed()))
            .map(record -> decode(kind, record));
    }

    @Override
    public Flux<BrokerEntry> readPending(JobKind kind, String afterId, int count) {
        return streams()
            .read(consumer(),
                StreamReadOptions.empty().count(count),
                StreamOffset.create(kind.getStreamKey(), ReadOffset.from(afterId)))
            .map(record -> decode(kind, record));
    }

    @Override
    public Flux<BrokerEntry> claimAbandoned(JobKind kind, Duration minIdle, int count) {
        String key = kind.getStreamKey();
        String group = properties.getBroker().getGroup();
        String consumerName = properties.getBroker().getConsumerName();

        return streams().pending(key, group, Range.unbounded(), count)
            .flatMapMany(pending -> {
                List<RecordId> abandoned = new ArrayList<>();
                for (PendingMessage message : pending) {
                    if (!consumerName.equals(message.getConsumerName())
                        && message.getElapsedTimeSinceLastDelivery().compareTo(minIdle) >= 0) {
                        abandoned.add(message.getId());
                    }
                }
                if (abandoned.isEmpty()) {
                    return Flux.empty();
                }
                log.info("Claiming {} abandoned entries on stream {}: {}", abandoned.size(), key, abandoned);
                return streams().claim(key, group, consumerName, minIdle, abandoned.toArray(new RecordId[0]));
            })
            .map(record -> decode(kind, record));
    }

    @Override
    public Mono<Boolean> acknowledge(JobKind kind, String recordId) {
        return streams().acknowledge(kind.getStreamKey(), properties.getBroker().getGroup(), recordId)
            .map(removed -> removed > 0)
            .doOnSuccess(removed -> {
                if (Boolean.TRUE.equals(removed)) {
                    log.debug("Acknowledged entry {} on stream {}", recordId, kind.getStreamKey());
                } else {
                    log.debug("Entry {} on stream {} was already acknowledged", recordId, kind.getStreamKey());
                }
            });
    }

    @Override
    public Mono<String> publish(JobKind kind, QueuedJob job) {
        return Mono.fromCallable(() -> {
                try {
                    return objectMapper.writeValueAsString(job);
                } catch (JsonProcessingException e) {
                    throw new IllegalArgumentException("Failed to serialize job " + job.getJobId(), e);
                }
            })
            .flatMap(json -> {
                MapRecord<String, String, String> record = StreamRecords.newRecord()
                    .in(kind.getStreamKey())
                    .ofMap(Map.of(DATA_FIELD, json));
                return streams().add(record);
            })
            .map(RecordId::getValue)
            .doOnSuccess(id -> log.info("Published job {} to {} as {}", job.getJobId(), kind.getStreamKey(), id));
    }

    @Override
    public Mono<Long> size(JobKind kind) {
        return streams().size(kind.getStreamKey())
            .defaultIfEmpty(0L);
    }

    BrokerEntry decode(JobKind kind, MapRecord<String, String, String> record) {
        String recordId = record.getId().getValue();
        Map<String, String> fields = record.getValue();
        String raw = fields == null ? null : fields.get(DATA_FIELD);
        if (raw == null) {
            log.warn("Entry {} on {} has no {} field (deleted or malformed)", recordId, kind.getStreamKey(), DATA_FIELD);
            return new BrokerEntry(kind, recordId, null, null);
        }
        try {
            QueuedJob job = objectMapper.readValue(raw, QueuedJob.class);
            job.setRecordId(recordId);
            if (job.getJobType() == null) {
                job.setJobType(kind.getWireName());
            }
            return new BrokerEntry(kind, recordId, job, raw);
        } catch (JsonProcessingException e) {
            log.warn("Failed to decode entry {} on {}: {}", recordId, kind.getStreamKey(), e.getOriginalMessage());
            return new BrokerEntry(kind, recordId, null, raw);
        }
    }

    private ReactiveStreamOperations<String, String, String> streams() {
        return redisTemplate.opsForStream();
    }

    private Consumer consumer() {
        return Consumer.from(properties.getBroker().getGroup(), properties.getBroker().getConsumerName());
    }

    private static boolean isBusyGroup(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current.getMessage() != null && current.getMessage().contains("BUSYGROUP")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
