package com.whereq.memori.controller;

import com.whereq.memori.conversation.ConversationGate;
import com.whereq.memori.retry.AttemptLedger;
import com.whereq.memori.service.JobConsumer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify the worker and its Redis connection.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private ReactiveRedisConnectionFactory connectionFactory;

    @Autowired
    private ConversationGate conversationGate;

    @Autowired
    private AttemptLedger attemptLedger;

    @Autowired
    private JobConsumer jobConsumer;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the worker is running and Redis is reachable")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.usingWhen(
                Mono.fromSupplier(connectionFactory::getReactiveConnection),
                connection -> connection.ping(),
                connection -> connection.closeLater())
            .timeout(Duration.ofSeconds(2))
            .map(pong -> {
                Map<String, Object> health = baseHealth();
                Map<String, String> redisInfo = new HashMap<>();
                redisInfo.put("status", "CONNECTED");
                redisInfo.put("ping", pong);
                health.put("redis", redisInfo);
                return ResponseEntity.ok(health);
            })
            .onErrorResume(e -> {
                Map<String, Object> health = baseHealth();
                Map<String, String> redisInfo = new HashMap<>();
                redisInfo.put("status", "ERROR");
                redisInfo.put("error", String.valueOf(e.getMessage()));
                health.put("redis", redisInfo);
                return Mono.just(ResponseEntity.ok(health));
            });
    }

    private Map<String, Object> baseHealth() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "memori-worker");
        health.put("consumerRunning", jobConsumer.isRunning());
        health.put("activeConversations", conversationGate.activeCount());
        health.put("pendingRetries", attemptLedger.size());
        return health;
    }
}
