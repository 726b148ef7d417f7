package com.whereq.memori.config;

import com.whereq.memori.model.JobKind;
import com.whereq.memori.model.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Configuration properties for the Memori worker.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "memori")
@Data
public class MemoriProperties {

    private BrokerConfig broker = new BrokerConfig();

    private ConsumerConfig consumer = new ConsumerConfig();

    private RetryConfig retry = new RetryConfig();

    private ConversationConfig conversation = new ConversationConfig();

    private NotificationConfig notification = new NotificationConfig();

    private LlmConfig llm = new LlmConfig();

    private EndpointConfig coreApi = new EndpointConfig("http://core:8000");

    private EndpointConfig gateway = new EndpointConfig("http://telegram-gateway:8080");

    @Data
    public static class BrokerConfig {
        /**
         * Consumer group shared by all worker instances.
         */
        private String group = "llm-worker-group";

        /**
         * Name of this consumer inside the group. Must be stable across
         * restarts so the pending list of a restarted worker is picked up again.
         */
        private String consumerName = "llm-worker-1";

        /**
         * Maximum number of new entries read per cycle.
         */
        private int batchSize = 10;

        /**
         * Maximum number of pending entries re-examined per cycle.
         */
        private int pendingBatchSize = 100;

        /**
         * Block timeout of the read for new entries.
         */
        private Duration blockTimeout = Duration.ofSeconds(1);

        /**
         * Idle time after which an entry pending on another consumer is claimed.
         */
        private Duration visibilityTimeout = Duration.ofMinutes(5);

        /**
         * Pause between cycles that found nothing to do.
         */
        private Duration idleDelay = Duration.ofMillis(100);

        /**
         * Delay before an entry is re-examined after the job store could not be reached.
         */
        private Duration storeRetryInterval = Duration.ofSeconds(5);

        /**
         * Kinds this worker consumes.
         */
        private Set<JobKind> kinds = EnumSet.allOf(JobKind.class);
    }

    @Data
    public static class ConsumerConfig {
        /**
         * Start the consumer loops on startup.
         */
        private boolean enabled = true;

        /**
         * Upper bound on a single handler invocation.
         */
        private Duration handlerTimeout = Duration.ofSeconds(150);

        /**
         * Time in-flight handler calls get to finish on shutdown.
         */
        private Duration shutdownGrace = Duration.ofSeconds(30);
    }

    @Data
    public static class RetryConfig {
        private InvalidResponseConfig invalidResponse = new InvalidResponseConfig();

        private UnavailableConfig unavailable = new UnavailableConfig();

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .maxAttempts(invalidResponse.getMaxAttempts())
                .initialInterval(invalidResponse.getInitialInterval())
                .backoffMultiplier(invalidResponse.getMultiplier())
                .maxInterval(invalidResponse.getMaxInterval())
                .unavailableRetryInterval(unavailable.getRetryInterval())
                .hardExpiry(unavailable.getHardExpiry())
                .build();
        }
    }

    @Data
    public static class InvalidResponseConfig {
        /**
         * The invalid response on this attempt fails the job.
         */
        private int maxAttempts = 5;

        private Duration initialInterval = Duration.ofSeconds(1);

        private int multiplier = 2;

        private Duration maxInterval = Duration.ofSeconds(16);
    }

    @Data
    public static class UnavailableConfig {
        private Duration retryInterval = Duration.ofMinutes(30);

        /**
         * Measured from job creation, not from the first failure.
         */
        private Duration hardExpiry = Duration.ofDays(14);
    }

    @Data
    public static class ConversationConfig {
        /**
         * How long a paused conversation stays open without a user action.
         */
        private Duration horizon = Duration.ofDays(7);

        /**
         * How often expired conversations are swept, regardless of traffic.
         */
        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class NotificationConfig {
        /**
         * Minimum delay between two messages to the same user.
         */
        private Duration minInterval = Duration.ofSeconds(3);

        private int transportRetries = 3;

        private Duration transportBackoff = Duration.ofSeconds(1);

        /**
         * How often bookkeeping of idle users is evicted.
         */
        private Duration evictionInterval = Duration.ofMinutes(5);

        /**
         * How long a user's latest submission is remembered for earlier-message framing.
         */
        private Duration submissionRetention = Duration.ofDays(21);
    }

    @Data
    public static class LlmConfig {
        private String baseUrl = "http://localhost:8080/v1";

        private String apiKey = "not-needed";

        private String textModel = "mistral";

        private String visionModel = "llava";

        private Duration timeout = Duration.ofSeconds(60);

        private Duration visionTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class EndpointConfig {
        private String baseUrl;

        private Duration timeout = Duration.ofSeconds(10);

        public EndpointConfig() {
        }

        public EndpointConfig(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
