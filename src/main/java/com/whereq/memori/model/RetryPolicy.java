package com.whereq.memori.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Retry policy for failed jobs, one section per failure kind
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Attempts a job gets before an invalid response fails it
     */
    @Builder.Default
    private int maxAttempts = 5;

    /**
     * Initial backoff interval
     */
    @Builder.Default
    private Duration initialInterval = Duration.ofSeconds(1);

    /**
     * Backoff multiplier
     */
    @Builder.Default
    private int backoffMultiplier = 2;

    /**
     * Maximum backoff interval
     */
    @Builder.Default
    private Duration maxInterval = Duration.ofSeconds(16);

    /**
     * Fixed interval between attempts while the remote service is unavailable
     */
    @Builder.Default
    private Duration unavailableRetryInterval = Duration.ofMinutes(30);

    /**
     * Wall-clock limit measured from job creation
     */
    @Builder.Default
    private Duration hardExpiry = Duration.ofDays(14);

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }
}
