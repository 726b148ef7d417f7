package com.whereq.memori.retry;

import com.whereq.memori.model.JobStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of {@link RetryManager#shouldRetry}: either retry after a delay
 * or terminate with a final status.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RetryDecision {

    public enum Action {
        RETRY,
        TERMINATE
    }

    Action action;

    /**
     * Wait before the next attempt (RETRY only)
     */
    Duration delay;

    /**
     * Whether the user should be told once that processing is delayed
     */
    boolean notifyDelayed;

    /**
     * FAILED or EXPIRED (TERMINATE only)
     */
    JobStatus terminalStatus;

    String reason;

    public static RetryDecision retry(Duration delay) {
        return new RetryDecision(Action.RETRY, delay, false, null, null);
    }

    public static RetryDecision retryWithNotice(Duration delay) {
        return new RetryDecision(Action.RETRY, delay, true, null, null);
    }

    public static RetryDecision terminate(JobStatus status, String reason) {
        if (!status.isTerminal() || status == JobStatus.COMPLETED) {
            throw new IllegalArgumentException("Not a failure status: " + status);
        }
        return new RetryDecision(Action.TERMINATE, Duration.ZERO, false, status, reason);
    }

    public boolean isRetry() {
        return action == Action.RETRY;
    }
}
