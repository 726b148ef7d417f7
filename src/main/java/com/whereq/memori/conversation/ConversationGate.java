package com.whereq.memori.conversation;

import com.whereq.memori.config.MemoriProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.Value;
import lombok.With;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user serialisation of job consumption.
 *
 * A user is blocked while one of their jobs is being processed (the
 * in-flight marker), while one of their jobs waits for a retry (the retry
 * hold, which spans all job kinds) or while a conversation waits for a
 * button press or a follow-up reply. Every transition runs inside a single
 * {@link ConcurrentHashMap#compute} on the user's slot, so a user never has
 * two open conversations and close is first-caller-wins.
 *
 * State is process-local. Losing it on restart resets conversations to idle.
 */
@Slf4j
@Component
public class ConversationGate {

    private final ConcurrentHashMap<String, UserSlot> slots = new ConcurrentHashMap<>();

    private final Clock clock;

    private final Duration horizon;

    @Autowired(required = false)
    private MeterRegistry meterRegistry;

    @Autowired
    public ConversationGate(Clock clock, MemoriProperties properties) {
        this(clock, properties.getConversation().getHorizon());
    }

    public ConversationGate(Clock clock, Duration horizon) {
        this.clock = clock;
        this.horizon = horizon;
    }

    @PostConstruct
    public void initialize() {
        if (meterRegistry != null) {
            Gauge.builder("memori.conversations.active", this::activeCount)
                .description("Users with an open conversation")
                .register(meterRegistry);
        }
    }

    /**
     * Check if the user's next job must wait
     */
    public boolean isBlocked(String userId) {
        UserSlot slot = slots.get(userId);
        if (slot == null) {
            return false;
        }
        return slot.getInFlight() != null
            || slot.getRetryPending() != null
            || isActive(slot.getState(), clock.instant());
    }

    /**
     * Claim the user for processing one job.
     *
     * @param userId user to claim
     * @param token identifies the holder, usually the job id
     * @return false if the user is busy with another job, another job is
     *         waiting for a retry, or the user has an open conversation
     */
    public boolean tryAcquire(String userId, String token) {
        Instant now = clock.instant();
        boolean[] acquired = {false};
        slots.compute(userId, (id, slot) -> {
            UserSlot current = dropExpired(id, slot, now);
            if (current.getInFlight() != null && !current.getInFlight().equals(token)) {
                return current;
            }
            if (current.getRetryPending() != null && !current.getRetryPending().equals(token)) {
                return current;
            }
            if (current.getState() != null) {
                return current;
            }
            acquired[0] = true;
            return current.withInFlight(token);
        });
        return acquired[0];
    }

    /**
     * Release the in-flight marker held by {@code token}
     */
    public void release(String userId, String token) {
        slots.computeIfPresent(userId, (id, slot) -> {
            if (token.equals(slot.getInFlight())) {
                UserSlot released = slot.withInFlight(null);
                return released.isEmpty() ? null : released;
            }
            return slot;
        });
    }

    /**
     * Keep the user reserved for {@code jobId} until its next attempt. Only
     * that job can acquire the user meanwhile, whatever stream the other
     * jobs arrive on.
     */
    public void holdForRetry(String userId, String jobId) {
        slots.compute(userId, (id, slot) -> {
            UserSlot current = slot == null ? UserSlot.EMPTY : slot;
            if (current.getRetryPending() != null && !current.getRetryPending().equals(jobId)) {
                log.warn("User {} already held for job {}, not holding for job {}",
                    id, current.getRetryPending(), jobId);
                return current;
            }
            return current.withRetryPending(jobId);
        });
    }

    /**
     * Drop the retry hold of {@code jobId} once the job completed or failed for good
     */
    public void clearRetryHold(String userId, String jobId) {
        slots.computeIfPresent(userId, (id, slot) -> {
            if (jobId.equals(slot.getRetryPending())) {
                log.debug("User {} no longer held for job {}", id, jobId);
                UserSlot released = slot.withRetryPending(null);
                return released.isEmpty() ? null : released;
            }
            return slot;
        });
    }

    /**
     * Job the user is held for, empty if none is waiting for a retry
     */
    public Optional<String> retryPending(String userId) {
        UserSlot slot = slots.get(userId);
        return Optional.ofNullable(slot == null ? null : slot.getRetryPending());
    }

    /**
     * Open a conversation for the user.
     *
     * An already open conversation about the same anchor job is replaced
     * (fresh horizon); one about a different anchor is left alone.
     *
     * @return true if the conversation is now open
     */
    public boolean open(String userId, ConversationMode mode, ConversationAnchor anchor) {
        if (mode == ConversationMode.IDLE) {
            throw new IllegalArgumentException("Cannot open an IDLE conversation");
        }
        Instant now = clock.instant();
        boolean[] opened = {false};
        slots.compute(userId, (id, slot) -> {
            UserSlot current = dropExpired(id, slot, now);
            ConversationState existing = current.getState();
            if (existing != null && !sameAnchor(existing, anchor)) {
                log.warn("User {} already in {} about job {}, not opening {} about job {}",
                    id, existing.getMode(), existing.getAnchorJobId(), mode, anchor.getJobId());
                return current;
            }
            opened[0] = true;
            return current.withState(ConversationState.builder()
                .userId(id)
                .mode(mode)
                .anchor(anchor)
                .openedAt(now)
                .expiresAt(now.plus(horizon))
                .build());
        });
        if (opened[0]) {
            log.info("User {} → {} (anchor job {}, memory {})",
                userId, mode, anchor.getJobId(), anchor.getMemoryId());
        }
        return opened[0];
    }

    /**
     * Conclude the user's conversation, whatever its mode.
     *
     * @return the closed state, empty if nothing was open (someone else won)
     */
    public Optional<ConversationState> close(String userId) {
        return closeMatching(userId, null, null);
    }

    /**
     * Conclude an {@link ConversationMode#AWAITING_BUTTON} conversation after a
     * button press for its anchor. A press for another anchor, a second press
     * or a press after expiry is a no-op.
     */
    public Optional<ConversationState> closeOnButton(String userId, String anchorJobId) {
        return closeMatching(userId, ConversationMode.AWAITING_BUTTON, anchorJobId);
    }

    /**
     * Take the user's pending follow-up question, if any, closing the
     * conversation and claiming the user under {@code token} in one step so
     * no queued job slips in before the reply is re-classified.
     */
    public Optional<ConversationState> takeFollowupReply(String userId, String token) {
        Instant now = clock.instant();
        ConversationState[] taken = {null};
        slots.computeIfPresent(userId, (id, slot) -> {
            UserSlot current = dropExpired(id, slot, now);
            ConversationState state = current.getState();
            if (state == null || state.getMode() != ConversationMode.AWAITING_FOLLOWUP_REPLY) {
                return current.isEmpty() ? null : current;
            }
            if (current.getInFlight() != null) {
                return current;
            }
            taken[0] = state;
            return current.withState(null).withInFlight(token);
        });
        if (taken[0] != null) {
            log.info("User {} answered follow-up about job {} → IDLE", userId, taken[0].getAnchorJobId());
        }
        return Optional.ofNullable(taken[0]);
    }

    /**
     * Close every conversation past its horizon. Runs on a timer so users who
     * never write again still get their conversation concluded. The anchored
     * record is left exactly as last saved.
     *
     * @return number of conversations closed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        for (String userId : slots.keySet()) {
            slots.computeIfPresent(userId, (id, slot) -> {
                if (slot.getState() != null && slot.getState().isExpired(now)) {
                    expired.add(id);
                    UserSlot cleared = slot.withState(null);
                    return cleared.isEmpty() ? null : cleared;
                }
                return slot;
            });
        }
        if (!expired.isEmpty()) {
            log.info("Expired {} conversation(s): {}", expired.size(), expired);
        }
        return expired.size();
    }

    @Scheduled(fixedDelayString = "${memori.conversation.sweep-interval:PT1M}")
    public void scheduledSweep() {
        sweepExpired();
    }

    /**
     * Current open conversation of the user, empty when idle or expired
     */
    public Optional<ConversationState> current(String userId) {
        UserSlot slot = slots.get(userId);
        if (slot == null || !isActive(slot.getState(), clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(slot.getState());
    }

    public ConversationMode modeOf(String userId) {
        return current(userId).map(ConversationState::getMode).orElse(ConversationMode.IDLE);
    }

    public long activeCount() {
        Instant now = clock.instant();
        return slots.values().stream().filter(slot -> isActive(slot.getState(), now)).count();
    }

    private Optional<ConversationState> closeMatching(String userId, ConversationMode mode, String anchorJobId) {
        Instant now = clock.instant();
        ConversationState[] closed = {null};
        slots.computeIfPresent(userId, (id, slot) -> {
            UserSlot current = dropExpired(id, slot, now);
            ConversationState state = current.getState();
            if (state != null
                && (mode == null || state.getMode() == mode)
                && (anchorJobId == null || anchorJobId.equals(state.getAnchorJobId()))) {
                closed[0] = state;
                current = current.withState(null);
            }
            return current.isEmpty() ? null : current;
        });
        if (closed[0] != null) {
            log.info("User {} {} → IDLE (anchor job {})", userId, closed[0].getMode(), closed[0].getAnchorJobId());
        } else {
            log.debug("No matching conversation to close for user {} (mode={}, anchor={})", userId, mode, anchorJobId);
        }
        return Optional.ofNullable(closed[0]);
    }

    private UserSlot dropExpired(String userId, UserSlot slot, Instant now) {
        if (slot == null) {
            return UserSlot.EMPTY;
        }
        if (slot.getState() != null && slot.getState().isExpired(now)) {
            log.info("Conversation of user {} about job {} expired", userId, slot.getState().getAnchorJobId());
            return slot.withState(null);
        }
        return slot;
    }

    private static boolean isActive(ConversationState state, Instant now) {
        return state != null && !state.isExpired(now);
    }

    private static boolean sameAnchor(ConversationState existing, ConversationAnchor anchor) {
        return existing.getAnchorJobId() != null && existing.getAnchorJobId().equals(anchor.getJobId());
    }

    @Value
    @With
    static class UserSlot {
        static final UserSlot EMPTY = new UserSlot(null, null, null);

        ConversationState state;

        /**
         * Token of the job currently being processed for this user
         */
        String inFlight;

        /**
         * Job that failed and must run again before any other job of this user
         */
        String retryPending;

        boolean isEmpty() {
            return state == null && inFlight == null && retryPending == null;
        }
    }
}
