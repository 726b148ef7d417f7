package com.whereq.memori.retry;

import com.whereq.memori.handler.HandlerResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AttemptLedgerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    AttemptLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new AttemptLedger();
    }

    @Test
    void recordFailure_countsEachKindSeparately() {
        ledger.recordFailure("j", FailureKind.INVALID_RESPONSE, T0);
        ledger.recordFailure("j", FailureKind.UNAVAILABLE, T0.plusSeconds(1));
        AttemptLedger.Entry entry = ledger.recordFailure("j", FailureKind.INVALID_RESPONSE, T0.plusSeconds(2));

        assertThat(entry.getInvalidResponseFailures()).isEqualTo(2);
        assertThat(entry.getUnavailableFailures()).isEqualTo(1);
        assertThat(entry.getFirstFailureAt()).isEqualTo(T0);
        assertThat(entry.getFirstUnavailableAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(entry.totalFailures()).isEqualTo(3);
    }

    @Test
    void isDue_beforeAndAfterScheduledAttempt() {
        ledger.recordFailure("j", FailureKind.INVALID_RESPONSE, T0);
        ledger.scheduleNextAttempt("j", T0.plusSeconds(4));

        assertThat(ledger.isDue("j", T0.plusSeconds(3))).isFalse();
        assertThat(ledger.isDue("j", T0.plusSeconds(4))).isTrue();
        assertThat(ledger.isDue("unknown", T0)).isTrue();
    }

    @Test
    void markUnavailableNoticeSent_flipsOnlyOnce() {
        ledger.recordFailure("j", FailureKind.UNAVAILABLE, T0);

        assertThat(ledger.markUnavailableNoticeSent("j")).isTrue();
        assertThat(ledger.markUnavailableNoticeSent("j")).isFalse();
        assertThat(ledger.markUnavailableNoticeSent("never-failed")).isFalse();
    }

    @Test
    void defer_withoutFailure_holdsJobWithoutCountingIt() {
        ledger.defer("j", T0.plusSeconds(5));

        assertThat(ledger.isDue("j", T0)).isFalse();
        assertThat(ledger.get("j")).get()
            .satisfies(entry -> assertThat(entry.totalFailures()).isZero());

        // a later failure still gets a first-failure time
        AttemptLedger.Entry entry = ledger.recordFailure("j", FailureKind.UNAVAILABLE, T0.plusSeconds(6));
        assertThat(entry.getFirstFailureAt()).isEqualTo(T0.plusSeconds(6));
    }

    @Test
    void recordResult_keptAcrossDeferAndDroppedOnClear() {
        HandlerResult result = HandlerResult.noAction(Map.of("matched", false), "nothing to do");
        ledger.recordFailure("j", FailureKind.UNAVAILABLE, T0);

        ledger.recordResult("j", result);
        ledger.defer("j", T0.plusSeconds(5));

        assertThat(ledger.completedResult("j")).containsSame(result);
        assertThat(ledger.get("j").orElseThrow().getUnavailableFailures()).isEqualTo(1);
        assertThat(ledger.completedResult("unknown")).isEmpty();

        ledger.clear("j");

        assertThat(ledger.completedResult("j")).isEmpty();
    }

    @Test
    void clear_removesEntry() {
        ledger.recordFailure("j", FailureKind.INVALID_RESPONSE, T0);

        ledger.clear("j");

        assertThat(ledger.get("j")).isEmpty();
        assertThat(ledger.size()).isZero();
    }
}
