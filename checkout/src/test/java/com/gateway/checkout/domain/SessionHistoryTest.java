package com.gateway.checkout.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SessionHistoryTest {

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static SessionVersion version(int number, String idempotencyKey, SessionStatus status) {
        return SessionVersion.builder()
                .sessionId("cs_1")
                .version(number)
                .reason(number == 1 ? TransitionReason.CREATED : TransitionReason.UPDATED)
                .snapshot(CheckoutSession.builder().id("cs_1").status(status).currency("usd").build())
                .idempotencyKey(idempotencyKey)
                .timestamp(Instant.parse("2026-01-01T10:00:00Z").plusSeconds(number))
                .build();
    }

    // ─── Tests ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("empty — does not exist and the next version is 1")
    void empty_nextVersionIsOne() {
        SessionHistory history = SessionHistory.empty("cs_1");

        assertThat(history.exists()).isFalse();
        assertThat(history.getLatestVersion()).isZero();
        assertThat(history.getNextVersion()).isEqualTo(1);
        assertThat(history.latest()).isEmpty();
    }

    @Test
    @DisplayName("constructor — versions are ordered regardless of input order")
    void constructor_sortsVersions() {
        SessionHistory history = new SessionHistory("cs_1", List.of(
                version(3, null, SessionStatus.READY_FOR_PAYMENT),
                version(1, "k1", SessionStatus.NOT_READY_FOR_PAYMENT),
                version(2, "k2", SessionStatus.NOT_READY_FOR_PAYMENT)));

        assertThat(history.getVersions()).extracting(SessionVersion::getVersion).containsExactly(1, 2, 3);
        assertThat(history.getNextVersion()).isEqualTo(4);
        assertThat(history.latest()).get().extracting(SessionVersion::getStatus).isEqualTo(SessionStatus.READY_FOR_PAYMENT);
    }

    @Test
    @DisplayName("pastResponse — the most recent version written under the key answers")
    void pastResponse_latestMatchWins() {
        SessionHistory history = new SessionHistory("cs_1", List.of(
                version(1, "k1", SessionStatus.NOT_READY_FOR_PAYMENT),
                version(2, "k1", SessionStatus.READY_FOR_PAYMENT),
                version(3, "k2", SessionStatus.CANCELED)));

        assertThat(history.pastResponse("k1")).get()
                .extracting(CheckoutSession::getStatus).isEqualTo(SessionStatus.READY_FOR_PAYMENT);
        assertThat(history.pastResponse("unknown")).isEmpty();
        assertThat(history.pastResponse(null)).isEmpty();
        assertThat(history.pastResponse(" ")).isEmpty();
    }
}
