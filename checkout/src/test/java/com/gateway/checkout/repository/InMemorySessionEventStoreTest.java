package com.gateway.checkout.repository;

import com.gateway.checkout.domain.CheckoutSession;
import com.gateway.checkout.domain.SessionHistory;
import com.gateway.checkout.domain.SessionStatus;
import com.gateway.checkout.domain.SessionVersion;
import com.gateway.checkout.domain.TransitionReason;
import com.gateway.checkout.repository.SessionEventStore.AppendResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class InMemorySessionEventStoreTest {

    private final InMemorySessionEventStore store = new InMemorySessionEventStore();

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static SessionVersion version(String sessionId, int number, String requestId) {
        return SessionVersion.builder()
                .sessionId(sessionId)
                .version(number)
                .reason(number == 1 ? TransitionReason.CREATED : TransitionReason.UPDATED)
                .snapshot(CheckoutSession.builder().id(sessionId).status(SessionStatus.NOT_READY_FOR_PAYMENT).build())
                .requestId(requestId)
                .timestamp(Instant.now())
                .build();
    }

    // ─── Tests ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("history — unknown session is empty")
    void history_unknown() {
        assertThat(store.history("cs_missing").exists()).isFalse();
    }

    @Test
    @DisplayName("append — second write of the same version is a conflict and keeps the first")
    void append_sameVersion_conflict() {
        assertThat(store.append(version("cs_1", 1, "req_a"))).isEqualTo(AppendResult.APPENDED);
        assertThat(store.append(version("cs_1", 1, "req_b"))).isEqualTo(AppendResult.CONFLICT);

        SessionHistory history = store.history("cs_1");
        assertThat(history.getVersions()).hasSize(1);
        assertThat(history.getVersions().get(0).getRequestId()).isEqualTo("req_a");
    }

    @Test
    @DisplayName("append — sessions are independent")
    void append_independentSessions() {
        store.append(version("cs_1", 1, "req_a"));
        assertThat(store.append(version("cs_2", 1, "req_b"))).isEqualTo(AppendResult.APPENDED);
    }

    @Test
    @DisplayName("append — racing writers produce contiguous versions with exactly one winner each")
    void append_concurrentWriters_contiguous() throws Exception {
        int writers = 8;
        int writesPerWriter = 25;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                String requestId = "writer_" + w;
                tasks.add(() -> {
                    start.await();
                    int written = 0;
                    while (written < writesPerWriter) {
                        int next = store.history("cs_race").getNextVersion();
                        if (store.append(version("cs_race", next, requestId)) == AppendResult.APPENDED) {
                            written++;
                        }
                    }
                    return written;
                });
            }
            List<Future<Integer>> futures = new ArrayList<>();
            for (Callable<Integer> task : tasks) {
                futures.add(pool.submit(task));
            }
            start.countDown();
            for (Future<Integer> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS)).isEqualTo(writesPerWriter);
            }
        } finally {
            pool.shutdownNow();
        }

        List<SessionVersion> versions = store.history("cs_race").getVersions();
        assertThat(versions).hasSize(writers * writesPerWriter);
        for (int i = 0; i < versions.size(); i++) {
            assertThat(versions.get(i).getVersion()).isEqualTo(i + 1);
        }
    }
}
