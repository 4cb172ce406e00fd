package com.gateway.checkout.service;

import com.gateway.checkout.config.CheckoutProperties;
import com.gateway.checkout.domain.Address;
import com.gateway.checkout.domain.Buyer;
import com.gateway.checkout.domain.CheckoutSession;
import com.gateway.checkout.domain.CompleteSessionCommand;
import com.gateway.checkout.domain.CreateSessionCommand;
import com.gateway.checkout.domain.FulfillmentDetails;
import com.gateway.checkout.domain.Item;
import com.gateway.checkout.domain.PaymentData;
import com.gateway.checkout.domain.RequestMetadata;
import com.gateway.checkout.domain.SelectedFulfillmentOption;
import com.gateway.checkout.domain.SessionHistory;
import com.gateway.checkout.domain.SessionStatus;
import com.gateway.checkout.domain.SessionVersion;
import com.gateway.checkout.domain.TransitionReason;
import com.gateway.checkout.domain.UpdateSessionCommand;
import com.gateway.checkout.exception.InvalidRequestException;
import com.gateway.checkout.exception.ProcessingException;
import com.gateway.checkout.exception.SessionNotFoundException;
import com.gateway.checkout.merchant.MerchantService;
import com.gateway.checkout.merchant.StubMerchantService;
import com.gateway.checkout.repository.InMemorySessionEventStore;
import com.gateway.checkout.repository.SessionEventStore;
import com.gateway.shared.idempotency.InMemoryIdempotencyIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit Tests — CheckoutSessionService
 *
 * Runs against the in-memory store and idempotency index with the stub merchant.
 * Commit listeners are mocked.
 */
@ExtendWith(MockitoExtension.class)
class CheckoutSessionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-01T09:00:00Z"), ZoneOffset.UTC);

    @Mock SessionCommitListener listener;

    InMemorySessionEventStore store;
    MerchantService merchant;
    CheckoutProperties properties;
    SimpleMeterRegistry meterRegistry;
    CheckoutSessionService service;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionEventStore();
        merchant = spy(new StubMerchantService(CLOCK, "https://shop.test/orders"));
        properties = new CheckoutProperties();
        meterRegistry = new SimpleMeterRegistry();
        service = serviceWith(store, merchant);
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private CheckoutSessionService serviceWith(SessionEventStore eventStore, MerchantService merchantService) {
        InMemoryIdempotencyIndex index = new InMemoryIdempotencyIndex(Duration.ofHours(24), CLOCK,
                () -> "cs_" + UUID.randomUUID().toString().replace("-", ""));
        return new CheckoutSessionService(index, eventStore, merchantService, List.of(listener),
                properties, CLOCK, meterRegistry);
    }

    private static RequestMetadata metadata(String idempotencyKey) {
        return RequestMetadata.of(idempotencyKey, "req_" + UUID.randomUUID());
    }

    private static CreateSessionCommand createCommand() {
        return CreateSessionCommand.builder()
                .items(List.of(Item.builder().id("item_123").quantity(2).build()))
                .build();
    }

    private static Buyer buyer() {
        return Buyer.builder().firstName("Ada").lastName("Lovelace").email("ada@example.com").build();
    }

    private static FulfillmentDetails details() {
        return FulfillmentDetails.builder()
                .name("Ada Lovelace")
                .email("ada@example.com")
                .address(Address.builder()
                        .name("Ada Lovelace")
                        .lineOne("1 Main St")
                        .city("Springfield")
                        .state("IL")
                        .country("US")
                        .postalCode("62701")
                        .build())
                .build();
    }

    private static UpdateSessionCommand readyUpdate() {
        return UpdateSessionCommand.builder()
                .items(List.of(Item.builder().id("item_123").quantity(2).build()))
                .buyer(buyer())
                .fulfillmentDetails(details())
                .build();
    }

    private static CompleteSessionCommand payment() {
        return CompleteSessionCommand.builder()
                .paymentData(PaymentData.builder().token("tok_visa").provider("stripe").build())
                .build();
    }

    private String readySession() {
        String sessionId = service.create(createCommand(), metadata("idem_create")).getId();
        service.update(sessionId, readyUpdate(), metadata("idem_ready"));
        return sessionId;
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    // ─── create Tests ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("create — items only: priced session, auto-selected shipping, not ready, version 1")
    void create_itemsOnly() {
        CheckoutSession session = service.create(createCommand(), metadata("idem_1"));

        assertThat(session.getId()).startsWith("cs_");
        assertThat(session.getStatus()).isEqualTo(SessionStatus.NOT_READY_FOR_PAYMENT);
        assertThat(session.getLineItems()).hasSize(1);
        assertThat(session.getLineItems().get(0).getTotal()).isEqualTo(2117);
        assertThat(session.getSelectedFulfillmentOptions()).extracting(SelectedFulfillmentOption::optionId)
                .containsExactly("ship_standard");
        assertThat(session.getLinks()).extracting("type")
                .containsExactly("terms_of_use", "privacy_policy", "return_policy");

        List<SessionVersion> history = service.history(session.getId());
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getReason()).isEqualTo(TransitionReason.CREATED);
        assertThat(history.get(0).getIdempotencyKey()).isEqualTo("idem_1");
        verify(listener).onCommitted(any(SessionVersion.class));
    }

    @Test
    @DisplayName("create — buyer and address up front make the session ready immediately")
    void create_withBuyerAndAddress_ready() {
        CheckoutSession session = service.create(CreateSessionCommand.builder()
                .items(List.of(Item.builder().id("item_123").quantity(1).build()))
                .buyer(buyer())
                .fulfillmentDetails(details())
                .build(), metadata("idem_1"));

        assertThat(session.getStatus()).isEqualTo(SessionStatus.READY_FOR_PAYMENT);
        assertThat(session.getLineItems().get(0).getTax()).isEqualTo(94);
    }

    @Test
    @DisplayName("create — same idempotency key replays the stored response without a new version")
    void create_replay() {
        CheckoutSession first = service.create(createCommand(), metadata("idem_same"));
        CheckoutSession second = service.create(createCommand(), metadata("idem_same"));

        assertThat(second).isEqualTo(first);
        assertThat(service.history(first.getId())).hasSize(1);
        verify(merchant, times(1)).getMerchantData(anyList(), any());
        verify(listener, times(1)).onCommitted(any(SessionVersion.class));
        assertThat(counter("checkout.idempotent.replays")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("create — without an idempotency key every call is a new session")
    void create_noKey_noDedupe() {
        CheckoutSession first = service.create(createCommand(), metadata(null));
        CheckoutSession second = service.create(createCommand(), metadata(null));

        assertThat(second.getId()).isNotEqualTo(first.getId());
    }

    @Test
    @DisplayName("create — merchant failure surfaces as merchant_unavailable and nothing is stored")
    void create_merchantFailure() {
        MerchantService failing = mock(MerchantService.class);
        when(failing.getMerchantData(anyList(), any()))
                .thenThrow(new MerchantService.MerchantUnavailableException("down", null));
        InMemorySessionEventStore emptyStore = new InMemorySessionEventStore();
        CheckoutSessionService failingService = serviceWith(emptyStore, failing);

        assertThatThrownBy(() -> failingService.create(createCommand(), metadata("idem_1")))
                .isInstanceOf(ProcessingException.class)
                .satisfies(ex -> {
                    ProcessingException pe = (ProcessingException) ex;
                    assertThat(pe.getCode()).isEqualTo(ProcessingException.MERCHANT_UNAVAILABLE);
                    assertThat(pe.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY);
                });
        verifyNoInteractions(listener);
    }

    // ─── update Tests ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("update — buyer and address move the session to ready_for_payment at version 2")
    void update_becomesReady() {
        String sessionId = service.create(createCommand(), metadata("idem_c")).getId();

        CheckoutSession updated = service.update(sessionId, UpdateSessionCommand.builder()
                .buyer(buyer())
                .fulfillmentDetails(details())
                .build(), metadata("idem_u"));

        assertThat(updated.getStatus()).isEqualTo(SessionStatus.READY_FOR_PAYMENT);
        assertThat(service.history(sessionId)).extracting(SessionVersion::getVersion).containsExactly(1, 2);
    }

    @Test
    @DisplayName("update — explicit selection of another option is applied")
    void update_selectsOption() {
        String sessionId = service.create(createCommand(), metadata("idem_c")).getId();

        CheckoutSession updated = service.update(sessionId, UpdateSessionCommand.builder()
                .selectedFulfillmentOptions(List.of(SelectedFulfillmentOption.of("shipping", "ship_expedited", null)))
                .build(), metadata("idem_u"));

        assertThat(updated.getSelectedFulfillmentOptions()).extracting(SelectedFulfillmentOption::optionId)
                .containsExactly("ship_expedited");
        verify(merchant, times(1)).getMerchantData(anyList(), any());
    }

    @Test
    @DisplayName("update — same idempotency key replays the first update")
    void update_replay() {
        String sessionId = service.create(createCommand(), metadata("idem_c")).getId();
        CheckoutSession first = service.update(sessionId, readyUpdate(), metadata("idem_u"));

        CheckoutSession second = service.update(sessionId, UpdateSessionCommand.builder().buyer(null).build(),
                metadata("idem_u"));

        assertThat(second).isEqualTo(first);
        assertThat(service.history(sessionId)).hasSize(2);
    }

    @Test
    @DisplayName("update — unknown session is not found and nothing is created")
    void update_unknownSession() {
        assertThatThrownBy(() -> service.update("cs_missing", readyUpdate(), metadata("idem_u")))
                .isInstanceOf(SessionNotFoundException.class)
                .hasMessageContaining("cs_missing");
        assertThat(store.history("cs_missing").exists()).isFalse();
    }

    // ─── complete Tests ───────────────────────────────────────────────────────

    @Test
    @DisplayName("complete — ready session completes with an order and notifies listeners")
    void complete_ready() {
        String sessionId = readySession();

        CheckoutSession completed = service.complete(sessionId, payment(), metadata("idem_pay"));

        assertThat(completed.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(completed.getOrder().getCheckoutSessionId()).isEqualTo(sessionId);
        assertThat(completed.getOrder().getPermalinkUrl()).startsWith("https://shop.test/orders/");

        ArgumentCaptor<SessionVersion> captor = ArgumentCaptor.forClass(SessionVersion.class);
        verify(listener, times(3)).onCommitted(captor.capture());
        assertThat(captor.getAllValues()).extracting(SessionVersion::getReason)
                .containsExactly(TransitionReason.CREATED, TransitionReason.UPDATED, TransitionReason.COMPLETED);
    }

    @Test
    @DisplayName("complete — missing payment data is rejected before touching the session")
    void complete_missingPaymentData() {
        String sessionId = readySession();

        assertThatThrownBy(() -> service.complete(sessionId, CompleteSessionCommand.builder().build(), metadata("idem_pay")))
                .isInstanceOf(InvalidRequestException.class)
                .extracting("code").isEqualTo(InvalidRequestException.MISSING_PAYMENT_DATA);
        assertThat(service.history(sessionId)).hasSize(2);
    }

    @Test
    @DisplayName("complete — not-ready session is rejected and no order is created")
    void complete_notReady() {
        String sessionId = service.create(createCommand(), metadata("idem_c")).getId();

        assertThatThrownBy(() -> service.complete(sessionId, payment(), metadata("idem_pay")))
                .isInstanceOf(InvalidRequestException.class)
                .extracting("code").isEqualTo(InvalidRequestException.ALREADY_COMPLETED);
        verify(merchant, never()).createOrder(any());
    }

    @Test
    @DisplayName("complete — a second completion is rejected")
    void complete_twice() {
        String sessionId = readySession();
        service.complete(sessionId, payment(), metadata("idem_pay"));

        assertThatThrownBy(() -> service.complete(sessionId, payment(), metadata("idem_pay_again")))
                .isInstanceOf(InvalidRequestException.class);
        verify(merchant, times(1)).createOrder(any());
    }

    @Test
    @DisplayName("complete — order creation failure leaves the session ready")
    void complete_orderCreationFails() {
        String sessionId = readySession();
        doThrow(new MerchantService.MerchantUnavailableException("orders down", null))
                .when(merchant).createOrder(any());

        assertThatThrownBy(() -> service.complete(sessionId, payment(), metadata("idem_pay")))
                .isInstanceOf(ProcessingException.class)
                .extracting("code").isEqualTo(ProcessingException.ORDER_CREATION_FAILED);
        assertThat(service.get(sessionId).getStatus()).isEqualTo(SessionStatus.READY_FOR_PAYMENT);
    }

    // ─── cancel Tests ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("cancel — open session is canceled; a repeat cancel is not allowed")
    void cancel_onceOnly() {
        String sessionId = service.create(createCommand(), metadata("idem_c")).getId();

        CheckoutSession canceled = service.cancel(sessionId, metadata("idem_x"));

        assertThat(canceled.getStatus()).isEqualTo(SessionStatus.CANCELED);
        assertThatThrownBy(() -> service.cancel(sessionId, metadata("idem_x")))
                .isInstanceOf(InvalidRequestException.class)
                .extracting("code").isEqualTo(InvalidRequestException.CANCELLATION_NOT_ALLOWED);
    }

    @Test
    @DisplayName("cancel — a completed session cannot be canceled")
    void cancel_afterComplete() {
        String sessionId = readySession();
        service.complete(sessionId, payment(), metadata("idem_pay"));

        assertThatThrownBy(() -> service.cancel(sessionId, metadata("idem_x")))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(service.get(sessionId).getStatus()).isEqualTo(SessionStatus.COMPLETED);
    }

    // ─── get / history Tests ──────────────────────────────────────────────────

    @Test
    @DisplayName("get — returns the latest snapshot; unknown id is not found")
    void get_latestOrNotFound() {
        String sessionId = readySession();

        assertThat(service.get(sessionId).getStatus()).isEqualTo(SessionStatus.READY_FOR_PAYMENT);
        assertThatThrownBy(() -> service.get("cs_missing")).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> service.history("cs_missing")).isInstanceOf(SessionNotFoundException.class);
    }

    // ─── Concurrency Tests ────────────────────────────────────────────────────

    @Test
    @DisplayName("commit — a lost append is retried on fresh history with the merchant called once")
    void commit_conflictRetried() {
        String sessionId = service.create(createCommand(), metadata("idem_c")).getId();
        AtomicInteger appends = new AtomicInteger();
        SessionEventStore racing = new SessionEventStore() {
            @Override
            public SessionHistory history(String id) {
                return store.history(id);
            }

            @Override
            public AppendResult append(SessionVersion version) {
                if (appends.getAndIncrement() == 0) {
                    // A competing writer takes this version number first
                    store.append(version.toBuilder().idempotencyKey("idem_other").requestId("req_other").build());
                }
                return store.append(version);
            }
        };
        CheckoutSessionService racingService = serviceWith(racing, merchant);
        clearInvocations(merchant);

        CheckoutSession updated = racingService.update(sessionId, readyUpdate(), metadata("idem_u"));

        assertThat(updated.getStatus()).isEqualTo(SessionStatus.READY_FOR_PAYMENT);
        assertThat(service.history(sessionId)).extracting(SessionVersion::getVersion).containsExactly(1, 2, 3);
        assertThat(service.history(sessionId).get(2).getIdempotencyKey()).isEqualTo("idem_u");
        verify(merchant, times(1)).getMerchantData(anyList(), any());
        assertThat(counter("checkout.store.conflicts")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("complete — an order priced before a concurrent line item change is replaced")
    void complete_conflictWithRepricedItems_newOrder() {
        String sessionId = readySession();
        CheckoutSession ready = service.get(sessionId);
        CheckoutSession repriced = ready.toBuilder()
                .lineItems(List.of(ready.getLineItems().get(0).toBuilder().total(9999).build()))
                .build();
        AtomicInteger appends = new AtomicInteger();
        SessionEventStore racing = new SessionEventStore() {
            @Override
            public SessionHistory history(String id) {
                return store.history(id);
            }

            @Override
            public AppendResult append(SessionVersion version) {
                if (appends.getAndIncrement() == 0) {
                    store.append(version.toBuilder()
                            .reason(TransitionReason.UPDATED)
                            .snapshot(repriced)
                            .idempotencyKey("idem_other")
                            .requestId("req_other")
                            .build());
                }
                return store.append(version);
            }
        };
        CheckoutSessionService racingService = serviceWith(racing, merchant);
        clearInvocations(merchant);

        CheckoutSession completed = racingService.complete(sessionId, payment(), metadata("idem_pay"));

        assertThat(completed.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(completed.getLineItems()).isEqualTo(repriced.getLineItems());
        ArgumentCaptor<CheckoutSession> priced = ArgumentCaptor.forClass(CheckoutSession.class);
        verify(merchant, times(2)).createOrder(priced.capture());
        assertThat(priced.getAllValues().get(1).getLineItems()).isEqualTo(repriced.getLineItems());
        assertThat(service.history(sessionId)).extracting(SessionVersion::getVersion).containsExactly(1, 2, 3, 4);
    }

    @Test
    @DisplayName("complete — a concurrent completion wins and the losing request is rejected")
    void complete_conflictWithConcurrentCompletion_rejected() {
        String sessionId = readySession();
        AtomicInteger appends = new AtomicInteger();
        SessionEventStore racing = new SessionEventStore() {
            @Override
            public SessionHistory history(String id) {
                return store.history(id);
            }

            @Override
            public AppendResult append(SessionVersion version) {
                if (appends.getAndIncrement() == 0) {
                    store.append(version.toBuilder().idempotencyKey("idem_other").requestId("req_other").build());
                }
                return store.append(version);
            }
        };
        CheckoutSessionService racingService = serviceWith(racing, merchant);
        clearInvocations(merchant);

        assertThatThrownBy(() -> racingService.complete(sessionId, payment(), metadata("idem_pay")))
                .isInstanceOf(InvalidRequestException.class)
                .satisfies(ex -> assertThat(((InvalidRequestException) ex).getCode())
                        .isEqualTo(InvalidRequestException.ALREADY_COMPLETED));

        verify(merchant, times(1)).createOrder(any());
        List<SessionVersion> history = service.history(sessionId);
        assertThat(history).hasSize(3);
        assertThat(history.get(2).getIdempotencyKey()).isEqualTo("idem_other");
    }

    @Test
    @DisplayName("commit — conflicts on every attempt give concurrent_modification (503)")
    void commit_conflictsExhausted() {
        SessionEventStore alwaysConflicting = mock(SessionEventStore.class);
        when(alwaysConflicting.history(anyString()))
                .thenAnswer(inv -> SessionHistory.empty(inv.getArgument(0)));
        when(alwaysConflicting.append(any())).thenReturn(SessionEventStore.AppendResult.CONFLICT);
        CheckoutSessionService conflicted = serviceWith(alwaysConflicting, merchant);

        assertThatThrownBy(() -> conflicted.create(createCommand(), metadata("idem_c")))
                .isInstanceOf(ProcessingException.class)
                .satisfies(ex -> {
                    ProcessingException pe = (ProcessingException) ex;
                    assertThat(pe.getCode()).isEqualTo(ProcessingException.CONCURRENT_MODIFICATION);
                    assertThat(pe.getStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                });
        verify(alwaysConflicting, times(properties.getMaxAppendAttempts())).append(any());
        verify(merchant, times(1)).getMerchantData(anyList(), any());
        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("create — concurrent calls with one idempotency key produce one session and one version")
    void create_concurrentSameKey() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<CheckoutSession>> calls = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            calls.add(() -> {
                start.await();
                return service.create(createCommand(), metadata("idem_race"));
            });
        }

        List<CheckoutSession> results = new ArrayList<>();
        try {
            List<Future<CheckoutSession>> futures = new ArrayList<>();
            for (Callable<CheckoutSession> call : calls) {
                futures.add(pool.submit(call));
            }
            start.countDown();
            for (Future<CheckoutSession> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        String sessionId = results.get(0).getId();
        assertThat(results).extracting(CheckoutSession::getId).containsOnly(sessionId);
        assertThat(service.history(sessionId)).extracting(SessionVersion::getVersion).containsExactly(1);
        verify(listener, times(1)).onCommitted(any());
    }

    // ─── Listener Tests ───────────────────────────────────────────────────────

    @Test
    @DisplayName("commit — a failing listener does not fail the request")
    void commit_listenerFailureIsolated() {
        doThrow(new IllegalStateException("webhook queue full")).when(listener).onCommitted(any());

        CheckoutSession session = service.create(createCommand(), metadata("idem_c"));

        assertThat(session.getStatus()).isEqualTo(SessionStatus.NOT_READY_FOR_PAYMENT);
        assertThat(service.history(session.getId())).hasSize(1);
    }
}
