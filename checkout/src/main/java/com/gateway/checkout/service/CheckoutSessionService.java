package com.gateway.checkout.service;

import com.gateway.checkout.config.CheckoutProperties;
import com.gateway.checkout.domain.CheckoutSession;
import com.gateway.checkout.domain.CompleteSessionCommand;
import com.gateway.checkout.domain.CreateSessionCommand;
import com.gateway.checkout.domain.FulfillmentDetails;
import com.gateway.checkout.domain.Item;
import com.gateway.checkout.domain.LineItem;
import com.gateway.checkout.domain.Link;
import com.gateway.checkout.domain.MerchantData;
import com.gateway.checkout.domain.Order;
import com.gateway.checkout.domain.RequestMetadata;
import com.gateway.checkout.domain.SessionAggregate;
import com.gateway.checkout.domain.SessionHistory;
import com.gateway.checkout.domain.SessionVersion;
import com.gateway.checkout.domain.TransitionReason;
import com.gateway.checkout.domain.UpdateSessionCommand;
import com.gateway.checkout.exception.CheckoutException;
import com.gateway.checkout.exception.InvalidRequestException;
import com.gateway.checkout.exception.ProcessingException;
import com.gateway.checkout.exception.SessionNotFoundException;
import com.gateway.checkout.merchant.MerchantService;
import com.gateway.checkout.repository.SessionEventStore;
import com.gateway.checkout.repository.SessionEventStore.AppendResult;
import com.gateway.shared.idempotency.IdempotencyIndex;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Checkout Session Service — lifecycle orchestration.
 *
 * Every write follows the same path:
 *  1. read the session history
 *  2. replay the stored response if this idempotency key already produced a version
 *  3. rebuild the aggregate from the latest version and apply the change
 *  4. append version N+1 with a conditional write
 *  5. on conflict, go back to 1 (bounded); on success, notify listeners and return
 *
 * No locks are taken. External calls (merchant data, order creation) happen before the
 * append, so when they fail nothing is written.
 */
@Slf4j
@Service
public class CheckoutSessionService {

    private final IdempotencyIndex idempotencyIndex;
    private final SessionEventStore eventStore;
    private final MerchantService merchantService;
    private final List<SessionCommitListener> listeners;
    private final CheckoutProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Counter conflictCounter;
    private final Counter replayCounter;

    public CheckoutSessionService(IdempotencyIndex idempotencyIndex,
                                  SessionEventStore eventStore,
                                  MerchantService merchantService,
                                  List<SessionCommitListener> listeners,
                                  CheckoutProperties properties,
                                  Clock clock,
                                  MeterRegistry meterRegistry) {
        this.idempotencyIndex = idempotencyIndex;
        this.eventStore = eventStore;
        this.merchantService = merchantService;
        this.listeners = listeners;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.conflictCounter = Counter.builder("checkout.store.conflicts")
                .description("Version appends lost to a concurrent writer")
                .register(meterRegistry);
        this.replayCounter = Counter.builder("checkout.idempotent.replays")
                .description("Requests answered from a previously stored response")
                .register(meterRegistry);
    }

    // ─── Write Operations ─────────────────────────────────────────────────────

    public CheckoutSession create(CreateSessionCommand command, RequestMetadata metadata) {
        String sessionId = idempotencyIndex.resolve(metadata.getIdempotencyKey());
        MerchantDataCache merchantData = new MerchantDataCache(command.getItems(), command.getFulfillmentDetails());

        CheckoutSession session = commit(sessionId, TransitionReason.CREATED, metadata, true, history -> {
            SessionAggregate aggregate = aggregateOf(history);
            aggregate.update(merchantData.get(), command.getBuyer(), command.getFulfillmentDetails(), null);
            return aggregate;
        });
        log.info("Checkout session created: sessionId={}, status={}, requestId={}",
                sessionId, session.getStatus().getValue(), metadata.getRequestId());
        return session;
    }

    public CheckoutSession update(String sessionId, UpdateSessionCommand command, RequestMetadata metadata) {
        MerchantDataCache merchantData = new MerchantDataCache(command.getItems(), command.getFulfillmentDetails());

        CheckoutSession session = commit(sessionId, TransitionReason.UPDATED, metadata, true, history -> {
            requireExists(history);
            SessionAggregate aggregate = aggregateOf(history);
            aggregate.update(merchantData.get(), command.getBuyer(), command.getFulfillmentDetails(),
                    command.getSelectedFulfillmentOptions());
            return aggregate;
        });
        log.info("Checkout session updated: sessionId={}, status={}, requestId={}",
                sessionId, session.getStatus().getValue(), metadata.getRequestId());
        return session;
    }

    public CheckoutSession complete(String sessionId, CompleteSessionCommand command, RequestMetadata metadata) {
        if (command == null || command.getPaymentData() == null) {
            throw InvalidRequestException.missingPaymentData();
        }
        OrderCache order = new OrderCache(sessionId);

        CheckoutSession session = commit(sessionId, TransitionReason.COMPLETED, metadata, false, history -> {
            requireExists(history);
            SessionAggregate aggregate = aggregateOf(history);
            if (!aggregate.canBeCompleted()) {
                order.release();
                throw InvalidRequestException.notCompletable(sessionId);
            }
            if (command.getBuyer() != null) {
                aggregate.setBuyer(command.getBuyer());
            }
            aggregate.complete(order.get(aggregate.snapshot()));
            return aggregate;
        });
        log.info("Checkout session completed: sessionId={}, orderId={}, requestId={}",
                sessionId, session.getOrder().getId(), metadata.getRequestId());
        return session;
    }

    public CheckoutSession cancel(String sessionId, RequestMetadata metadata) {
        CheckoutSession session = commit(sessionId, TransitionReason.CANCELED, metadata, false, history -> {
            requireExists(history);
            SessionAggregate aggregate = aggregateOf(history);
            if (!aggregate.canBeCanceled()) {
                throw InvalidRequestException.cancellationNotAllowed(sessionId);
            }
            aggregate.cancel();
            return aggregate;
        });
        log.info("Checkout session canceled: sessionId={}, requestId={}", sessionId, metadata.getRequestId());
        return session;
    }

    // ─── Read Operations ──────────────────────────────────────────────────────

    public CheckoutSession get(String sessionId) {
        return eventStore.history(sessionId)
                .latest()
                .map(SessionVersion::getSnapshot)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Full version log, oldest first.
     */
    public List<SessionVersion> history(String sessionId) {
        SessionHistory history = eventStore.history(sessionId);
        requireExists(history);
        return history.getVersions();
    }

    // ─── Internals ────────────────────────────────────────────────────────────

    /**
     * Optimistic write loop. {@code mutation} is re-run against fresh history on every
     * attempt and may throw a {@link CheckoutException} to abort without writing.
     */
    private CheckoutSession commit(String sessionId,
                                   TransitionReason reason,
                                   RequestMetadata metadata,
                                   boolean replayable,
                                   Function<SessionHistory, SessionAggregate> mutation) {
        int maxAttempts = Math.max(1, properties.getMaxAppendAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            SessionHistory history = eventStore.history(sessionId);

            if (replayable) {
                Optional<CheckoutSession> previous = history.pastResponse(metadata.getIdempotencyKey());
                if (previous.isPresent()) {
                    replayCounter.increment();
                    log.info("Idempotent replay: sessionId={}, idempotencyKey={}, latestVersion={}",
                            sessionId, metadata.getIdempotencyKey(), history.getLatestVersion());
                    return previous.get();
                }
            }

            SessionAggregate aggregate = mutation.apply(history);
            SessionVersion version = SessionVersion.builder()
                    .sessionId(sessionId)
                    .version(history.getNextVersion())
                    .reason(reason)
                    .snapshot(aggregate.snapshot())
                    .idempotencyKey(metadata.getIdempotencyKey())
                    .requestId(metadata.getRequestId())
                    .signature(metadata.getSignature())
                    .timestamp(clock.instant())
                    .build();

            if (eventStore.append(version) == AppendResult.APPENDED) {
                meterRegistry.counter("checkout.sessions.committed", "reason", reason.getValue()).increment();
                log.debug("Version appended: sessionId={}, version={}, reason={}, status={}",
                        sessionId, version.getVersion(), reason.getValue(), version.getStatus().getValue());
                notifyListeners(version);
                return version.getSnapshot();
            }

            conflictCounter.increment();
            log.warn("Version conflict: sessionId={}, version={}, attempt={}/{}",
                    sessionId, version.getVersion(), attempt, maxAttempts);
        }
        throw ProcessingException.concurrentModification(sessionId, maxAttempts);
    }

    private void notifyListeners(SessionVersion version) {
        for (SessionCommitListener listener : listeners) {
            try {
                listener.onCommitted(version);
            } catch (RuntimeException e) {
                log.error("Commit listener failed: listener={}, sessionId={}, version={}",
                        listener.getClass().getSimpleName(), version.getSessionId(), version.getVersion(), e);
            }
        }
    }

    private SessionAggregate aggregateOf(SessionHistory history) {
        return history.latest()
                .map(latest -> new SessionAggregate(latest.getSnapshot()))
                .orElseGet(() -> SessionAggregate.newSession(history.getSessionId(), links()));
    }

    private static void requireExists(SessionHistory history) {
        if (!history.exists()) {
            throw new SessionNotFoundException(history.getSessionId());
        }
    }

    private List<Link> links() {
        CheckoutProperties.Links links = properties.getLinks();
        return List.of(
                Link.builder().type("terms_of_use").url(links.getTermsOfUse()).build(),
                Link.builder().type("privacy_policy").url(links.getPrivacyPolicy()).build(),
                Link.builder().type("return_policy").url(links.getReturnPolicy()).build()
        );
    }

    /**
     * Merchant data for one request, fetched at most once across write attempts.
     */
    private final class MerchantDataCache {
        private final List<Item> items;
        private final FulfillmentDetails fulfillmentDetails;
        private MerchantData value;

        private MerchantDataCache(List<Item> items, FulfillmentDetails fulfillmentDetails) {
            this.items = items;
            this.fulfillmentDetails = fulfillmentDetails;
        }

        MerchantData get() {
            if (items == null) {
                return null;
            }
            if (value == null) {
                try {
                    value = merchantService.getMerchantData(items, fulfillmentDetails);
                } catch (RuntimeException e) {
                    log.error("Merchant data lookup failed: items={}, error={}", items.size(), e.getMessage());
                    throw ProcessingException.merchantUnavailable(e);
                }
            }
            return value;
        }
    }

    /**
     * The order for one completion request, created at most once across write attempts as
     * long as the line items it was priced from are unchanged.
     */
    private final class OrderCache {
        private final String sessionId;
        private Order value;
        private List<LineItem> pricedLineItems;

        private OrderCache(String sessionId) {
            this.sessionId = sessionId;
        }

        Order get(CheckoutSession session) {
            if (value != null && !Objects.equals(pricedLineItems, session.getLineItems())) {
                log.warn("Line items changed since the order was created, creating a new one: sessionId={}, abandonedOrderId={}",
                        sessionId, value.getId());
                value = null;
            }
            if (value == null) {
                try {
                    value = merchantService.createOrder(session);
                    pricedLineItems = session.getLineItems();
                } catch (RuntimeException e) {
                    log.error("Order creation failed: sessionId={}, error={}", sessionId, e.getMessage());
                    throw ProcessingException.orderCreationFailed(sessionId, e);
                }
            }
            return value;
        }

        /** Called when the session can no longer take this order. */
        void release() {
            if (value != null) {
                log.warn("Order created but never attached: sessionId={}, orderId={}", sessionId, value.getId());
                value = null;
            }
        }
    }
}
