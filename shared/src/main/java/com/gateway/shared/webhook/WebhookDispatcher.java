package com.gateway.shared.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Webhook Dispatcher — signed, retried delivery to a single subscriber.
 *
 * The payload is serialized once; the signature covers exactly those bytes and the
 * same bytes go out on every attempt. Attempts run on a dedicated scheduler, never on
 * the calling thread.
 *
 * Delivery policy:
 *  - 2xx              → DELIVERED
 *  - 4xx              → REJECTED, no retry
 *  - 5xx / I/O error  → retry after {@code attempt * retryDelay}, EXHAUSTED after maxAttempts
 *
 * Failures are logged and reported through the returned future; they never throw to the caller.
 */
@Slf4j
public class WebhookDispatcher implements AutoCloseable {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String MERCHANT_SIGNATURE_HEADER = "X-Merchant-Signature";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String TIMESTAMP_HEADER = "X-Timestamp";
    public static final String EVENT_TYPE_HEADER = "X-Event-Type";

    private final WebhookProperties properties;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final WebhookSigner signer;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;
    private final Map<DeliveryResult.Outcome, Counter> outcomeCounters = new EnumMap<>(DeliveryResult.Outcome.class);

    public WebhookDispatcher(WebhookProperties properties,
                             RestClient restClient,
                             ObjectMapper objectMapper,
                             MeterRegistry meterRegistry) {
        this.properties = properties;
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.signer = properties.isEnabled() ? new WebhookSigner(properties.getSecret()) : null;
        this.retryPolicy = new LinearBackoffRetryPolicy(properties.getRetryDelay().toMillis());
        this.scheduler = Executors.newScheduledThreadPool(
                Math.max(1, properties.getWorkerThreads()), new DispatcherThreadFactory("webhook-dispatcher-"));

        for (DeliveryResult.Outcome outcome : DeliveryResult.Outcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("webhook.deliveries")
                    .tag("outcome", outcome.name().toLowerCase())
                    .description("Webhook events by final delivery outcome")
                    .register(meterRegistry));
        }

        if (properties.isEnabled()) {
            log.info("Webhook delivery enabled: url={}, maxAttempts={}", properties.getUrl(), properties.getMaxAttempts());
        } else {
            log.info("Webhook delivery disabled: no subscriber url configured");
        }
    }

    /**
     * Queue an event for delivery and return immediately.
     *
     * @param eventType value sent in the event type header
     * @param timestamp value sent in the timestamp header, normally the payload's own timestamp
     * @param payload   body, serialized to JSON once
     */
    public CompletableFuture<DeliveryResult> dispatch(String eventType, Instant timestamp, Object payload) {
        if (!properties.isEnabled()) {
            log.debug("Webhook skipped (disabled): eventType={}", eventType);
            return CompletableFuture.completedFuture(record(DeliveryResult.skipped()));
        }

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize webhook payload: eventType={}", eventType, e);
            return CompletableFuture.failedFuture(e);
        }

        String signature = signer.sign(body);
        Delivery delivery = new Delivery(eventType, timestamp.toString(), UUID.randomUUID().toString(), body, signature);
        CompletableFuture<DeliveryResult> result = new CompletableFuture<>();
        schedule(delivery, 1, 0L, result);
        return result;
    }

    /**
     * Cancel pending retries. Events still waiting for an attempt are dropped.
     */
    @Override
    public void close() {
        List<Runnable> pending = scheduler.shutdownNow();
        if (!pending.isEmpty()) {
            log.warn("Webhook dispatcher stopped with pending deliveries dropped: count={}", pending.size());
        }
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    // ─── Internals ────────────────────────────────────────────────────────────

    private void schedule(Delivery delivery, int attempt, long delayMs, CompletableFuture<DeliveryResult> result) {
        try {
            scheduler.schedule(() -> {
                try {
                    attempt(delivery, attempt, result);
                } catch (RuntimeException e) {
                    log.error("Unexpected webhook delivery failure: eventType={}, requestId={}",
                            delivery.eventType, delivery.requestId, e);
                    result.completeExceptionally(e);
                }
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Webhook dropped, dispatcher is shut down: eventType={}, requestId={}, attempt={}",
                    delivery.eventType, delivery.requestId, attempt);
            result.complete(record(new DeliveryResult(DeliveryResult.Outcome.EXHAUSTED, attempt - 1, null)));
        }
    }

    private void attempt(Delivery delivery, int attempt, CompletableFuture<DeliveryResult> result) {
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        Integer lastStatus = null;
        try {
            HttpStatusCode status = send(delivery);
            lastStatus = status.value();

            if (status.is2xxSuccessful()) {
                log.info("Webhook delivered: eventType={}, requestId={}, status={}, attempt={}",
                        delivery.eventType, delivery.requestId, lastStatus, attempt);
                result.complete(record(new DeliveryResult(DeliveryResult.Outcome.DELIVERED, attempt, lastStatus)));
                return;
            }
            if (status.is4xxClientError()) {
                log.warn("Webhook rejected by subscriber, not retrying: eventType={}, requestId={}, status={}",
                        delivery.eventType, delivery.requestId, lastStatus);
                result.complete(record(new DeliveryResult(DeliveryResult.Outcome.REJECTED, attempt, lastStatus)));
                return;
            }
            log.warn("Webhook delivery failed: eventType={}, requestId={}, status={}, attempt={}/{}",
                    delivery.eventType, delivery.requestId, lastStatus, attempt, maxAttempts);
        } catch (RestClientException e) {
            log.warn("Webhook delivery error: eventType={}, requestId={}, attempt={}/{}, error={}",
                    delivery.eventType, delivery.requestId, attempt, maxAttempts, e.getMessage());
        }

        if (attempt >= maxAttempts) {
            log.error("Webhook dropped after {} attempts: eventType={}, requestId={}, lastStatus={}",
                    attempt, delivery.eventType, delivery.requestId, lastStatus);
            result.complete(record(new DeliveryResult(DeliveryResult.Outcome.EXHAUSTED, attempt, lastStatus)));
            return;
        }
        schedule(delivery, attempt + 1, retryPolicy.computeDelayMs(attempt), result);
    }

    private HttpStatusCode send(Delivery delivery) {
        return restClient.post()
                .uri(properties.getUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .header(SIGNATURE_HEADER, delivery.signature)
                .header(MERCHANT_SIGNATURE_HEADER, properties.getMerchantName() + "-" + delivery.signature)
                .header(REQUEST_ID_HEADER, delivery.requestId)
                .header(TIMESTAMP_HEADER, delivery.timestamp)
                .header(EVENT_TYPE_HEADER, delivery.eventType)
                .body(delivery.body)
                .exchange((request, response) -> response.getStatusCode());
    }

    private DeliveryResult record(DeliveryResult result) {
        outcomeCounters.get(result.getOutcome()).increment();
        return result;
    }

    private static final class Delivery {
        private final String eventType;
        private final String timestamp;
        private final String requestId;
        private final byte[] body;
        private final String signature;

        private Delivery(String eventType, String timestamp, String requestId, byte[] body, String signature) {
            this.eventType = eventType;
            this.timestamp = timestamp;
            this.requestId = requestId;
            this.body = body;
            this.signature = signature;
        }
    }
}
