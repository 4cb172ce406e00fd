package com.gateway.checkout.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.gateway.checkout.domain.Buyer;
import com.gateway.checkout.domain.CheckoutSession;
import com.gateway.checkout.domain.CompleteSessionCommand;
import com.gateway.checkout.domain.CreateSessionCommand;
import com.gateway.checkout.domain.FulfillmentDetails;
import com.gateway.checkout.domain.Item;
import com.gateway.checkout.domain.PaymentData;
import com.gateway.checkout.domain.RequestMetadata;
import com.gateway.checkout.domain.SelectedFulfillmentOption;
import com.gateway.checkout.domain.SessionVersion;
import com.gateway.checkout.domain.UpdateSessionCommand;
import com.gateway.checkout.service.CheckoutSessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Instant;
import java.util.List;

/**
 * Agentic Commerce Protocol checkout endpoints.
 *
 *   POST /checkout_sessions                 create
 *   GET  /checkout_sessions/{id}            retrieve
 *   POST /checkout_sessions/{id}            update
 *   POST /checkout_sessions/{id}/complete   complete with payment data
 *   POST /checkout_sessions/{id}/cancel     cancel
 *   GET  /checkout_sessions/{id}/versions   audit trail
 */
@Slf4j
@RestController
@RequestMapping("/checkout_sessions")
@RequiredArgsConstructor
public class CheckoutSessionController {

    private final CheckoutSessionService sessionService;

    // ─── Write Endpoints ──────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<CheckoutSession> createSession(
            @Valid @RequestBody CreateCheckoutSessionRequest request,
            @RequestAttribute(RequestMetadataFilter.METADATA_ATTRIBUTE) RequestMetadata metadata) {

        CreateSessionCommand command = CreateSessionCommand.builder()
                .items(toItems(request.getItems()))
                .buyer(request.getBuyer())
                .fulfillmentDetails(request.getFulfillmentDetails())
                .build();

        CheckoutSession session = sessionService.create(command, metadata);
        return ResponseEntity
                .created(URI.create("/checkout_sessions/" + session.getId()))
                .body(session);
    }

    @PostMapping("/{sessionId}")
    public ResponseEntity<CheckoutSession> updateSession(
            @PathVariable String sessionId,
            @Valid @RequestBody UpdateCheckoutSessionRequest request,
            @RequestAttribute(RequestMetadataFilter.METADATA_ATTRIBUTE) RequestMetadata metadata) {

        UpdateSessionCommand command = UpdateSessionCommand.builder()
                .items(request.getItems() != null ? toItems(request.getItems()) : null)
                .buyer(request.getBuyer())
                .fulfillmentDetails(request.getFulfillmentDetails())
                .selectedFulfillmentOptions(request.getSelectedFulfillmentOptions())
                .build();

        return ResponseEntity.ok(sessionService.update(sessionId, command, metadata));
    }

    @PostMapping("/{sessionId}/complete")
    public ResponseEntity<CheckoutSession> completeSession(
            @PathVariable String sessionId,
            @RequestBody(required = false) CompleteCheckoutSessionRequest request,
            @RequestAttribute(RequestMetadataFilter.METADATA_ATTRIBUTE) RequestMetadata metadata) {

        CompleteSessionCommand command = CompleteSessionCommand.builder()
                .paymentData(request != null ? request.getPaymentData() : null)
                .buyer(request != null ? request.getBuyer() : null)
                .build();

        return ResponseEntity.ok(sessionService.complete(sessionId, command, metadata));
    }

    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<CheckoutSession> cancelSession(
            @PathVariable String sessionId,
            @RequestAttribute(RequestMetadataFilter.METADATA_ATTRIBUTE) RequestMetadata metadata) {
        return ResponseEntity.ok(sessionService.cancel(sessionId, metadata));
    }

    // ─── Read Endpoints ───────────────────────────────────────────────────────

    @GetMapping("/{sessionId}")
    public ResponseEntity<CheckoutSession> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.get(sessionId));
    }

    @GetMapping("/{sessionId}/versions")
    public ResponseEntity<SessionVersionsResponse> getSessionVersions(@PathVariable String sessionId) {
        List<VersionSummary> versions = sessionService.history(sessionId).stream()
                .map(CheckoutSessionController::toSummary)
                .toList();
        return ResponseEntity.ok(SessionVersionsResponse.builder()
                .checkoutSessionId(sessionId)
                .versions(versions)
                .count(versions.size())
                .build());
    }

    private static List<Item> toItems(List<ItemRequest> items) {
        return items.stream()
                .map(i -> Item.builder().id(i.getId()).quantity(i.getQuantity()).build())
                .toList();
    }

    private static VersionSummary toSummary(SessionVersion version) {
        return VersionSummary.builder()
                .version(version.getVersion())
                .reason(version.getReason().getValue())
                .status(version.getStatus().getValue())
                .idempotencyKey(version.getIdempotencyKey())
                .requestId(version.getRequestId())
                .timestamp(version.getTimestamp())
                .build();
    }
}

// ─── Request / Response DTOs ───────────────────────────────────────────────────

@Data
class ItemRequest {
    @NotBlank private String id;
    @Min(1) private int quantity;
}

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
class CreateCheckoutSessionRequest {
    @NotEmpty @Valid private List<ItemRequest> items;
    private Buyer buyer;
    private FulfillmentDetails fulfillmentDetails;
}

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
class UpdateCheckoutSessionRequest {
    @Valid private List<ItemRequest> items;
    private Buyer buyer;
    private FulfillmentDetails fulfillmentDetails;
    private List<SelectedFulfillmentOption> selectedFulfillmentOptions;
}

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
class CompleteCheckoutSessionRequest {
    private Buyer buyer;
    private PaymentData paymentData;
}

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
class SessionVersionsResponse {
    private String checkoutSessionId;
    private List<VersionSummary> versions;
    private int count;
}

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
class VersionSummary {
    private int version;
    private String reason;
    private String status;
    private String idempotencyKey;
    private String requestId;
    private Instant timestamp;
}
