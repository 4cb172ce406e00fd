package com.gateway.checkout.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToLongFunction;
import java.util.stream.Collectors;

/**
 * Checkout Session Aggregate — state machine over an immutable snapshot.
 *
 * Every mutation produces a new {@link CheckoutSession} and re-derives status:
 *
 *   not_ready_for_payment ⇄ ready_for_payment → completed
 *            └──────────────────┴──────────────→ canceled
 *
 * Ready means: line items, fulfillment options, a selected option, an address and a buyer
 * are all present. Completed and canceled are terminal; once reached, status never moves.
 *
 * Not thread-safe. Each request builds its own aggregate from the latest stored version.
 */
public class SessionAggregate {

    public static final String DEFAULT_CURRENCY = "usd";

    private CheckoutSession state;

    public SessionAggregate(CheckoutSession state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    /**
     * A fresh, empty session in {@code not_ready_for_payment}.
     */
    public static SessionAggregate newSession(String sessionId, List<Link> links) {
        CheckoutSession initial = CheckoutSession.builder()
                .id(sessionId)
                .paymentProvider(PaymentProvider.builder()
                        .provider("stripe")
                        .supportedPaymentMethods(List.of("card"))
                        .build())
                .status(SessionStatus.NOT_READY_FOR_PAYMENT)
                .currency(DEFAULT_CURRENCY)
                .links(links)
                .build();
        return new SessionAggregate(initial);
    }

    public CheckoutSession snapshot() {
        return state;
    }

    public String getId() {
        return state.getId();
    }

    public SessionStatus getStatus() {
        return state.getStatus();
    }

    // ─── Mutations ────────────────────────────────────────────────────────────

    /**
     * Apply whatever the caller supplied. Merchant data goes first so selections are
     * validated against the fresh fulfillment options.
     */
    public void update(MerchantData merchantData,
                       Buyer buyer,
                       FulfillmentDetails fulfillmentDetails,
                       List<SelectedFulfillmentOption> selections) {
        if (merchantData != null) {
            applyMerchantData(merchantData);
        }
        if (buyer != null) {
            setBuyer(buyer);
        }
        if (fulfillmentDetails != null) {
            setFulfillmentDetails(fulfillmentDetails);
        }
        if (selections != null) {
            selectFulfillmentOptions(selections);
        }
    }

    public void applyMerchantData(MerchantData data) {
        if (data.getLineItems() != null) {
            replaceLineItems(data.getLineItems());
        }
        if (data.getFulfillmentOptions() != null) {
            replaceFulfillmentOptions(data.getFulfillmentOptions());
        }
        if (data.getMessages() != null) {
            state = state.toBuilder().messages(List.copyOf(data.getMessages())).build();
        }
    }

    /** Line items and totals are always replaced together. */
    public void replaceLineItems(List<LineItem> lineItems) {
        transition(state.toBuilder()
                .lineItems(List.copyOf(lineItems))
                .totals(computeTotals(lineItems))
                .build());
    }

    /**
     * Replace the available options. An empty list clears the selection; a selection that no
     * longer matches the options is repaired by picking the cheapest option of each type.
     */
    public void replaceFulfillmentOptions(List<FulfillmentOption> options) {
        List<FulfillmentOption> available = List.copyOf(options);
        List<SelectedFulfillmentOption> selected = state.getSelectedFulfillmentOptions();

        if (available.isEmpty()) {
            selected = List.of();
        } else if (!isSelectionValid(selected, available)) {
            selected = cheapestPerType(available, allItemIds());
        }

        transition(state.toBuilder()
                .fulfillmentOptions(available)
                .selectedFulfillmentOptions(selected)
                .build());
    }

    /**
     * Keep only selections that point at an available option, at most one per type.
     * If none survive, the current selection stays.
     */
    public void selectFulfillmentOptions(List<SelectedFulfillmentOption> selections) {
        Set<String> availableIds = state.getFulfillmentOptions().stream()
                .map(FulfillmentOption::getId)
                .collect(Collectors.toSet());

        Map<String, SelectedFulfillmentOption> byType = new LinkedHashMap<>();
        for (SelectedFulfillmentOption selection : selections) {
            if (selection == null || !availableIds.contains(selection.optionId())) {
                continue;
            }
            byType.putIfAbsent(selection.effectiveType(), withItemIds(selection));
        }

        if (!byType.isEmpty()) {
            transition(state.toBuilder()
                    .selectedFulfillmentOptions(List.copyOf(byType.values()))
                    .build());
        }
    }

    public void setBuyer(Buyer buyer) {
        transition(state.toBuilder().buyer(buyer).build());
    }

    public void setFulfillmentDetails(FulfillmentDetails details) {
        transition(state.toBuilder().fulfillmentDetails(details).build());
    }

    // ─── Terminal transitions ─────────────────────────────────────────────────

    public boolean canBeCompleted() {
        return state.getStatus() == SessionStatus.READY_FOR_PAYMENT;
    }

    public boolean canBeCanceled() {
        return !state.getStatus().isTerminal();
    }

    public void complete(Order order) {
        if (!canBeCompleted()) {
            throw new IllegalStateException("Session " + state.getId() + " cannot be completed from " + state.getStatus().getValue());
        }
        state = state.toBuilder()
                .status(SessionStatus.COMPLETED)
                .order(order)
                .build();
    }

    public void cancel() {
        if (!canBeCanceled()) {
            throw new IllegalStateException("Session " + state.getId() + " cannot be canceled from " + state.getStatus().getValue());
        }
        state = state.toBuilder()
                .status(SessionStatus.CANCELED)
                .build();
    }

    // ─── Derived fields ───────────────────────────────────────────────────────

    static List<Total> computeTotals(List<LineItem> lineItems) {
        return List.of(
                total("items_base_amount", "Items Base Amount", sum(lineItems, LineItem::getBaseAmount)),
                total("items_discount", "Discount", -sum(lineItems, LineItem::getDiscount)),
                total("subtotal", "Subtotal", sum(lineItems, LineItem::getSubtotal)),
                total("tax", "Tax", sum(lineItems, LineItem::getTax)),
                total("total", "Total", sum(lineItems, LineItem::getTotal))
        );
    }

    private void transition(CheckoutSession next) {
        state = withDerivedStatus(next);
    }

    private static CheckoutSession withDerivedStatus(CheckoutSession session) {
        if (session.getStatus() != null && session.getStatus().isTerminal()) {
            return session;
        }
        SessionStatus status = isReadyForPayment(session)
                ? SessionStatus.READY_FOR_PAYMENT
                : SessionStatus.NOT_READY_FOR_PAYMENT;
        return session.getStatus() == status ? session : session.toBuilder().status(status).build();
    }

    private static boolean isReadyForPayment(CheckoutSession session) {
        return !session.getLineItems().isEmpty()
                && !session.getFulfillmentOptions().isEmpty()
                && !session.getSelectedFulfillmentOptions().isEmpty()
                && session.getFulfillmentDetails() != null
                && session.getFulfillmentDetails().getAddress() != null
                && session.getBuyer() != null;
    }

    private static boolean isSelectionValid(List<SelectedFulfillmentOption> selected, List<FulfillmentOption> available) {
        if (selected.isEmpty()) {
            return false;
        }
        Set<String> availableIds = available.stream().map(FulfillmentOption::getId).collect(Collectors.toSet());
        return selected.stream().allMatch(selection -> availableIds.contains(selection.optionId()));
    }

    private static List<SelectedFulfillmentOption> cheapestPerType(List<FulfillmentOption> available, List<String> itemIds) {
        Map<String, FulfillmentOption> cheapest = new LinkedHashMap<>();
        for (FulfillmentOption option : available) {
            cheapest.merge(option.getType(), option, (current, candidate) ->
                    Comparator.comparingLong(FulfillmentOption::getTotal).compare(candidate, current) < 0 ? candidate : current);
        }
        List<SelectedFulfillmentOption> selections = new ArrayList<>();
        for (FulfillmentOption option : cheapest.values()) {
            selections.add(SelectedFulfillmentOption.of(option.getType(), option.getId(), itemIds));
        }
        return List.copyOf(selections);
    }

    private SelectedFulfillmentOption withItemIds(SelectedFulfillmentOption selection) {
        FulfillmentSelection chosen = selection.selection();
        if (selection.getType() != null && chosen.getItemIds() != null) {
            return selection;
        }
        List<String> itemIds = chosen.getItemIds() != null ? chosen.getItemIds() : allItemIds();
        return SelectedFulfillmentOption.of(selection.effectiveType(), chosen.getOptionId(), itemIds);
    }

    private List<String> allItemIds() {
        return state.getLineItems().stream()
                .map(lineItem -> lineItem.getItem().getId())
                .toList();
    }

    private static Total total(String type, String displayText, long amount) {
        return Total.builder().type(type).displayText(displayText).amount(amount).build();
    }

    private static long sum(List<LineItem> lineItems, ToLongFunction<LineItem> amount) {
        return lineItems.stream().mapToLong(amount).sum();
    }
}
