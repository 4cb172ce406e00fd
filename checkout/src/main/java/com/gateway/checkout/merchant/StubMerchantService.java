package com.gateway.checkout.merchant;

import com.gateway.checkout.domain.CheckoutSession;
import com.gateway.checkout.domain.FulfillmentDetails;
import com.gateway.checkout.domain.FulfillmentOption;
import com.gateway.checkout.domain.Item;
import com.gateway.checkout.domain.LineItem;
import com.gateway.checkout.domain.MerchantData;
import com.gateway.checkout.domain.Message;
import com.gateway.checkout.domain.Order;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Demo merchant with deterministic prices, for local runs and tests.
 *
 * Unit price is derived from the product id (500–4999 cents), quantities above one get 10% off,
 * and tax is a flat 8% once an address is known. Two shipping options are always offered.
 */
@Slf4j
public class StubMerchantService implements MerchantService {

    static final long BASE_PRICE_CENTS = 500;
    static final long PRICE_SPREAD_CENTS = 4500;
    static final double TAX_RATE = 0.08;
    static final double MULTI_QUANTITY_DISCOUNT = 0.10;

    private final Clock clock;
    private final String permalinkBase;

    public StubMerchantService(Clock clock, String permalinkBase) {
        this.clock = clock;
        this.permalinkBase = permalinkBase.endsWith("/")
                ? permalinkBase.substring(0, permalinkBase.length() - 1)
                : permalinkBase;
    }

    @Override
    public MerchantData getMerchantData(List<Item> items, FulfillmentDetails fulfillmentDetails) {
        boolean taxable = fulfillmentDetails != null && fulfillmentDetails.getAddress() != null;
        return MerchantData.builder()
                .lineItems(items.stream().map(item -> price(item, taxable)).toList())
                .fulfillmentOptions(shippingOptions())
                .messages(List.of(Message.builder()
                        .type("info")
                        .contentType("plain")
                        .content("Welcome to the demo store! This is a simulated checkout experience.")
                        .build()))
                .build();
    }

    @Override
    public Order createOrder(CheckoutSession session) {
        String orderId = UUID.randomUUID().toString();
        log.info("Stub order created: orderId={}, sessionId={}", orderId, session.getId());
        return Order.builder()
                .id(orderId)
                .checkoutSessionId(session.getId())
                .permalinkUrl(permalinkBase + "/" + orderId)
                .build();
    }

    static long unitPrice(String productId) {
        long hash = productId.chars().sum();
        return BASE_PRICE_CENTS + (hash % PRICE_SPREAD_CENTS);
    }

    private LineItem price(Item item, boolean taxable) {
        long baseAmount = unitPrice(item.getId()) * item.getQuantity();
        long discount = item.getQuantity() > 1 ? (long) Math.floor(baseAmount * MULTI_QUANTITY_DISCOUNT) : 0;
        long subtotal = baseAmount - discount;
        long tax = taxable ? (long) Math.floor(subtotal * TAX_RATE) : 0;

        return LineItem.builder()
                .id("line_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12))
                .item(Item.builder().id(item.getId()).quantity(item.getQuantity()).build())
                .baseAmount(baseAmount)
                .discount(discount)
                .subtotal(subtotal)
                .tax(tax)
                .total(subtotal + tax)
                .build();
    }

    private List<FulfillmentOption> shippingOptions() {
        Instant now = clock.instant();
        return List.of(
                FulfillmentOption.builder()
                        .type("shipping")
                        .id("ship_standard")
                        .title("Standard Shipping")
                        .subtitle("5-7 business days")
                        .carrier("USPS")
                        .earliestDeliveryTime(now.plus(Duration.ofDays(5)))
                        .latestDeliveryTime(now.plus(Duration.ofDays(7)))
                        .subtotal(100)
                        .tax(80)
                        .total(180)
                        .build(),
                FulfillmentOption.builder()
                        .type("shipping")
                        .id("ship_expedited")
                        .title("Expedited Shipping")
                        .subtitle("2-3 business days")
                        .carrier("FedEx")
                        .earliestDeliveryTime(now.plus(Duration.ofDays(2)))
                        .latestDeliveryTime(now.plus(Duration.ofDays(3)))
                        .subtotal(150)
                        .tax(120)
                        .total(270)
                        .build()
        );
    }
}
