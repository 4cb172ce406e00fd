package com.gateway.checkout.merchant;

import com.gateway.checkout.domain.Address;
import com.gateway.checkout.domain.CheckoutSession;
import com.gateway.checkout.domain.FulfillmentDetails;
import com.gateway.checkout.domain.FulfillmentOption;
import com.gateway.checkout.domain.Item;
import com.gateway.checkout.domain.LineItem;
import com.gateway.checkout.domain.MerchantData;
import com.gateway.checkout.domain.Order;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StubMerchantServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final StubMerchantService merchant =
            new StubMerchantService(Clock.fixed(NOW, ZoneOffset.UTC), "https://shop.test/orders/");

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static FulfillmentDetails withAddress() {
        return FulfillmentDetails.builder()
                .name("Ada Lovelace")
                .address(Address.builder().lineOne("1 Main St").city("Springfield").country("US").postalCode("12345").build())
                .build();
    }

    // ─── getMerchantData Tests ────────────────────────────────────────────────

    @Test
    @DisplayName("unitPrice — deterministic per product id, within 500..4999 cents")
    void unitPrice_deterministic() {
        assertThat(StubMerchantService.unitPrice("item_123")).isEqualTo(1176);
        assertThat(StubMerchantService.unitPrice("item_123")).isEqualTo(StubMerchantService.unitPrice("item_123"));
        assertThat(StubMerchantService.unitPrice("a-much-longer-product-identifier")).isBetween(500L, 4999L);
    }

    @Test
    @DisplayName("getMerchantData — quantity above one gets 10% off; no tax without an address")
    void getMerchantData_discountNoTax() {
        MerchantData data = merchant.getMerchantData(
                List.of(Item.builder().id("item_123").quantity(2).build()), null);

        LineItem line = data.getLineItems().get(0);
        assertThat(line.getId()).startsWith("line_").hasSize(17);
        assertThat(line.getItem().getId()).isEqualTo("item_123");
        assertThat(line.getBaseAmount()).isEqualTo(2352);
        assertThat(line.getDiscount()).isEqualTo(235);
        assertThat(line.getSubtotal()).isEqualTo(2117);
        assertThat(line.getTax()).isZero();
        assertThat(line.getTotal()).isEqualTo(2117);
    }

    @Test
    @DisplayName("getMerchantData — 8% tax on the subtotal once an address is known")
    void getMerchantData_taxWithAddress() {
        MerchantData data = merchant.getMerchantData(
                List.of(Item.builder().id("item_123").quantity(1).build()), withAddress());

        LineItem line = data.getLineItems().get(0);
        assertThat(line.getDiscount()).isZero();
        assertThat(line.getSubtotal()).isEqualTo(1176);
        assertThat(line.getTax()).isEqualTo(94);
        assertThat(line.getTotal()).isEqualTo(1270);
    }

    @Test
    @DisplayName("getMerchantData — offers standard and expedited shipping relative to the clock")
    void getMerchantData_shippingOptions() {
        MerchantData data = merchant.getMerchantData(List.of(Item.builder().id("item_123").quantity(1).build()), null);

        assertThat(data.getFulfillmentOptions())
                .extracting(FulfillmentOption::getId, FulfillmentOption::getCarrier, FulfillmentOption::getTotal)
                .containsExactly(
                        tuple("ship_standard", "USPS", 180L),
                        tuple("ship_expedited", "FedEx", 270L));
        FulfillmentOption standard = data.getFulfillmentOptions().get(0);
        assertThat(standard.getEarliestDeliveryTime()).isEqualTo(NOW.plus(Duration.ofDays(5)));
        assertThat(standard.getLatestDeliveryTime()).isEqualTo(NOW.plus(Duration.ofDays(7)));
        assertThat(data.getMessages()).hasSize(1);
    }

    // ─── createOrder Tests ────────────────────────────────────────────────────

    @Test
    @DisplayName("createOrder — order links back to the session with a permalink under the base url")
    void createOrder_permalink() {
        Order order = merchant.createOrder(CheckoutSession.builder().id("cs_42").build());

        assertThat(order.getId()).isNotBlank();
        assertThat(order.getCheckoutSessionId()).isEqualTo("cs_42");
        assertThat(order.getPermalinkUrl()).isEqualTo("https://shop.test/orders/" + order.getId());
    }
}
