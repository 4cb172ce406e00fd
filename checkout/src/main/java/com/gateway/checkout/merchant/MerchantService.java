package com.gateway.checkout.merchant;

import com.gateway.checkout.domain.CheckoutSession;
import com.gateway.checkout.domain.FulfillmentDetails;
import com.gateway.checkout.domain.Item;
import com.gateway.checkout.domain.MerchantData;
import com.gateway.checkout.domain.Order;

import java.util.List;

/**
 * The merchant's catalog, shipping and order management, as seen by the checkout engine.
 *
 * Implementations are chosen at startup with {@code checkout.merchant.mode}.
 */
public interface MerchantService {

    /**
     * Price the items and list the ways they can be fulfilled.
     * Tax depends on the destination, so line items carry no tax while
     * {@code fulfillmentDetails} or its address is absent.
     *
     * @param items              requested product ids and quantities
     * @param fulfillmentDetails delivery details, or null if not provided yet
     */
    MerchantData getMerchantData(List<Item> items, FulfillmentDetails fulfillmentDetails);

    /**
     * Create the order for a session that is about to complete. Called once per completion.
     */
    Order createOrder(CheckoutSession session);

    class MerchantUnavailableException extends RuntimeException {
        public MerchantUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
