package com.gateway.checkout.merchant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.gateway.checkout.domain.CheckoutSession;
import com.gateway.checkout.domain.FulfillmentDetails;
import com.gateway.checkout.domain.Item;
import com.gateway.checkout.domain.MerchantData;
import com.gateway.checkout.domain.Order;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.function.Supplier;

/**
 * Merchant back end reached over REST.
 *
 *   POST {baseUrl}/merchant-data  {items, fulfillment_details} → MerchantData
 *   POST {baseUrl}/orders         CheckoutSession              → Order
 *
 * Calls go through a circuit breaker; an open breaker or a failed call surfaces as
 * {@link MerchantUnavailableException}.
 */
@Slf4j
public class HttpMerchantService implements MerchantService {

    private final RestClient restClient;
    private final CircuitBreaker circuitBreaker;

    public HttpMerchantService(RestClient restClient, CircuitBreaker circuitBreaker) {
        this.restClient = restClient;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public MerchantData getMerchantData(List<Item> items, FulfillmentDetails fulfillmentDetails) {
        return call("merchant-data", () -> restClient.post()
                .uri("/merchant-data")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new MerchantDataRequest(items, fulfillmentDetails))
                .retrieve()
                .body(MerchantData.class));
    }

    @Override
    public Order createOrder(CheckoutSession session) {
        return call("orders", () -> restClient.post()
                .uri("/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .body(session)
                .retrieve()
                .body(Order.class));
    }

    private <T> T call(String operation, Supplier<T> request) {
        T response;
        try {
            response = circuitBreaker.executeSupplier(request);
        } catch (CallNotPermittedException e) {
            log.warn("Merchant call short-circuited: operation={}, breaker={}", operation, circuitBreaker.getName());
            throw new MerchantUnavailableException("Merchant circuit breaker is open", e);
        } catch (RestClientException e) {
            log.error("Merchant call failed: operation={}, error={}", operation, e.getMessage());
            throw new MerchantUnavailableException("Merchant call failed: " + operation, e);
        }
        if (response == null) {
            throw new MerchantUnavailableException("Merchant returned an empty body: " + operation, null);
        }
        return response;
    }

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class MerchantDataRequest {
        List<Item> items;
        FulfillmentDetails fulfillmentDetails;
    }
}
