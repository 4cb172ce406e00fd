package com.gateway.checkout.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CompleteSessionCommand {
    PaymentData paymentData;
    Buyer buyer;
}
