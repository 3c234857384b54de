package com.flagship.order_payments.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.order_payments.reconciliation.PaymentInitiationResult;
import lombok.Value;

@Value
public class PaymentInitiationResponse {

    @JsonProperty("payment")
    PaymentResponse payment;

    @JsonProperty("order")
    OrderSummaryResponse order;

    public static PaymentInitiationResponse from(PaymentInitiationResult result) {
        return new PaymentInitiationResponse(
            PaymentResponse.from(result.getPayment()),
            OrderSummaryResponse.from(result.getOrder()));
    }
}
