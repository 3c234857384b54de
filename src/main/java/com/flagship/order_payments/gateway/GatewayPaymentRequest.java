package com.flagship.order_payments.gateway;

import com.flagship.order_payments.payment.MobileMoneyProvider;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class GatewayPaymentRequest {
    BigDecimal amount;
    String phoneNumber;
    MobileMoneyProvider provider;
    /**
     * Our reference for the payment; the gateway echoes it back as externalId in callbacks.
     * It is the order id.
     */
    String externalReference;
}
