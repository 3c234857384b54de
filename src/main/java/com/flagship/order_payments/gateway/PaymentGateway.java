package com.flagship.order_payments.gateway;

/**
 * Mobile money payment gateway as seen by the payment flows.
 *
 * A submission either returns a result (confirmed or declined)
 * or throws {@link GatewayException} when the gateway could not be reached or understood.
 * Final status may arrive later through the gateway callback endpoint.
 */
public interface PaymentGateway {

    GatewayResult submit(GatewayPaymentRequest request);
}
