package com.flagship.order_payments.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Callback body as the gateway sends it. Fields are checked by the controller so a
 * malformed callback still gets the gateway's error shape.
 */
@Value
public class GatewayCallbackRequest {

    @JsonProperty("externalId")
    String externalId;

    @JsonProperty("transactionStatus")
    String transactionStatus;

    @JsonProperty("transactionId")
    String transactionId;

    @JsonProperty("message")
    String message;
}
