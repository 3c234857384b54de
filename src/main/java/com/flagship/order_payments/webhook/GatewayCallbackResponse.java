package com.flagship.order_payments.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GatewayCallbackResponse {
    String status;
    String message;

    public static GatewayCallbackResponse success() {
        return new GatewayCallbackResponse("success", null);
    }

    public static GatewayCallbackResponse error(String message) {
        return new GatewayCallbackResponse("error", message);
    }
}
