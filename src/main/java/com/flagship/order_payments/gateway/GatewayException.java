package com.flagship.order_payments.gateway;

import lombok.Getter;

/**
 * A gateway call did not produce a usable answer, or the gateway declined the payment.
 */
@Getter
public class GatewayException extends RuntimeException {

    public enum Reason {
        /**
         * The gateway refused our client credentials.
         */
        INVALID_CREDENTIALS,
        /**
         * The gateway answered and declined the payment.
         */
        DECLINED,
        /**
         * Network failure or timeout; retrying later may help.
         */
        TRANSIENT,
        /**
         * The gateway answered with something we could not interpret.
         */
        MALFORMED_RESPONSE
    }

    private final Reason reason;

    public GatewayException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GatewayException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    @Override
    public String getMessage() {
        return reason + ": " + super.getMessage();
    }
}
