package com.flagship.order_payments.webhook;

public enum CallbackOutcome {
    /** The payment was completed and credited to its order. */
    RECONCILED,
    MARKED_FAILED,
    /** Redelivery, unknown status, or a status that changes nothing. */
    NO_OP
}
