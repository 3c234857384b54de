package com.flagship.order_payments.order;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A line of an order: quantity times the product price captured when the order was placed.
 */
@Value
public class OrderItem {
    Long productId;
    int quantity;
    BigDecimal priceAtTime;

    public BigDecimal lineTotal() {
        return priceAtTime.multiply(BigDecimal.valueOf(quantity));
    }
}
