package com.flagship.order_payments.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * JPA entity for order lines. Written once at order placement, read-only afterwards.
 */
@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false, updatable = false)
    private Long orderId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private Long productId;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Column(name = "price_at_time", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal priceAtTime;

    static OrderItemEntity fromDomain(Long orderId, OrderItem item) {
        return new OrderItemEntity(null, orderId, item.getProductId(), item.getQuantity(), item.getPriceAtTime());
    }

    public OrderItem toDomain() {
        return new OrderItem(productId, quantity, priceAtTime);
    }
}
