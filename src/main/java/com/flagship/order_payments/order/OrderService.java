package com.flagship.order_payments.order;

import com.flagship.order_payments.catalog.ProductEntity;
import com.flagship.order_payments.catalog.ProductRepository;
import com.flagship.order_payments.observability.PaymentMetrics;
import com.flagship.order_payments.outbox.OutboxService;
import com.flagship.order_payments.payment.PaymentPersistenceService;
import com.flagship.order_payments.payment.event.OrderPlacedEvent;
import com.flagship.order_payments.payment.exception.RequestValidationException;
import com.flagship.order_payments.payment.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Places and cancels orders.
 *
 * Placement snapshots each product's current price onto the order line, takes the
 * units out of stock and fixes the order amount as the sum of the lines.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderService {

    private final OrderPersistenceService orderPersistenceService;
    private final ProductRepository productRepository;
    private final OutboxService outboxService;
    private final PaymentPersistenceService paymentPersistenceService;
    private final PaymentMetrics paymentMetrics;

    /**
     * A requested order line: product and quantity, before prices are known.
     */
    public record LineRequest(Long productId, int quantity) {
    }

    /**
     * @throws RequestValidationException if a product is unknown, listed twice, or short on stock
     */
    @Transactional
    public Order placeOrder(UUID customerId, String shippingAddress, List<LineRequest> lines) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (lines == null || lines.isEmpty()) {
            throw RequestValidationException.of("items", "At least one item is required");
        }

        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < lines.size(); i++) {
            LineRequest line = lines.get(i);
            if (line.quantity() < 1) {
                errors.put("items[" + i + "].quantity", "Quantity must be at least 1");
            }
            if (!seen.add(line.productId())) {
                errors.put("items[" + i + "].product_id", "Product " + line.productId() + " is listed more than once");
            }
        }
        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }

        // lock products in id order so concurrent placements cannot deadlock
        Map<Long, ProductEntity> products = new HashMap<>();
        lines.stream()
            .map(LineRequest::productId)
            .sorted(Comparator.naturalOrder())
            .forEach(productId -> productRepository.findByIdForUpdate(productId)
                .ifPresent(product -> products.put(productId, product)));

        for (int i = 0; i < lines.size(); i++) {
            LineRequest line = lines.get(i);
            ProductEntity product = products.get(line.productId());
            if (product == null) {
                errors.put("items[" + i + "].product_id", "Product not found: " + line.productId());
            } else if (!product.hasStock(line.quantity())) {
                errors.put("items[" + i + "].quantity",
                    String.format("Only %d units of product %d in stock", product.getStock(), product.getId()));
            }
        }
        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }

        List<OrderItem> items = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (LineRequest line : lines) {
            ProductEntity product = products.get(line.productId());
            product.decrementStock(line.quantity());
            OrderItem item = new OrderItem(product.getId(), line.quantity(), product.getPrice());
            items.add(item);
            total = total.add(item.lineTotal());
        }

        Order saved = orderPersistenceService.save(Order.place(customerId, shippingAddress, total), items);
        outboxService.saveOrderEvent(OrderPlacedEvent.fromOrder(saved, items.size()));
        paymentMetrics.recordOrderPlaced();

        log.info("Order placed: orderId={}, customerId={}, items={}, amount={}",
            saved.getId(), customerId, items.size(), saved.getAmount());
        return saved;
    }

    @Transactional(readOnly = true)
    public Order getOrder(Long orderId) {
        return orderPersistenceService.findById(orderId)
            .orElseThrow(() -> ResourceNotFoundException.order(orderId));
    }

    @Transactional(readOnly = true)
    public List<OrderItem> getItems(Long orderId) {
        return orderPersistenceService.findItems(orderId);
    }

    /**
     * Cancels an order nothing has been paid on. Stock is not returned to the catalog.
     *
     * A PENDING payment may still be confirmed by a gateway callback, so it blocks cancellation.
     *
     * @throws IllegalStateException if the order has payments in flight or applied,
     *         or has left PENDING/PROCESSING
     */
    @Transactional
    public Order cancelOrder(Long orderId) {
        Order order = orderPersistenceService.lockForUpdate(orderId);
        if (paymentPersistenceService.hasPendingPayment(orderId)) {
            throw new IllegalStateException(
                String.format("Order %s has a payment awaiting gateway confirmation and cannot be cancelled", orderId));
        }
        Order cancelled = orderPersistenceService.update(order.cancel());
        log.info("Order cancelled: orderId={}", orderId);
        return cancelled;
    }
}
