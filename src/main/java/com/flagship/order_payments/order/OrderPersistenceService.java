package com.flagship.order_payments.order;

import com.flagship.order_payments.payment.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Bridges the {@link Order} domain object and {@link OrderEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderPersistenceService {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;

    /**
     * Inserts a new order with its lines. The returned order carries the generated id.
     */
    @Transactional
    public Order save(Order order, List<OrderItem> items) {
        OrderEntity saved = orderRepository.saveAndFlush(OrderEntity.fromDomain(order));
        items.forEach(item -> orderItemRepository.save(OrderItemEntity.fromDomain(saved.getId(), item)));
        log.debug("Saved order {} with {} items", saved.getId(), items.size());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Order> findById(Long orderId) {
        return orderRepository.findById(orderId).map(OrderEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<OrderItem> findItems(Long orderId) {
        return orderItemRepository.findByOrderIdOrderByIdAsc(orderId).stream()
            .map(OrderItemEntity::toDomain)
            .toList();
    }

    /**
     * Reads an order under a row lock held by the caller's transaction.
     * Must be the first read of the order in that transaction, or Hibernate may hand back a stale copy.
     *
     * @throws ResourceNotFoundException if the order does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Order lockForUpdate(Long orderId) {
        return orderRepository.findByIdForUpdate(orderId)
            .map(OrderEntity::toDomain)
            .orElseThrow(() -> ResourceNotFoundException.order(orderId));
    }

    /**
     * Writes the mutable fields of an existing order.
     */
    @Transactional
    public Order update(Order order) {
        OrderEntity existing = orderRepository.findById(order.getId())
            .orElseThrow(() -> ResourceNotFoundException.order(order.getId()));
        existing.updateFromDomain(order);
        OrderEntity updated = orderRepository.saveAndFlush(existing);
        log.debug("Updated order {}: amountPaid={}, paymentStatus={}",
            updated.getId(), updated.getAmountPaid(), updated.getPaymentStatus());
        return updated.toDomain();
    }
}
