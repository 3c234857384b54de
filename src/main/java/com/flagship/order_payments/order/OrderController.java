package com.flagship.order_payments.order;

import com.flagship.order_payments.order.dto.OrderResponse;
import com.flagship.order_payments.order.dto.PlaceOrderRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
@Slf4j
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    public ResponseEntity<OrderResponse> placeOrder(@Valid @RequestBody PlaceOrderRequest request) {
        log.info("Received order request: customerId={}, items={}", request.getCustomerId(), request.getItems().size());

        List<OrderService.LineRequest> lines = request.getItems().stream()
            .map(item -> new OrderService.LineRequest(item.getProductId(), item.getQuantity()))
            .toList();
        Order order = orderService.placeOrder(request.getCustomerId(), request.getShippingAddress(), lines);

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(OrderResponse.from(order, orderService.getItems(order.getId())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("id") Long id) {
        Order order = orderService.getOrder(id);
        return ResponseEntity.ok(OrderResponse.from(order, orderService.getItems(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(@PathVariable("id") Long id) {
        Order order = orderService.cancelOrder(id);
        return ResponseEntity.ok(OrderResponse.from(order, orderService.getItems(id)));
    }
}
