package com.flagship.order_payments.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class PlaceOrderRequest {

    @NotNull(message = "Customer ID is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @NotBlank(message = "Shipping address is required")
    @JsonProperty("shipping_address")
    String shippingAddress;

    @NotEmpty(message = "At least one item is required")
    @JsonProperty("items")
    List<@NotNull(message = "Item is required") @Valid Item> items;

    @Value
    public static class Item {

        @NotNull(message = "Product ID is required")
        @JsonProperty("product_id")
        Long productId;

        @NotNull(message = "Quantity is required")
        @Min(value = 1, message = "Quantity must be at least 1")
        @JsonProperty("quantity")
        Integer quantity;
    }
}
