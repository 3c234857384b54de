package com.flagship.order_payments.payment.exception;

import lombok.Getter;

@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final String resourceId;

    public ResourceNotFoundException(String resource, Object resourceId) {
        super(resource + " not found: " + resourceId);
        this.resource = resource;
        this.resourceId = String.valueOf(resourceId);
    }

    public static ResourceNotFoundException order(Long orderId) {
        return new ResourceNotFoundException("Order", orderId);
    }
}
