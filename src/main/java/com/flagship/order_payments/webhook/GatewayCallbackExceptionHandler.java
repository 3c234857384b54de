package com.flagship.order_payments.webhook;

import com.flagship.order_payments.payment.exception.OverpaymentException;
import com.flagship.order_payments.payment.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Answers callback failures in the gateway's {@code {status, message}} shape.
 * Takes precedence over the global handler for the callback controller only.
 */
@RestControllerAdvice(assignableTypes = GatewayCallbackController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class GatewayCallbackExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<GatewayCallbackResponse> handleMalformed(Exception e) {
        log.warn("Malformed gateway callback: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid callback: " + e.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<GatewayCallbackResponse> handleNotFound(ResourceNotFoundException e) {
        log.warn("Gateway callback for unknown record: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({OverpaymentException.class, IllegalStateException.class, DataIntegrityViolationException.class})
    public ResponseEntity<GatewayCallbackResponse> handleRejected(RuntimeException e) {
        log.warn("Gateway callback rejected: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<GatewayCallbackResponse> handleUnexpected(Exception e) {
        log.error("Gateway callback processing failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error while processing callback");
    }

    private static ResponseEntity<GatewayCallbackResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(GatewayCallbackResponse.error(message));
    }
}
