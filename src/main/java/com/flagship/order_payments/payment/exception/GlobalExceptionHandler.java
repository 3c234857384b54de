package com.flagship.order_payments.payment.exception;

import com.flagship.order_payments.gateway.GatewayException;
import com.flagship.order_payments.observability.CorrelationContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the service's exception taxonomy to {@link ApiError} responses.
 * The gateway callback endpoint has its own advice with the gateway's response shape.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e, HttpServletRequest request) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e,
                                                              HttpServletRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error -> errors.putIfAbsent(
            error.getField(),
            error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"));

        log.warn("Validation failed: fields={}", errors.keySet());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors, request);
    }

    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<ApiError> handleRequestValidation(RequestValidationException e, HttpServletRequest request) {
        log.warn("Validation failed: fields={}", e.getFieldErrors().keySet());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed",
            e.getFieldErrors(), request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e, HttpServletRequest request) {
        log.warn("Unreadable request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", "Request could not be parsed", null, request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException e, HttpServletRequest request) {
        log.warn("{}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null, request);
    }

    @ExceptionHandler(OverpaymentException.class)
    public ResponseEntity<ApiError> handleOverpayment(OverpaymentException e, HttpServletRequest request) {
        log.warn("Overpayment rejected: {}", e.getMessage());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("amount", e.getRequestedAmount().toPlainString());
        details.put("remaining_balance", e.getRemainingBalance().toPlainString());
        return respond(HttpStatus.CONFLICT, "Overpayment", e.getMessage(), details, request);
    }

    @ExceptionHandler(DuplicatePaymentException.class)
    public ResponseEntity<ApiError> handleDuplicatePayment(DuplicatePaymentException e, HttpServletRequest request) {
        log.warn("Duplicate payment: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Duplicate Payment", e.getMessage(), null, request);
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ApiError> handleGateway(GatewayException e, HttpServletRequest request) {
        // Gateway detail stays in the log; callers get a generic reason
        log.error("Payment gateway failure: {}", e.getMessage(), e);
        return respond(HttpStatus.BAD_GATEWAY, "Payment Gateway Error",
            "The payment could not be initiated with the mobile money provider", null, request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleDataIntegrity(DataIntegrityViolationException e, HttpServletRequest request) {
        log.warn("Data integrity violation: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", "The request conflicts with existing data", null, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e, HttpServletRequest request) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null, request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e, HttpServletRequest request) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e, HttpServletRequest request) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", null, request);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                             Map<String, String> details, HttpServletRequest request) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .status(status.value())
            .path(request.getRequestURI())
            .correlationId(CorrelationContext.getCorrelationId())
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
