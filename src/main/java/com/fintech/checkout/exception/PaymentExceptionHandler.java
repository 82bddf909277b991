package com.fintech.checkout.exception;

import com.fintech.checkout.dto.ApiResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps payment exceptions to the {@link ApiResult} failure envelope.
 */
@RestControllerAdvice
@Slf4j
public class PaymentExceptionHandler {

    @ExceptionHandler(InvalidPaymentRequestException.class)
    public ResponseEntity<ApiResult<Void>> handleInvalidRequest(InvalidPaymentRequestException ex) {
        log.warn("Invalid payment request: {}", ex.getMessage());
        ApiResult<Void> body = ApiResult.failure(ex.getMessage(), null);
        if (!ex.getMissingFields().isEmpty()) {
            body.setMissingFields(ex.getMissingFields());
        }
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<ApiResult<Void>> handleInvalidSignature(InvalidSignatureException ex,
                                                                  HttpServletRequest request) {
        log.error("SECURITY: signature rejected on {} {}", request.getMethod(), request.getRequestURI());
        return ResponseEntity.badRequest().body(ApiResult.failure(ex.getMessage(), null));
    }

    @ExceptionHandler({PaymentNotFoundException.class, OrderNotFoundException.class})
    public ResponseEntity<ApiResult<Void>> handleNotFound(PaymentException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResult.failure(ex.getMessage(), null));
    }

    @ExceptionHandler(PaymentStateException.class)
    public ResponseEntity<ApiResult<Void>> handleStateConflict(PaymentStateException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("currentStatus", ex.getCurrentStatus());
        details.put("requestedStatus", ex.getRequestedStatus());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResult.failure(ex.getMessage(), details));
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ApiResult<Void>> handleGateway(GatewayException ex) {
        log.error("Gateway call failed ({}): {} - {}", ex.getGatewayName(), ex.getMessage(),
                ex.getGatewayDescription());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ApiResult.failure(ex.getMessage(), ex.getGatewayDescription()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResult<Void>> handleValidation(MethodArgumentNotValidException ex) {
        List<String> fields = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .toList();
        ApiResult<Void> body = ApiResult.failure("Invalid request", null);
        body.setMissingFields(fields);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResult<Void>> handleUnreadable(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResult.failure("Malformed request", null));
    }

    @ExceptionHandler(PaymentException.class)
    public ResponseEntity<ApiResult<Void>> handlePayment(PaymentException ex) {
        log.error("Payment processing error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResult.failure(ex.getMessage(), null));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiResult<Void>> handleUnexpected(RuntimeException ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResult.failure("Internal server error", null));
    }
}
