package com.fintech.checkout.exception;

/**
 * Base exception for payment reconciliation errors.
 */
public class PaymentException extends RuntimeException {

    public PaymentException(String message) {
        super(message);
    }

    public PaymentException(String message, Throwable cause) {
        super(message, cause);
    }
}
