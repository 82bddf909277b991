package com.fintech.checkout.exception;

/**
 * Thrown when a requested status change is not allowed from the current status,
 * e.g. completing a payment that has already been refunded.
 */
public class PaymentStateException extends PaymentException {

    private final String currentStatus;
    private final String requestedStatus;

    public PaymentStateException(String message, String currentStatus, String requestedStatus) {
        super(message);
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }

    public String getRequestedStatus() {
        return requestedStatus;
    }
}
