package com.fintech.checkout.exception;

import java.util.List;

/**
 * Thrown when a request is missing fields or carries malformed values.
 */
public class InvalidPaymentRequestException extends PaymentException {

    private final List<String> missingFields;

    public InvalidPaymentRequestException(String message) {
        super(message);
        this.missingFields = List.of();
    }

    public InvalidPaymentRequestException(String message, List<String> missingFields) {
        super(message);
        this.missingFields = List.copyOf(missingFields);
    }

    /**
     * Names of the request fields that were absent, in request order.
     */
    public List<String> getMissingFields() {
        return missingFields;
    }
}
