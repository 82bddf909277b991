package com.fintech.checkout.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Instrument the customer paid with.
 */
public enum PaymentMethod {
    CARD,
    UPI,
    NETBANKING,
    WALLET,
    EMI;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    /**
     * Parses one of our own method names. Anything else, including the
     * checkout widget's generic {@code "razorpay"}, yields empty.
     */
    public static Optional<PaymentMethod> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(method -> method.value().equals(normalized))
                .findFirst();
    }
}
