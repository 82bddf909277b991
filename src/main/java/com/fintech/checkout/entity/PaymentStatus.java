package com.fintech.checkout.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a payment attempt.
 * <p>
 * Transitions are one-directional except for a failed attempt, which may be
 * re-initiated or captured by a later attempt on the same gateway order.
 */
public enum PaymentStatus {
    /**
     * Gateway order created, waiting for the customer to pay.
     */
    PENDING,

    /**
     * Payment captured and verified.
     */
    COMPLETED,

    /**
     * Gateway reported the payment as failed.
     */
    FAILED,

    /**
     * Captured payment was refunded. Nothing follows this state.
     */
    REFUNDED;

    public boolean canTransitionTo(PaymentStatus target) {
        return switch (this) {
            case PENDING -> target != REFUNDED;
            case COMPLETED -> target == COMPLETED || target == REFUNDED;
            case FAILED -> target == FAILED || target == COMPLETED || target == PENDING;
            case REFUNDED -> target == REFUNDED;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
