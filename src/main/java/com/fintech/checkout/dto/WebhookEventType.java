package com.fintech.checkout.dto;

import java.util.Arrays;
import java.util.Optional;

/**
 * Razorpay webhook events this service acts on.
 */
public enum WebhookEventType {
    PAYMENT_CAPTURED("payment.captured"),
    PAYMENT_FAILED("payment.failed"),
    REFUND_CREATED("refund.created");

    private final String eventName;

    WebhookEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    public static Optional<WebhookEventType> fromEventName(String eventName) {
        return Arrays.stream(values())
                .filter(type -> type.eventName.equals(eventName))
                .findFirst();
    }
}
