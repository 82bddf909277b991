package com.fintech.checkout.entity;

/**
 * Fulfillment status of a storefront order.
 */
public enum OrderStatus {
    /**
     * Order placed, payment not yet confirmed.
     */
    PENDING,

    /**
     * Payment confirmed, order ready for fulfillment.
     */
    CONFIRMED,

    /**
     * Order handed over to the customer.
     */
    DELIVERED,

    /**
     * Order cancelled by the customer or an admin.
     */
    CANCELLED;

    public boolean canTransitionTo(OrderStatus target) {
        return switch (this) {
            case PENDING -> target == CONFIRMED || target == CANCELLED;
            case CONFIRMED -> target == DELIVERED || target == CANCELLED;
            case DELIVERED, CANCELLED -> false;
        };
    }
}
