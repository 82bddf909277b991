package com.fintech.checkout.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A Razorpay payment entity.
 * <p>
 * Kept as a JSON tree because instrument fields differ by method and API version;
 * the typed accessors cover what every payment carries.
 */
public final class GatewayPayment {

    private final JsonNode entity;

    public GatewayPayment(JsonNode entity) {
        this.entity = Objects.requireNonNull(entity, "entity");
    }

    public JsonNode getEntity() {
        return entity;
    }

    public String getId() {
        return text("id");
    }

    public String getOrderId() {
        return text("order_id");
    }

    public String getMethod() {
        return text("method");
    }

    public String getStatus() {
        return text("status");
    }

    public String getErrorDescription() {
        return text("error_description");
    }

    /**
     * Amount in minor units, 0 when absent.
     */
    public long getAmount() {
        JsonNode node = entity.get("amount");
        return node != null && node.canConvertToLong() ? node.asLong() : 0L;
    }

    private String text(String field) {
        JsonNode node = entity.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    @Override
    public String toString() {
        return "GatewayPayment{id=" + getId() + ", orderId=" + getOrderId()
                + ", method=" + getMethod() + ", status=" + getStatus() + "}";
    }
}
