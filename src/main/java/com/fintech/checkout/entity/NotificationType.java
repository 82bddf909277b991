package com.fintech.checkout.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    ORDER,
    PAYMENT,
    SYSTEM;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
