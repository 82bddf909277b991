package com.fintech.checkout.event;

import com.fintech.checkout.entity.NotificationType;
import lombok.Value;

import java.util.Map;

/**
 * An admin notification raised inside a business transaction, stored once that transaction commits.
 */
@Value
public class NotificationEvent {
    NotificationType type;
    String message;
    Map<String, Object> data;
}
