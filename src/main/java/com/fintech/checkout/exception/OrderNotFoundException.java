package com.fintech.checkout.exception;

public class OrderNotFoundException extends PaymentException {

    public OrderNotFoundException(String orderId) {
        super("Order not found: " + orderId);
    }
}
