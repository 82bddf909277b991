package com.fintech.checkout.exception;

public class PaymentNotFoundException extends PaymentException {

    public PaymentNotFoundException(String razorpayOrderId) {
        super("Payment not found for Razorpay order " + razorpayOrderId);
    }
}
