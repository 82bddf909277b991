package com.fintech.checkout.entity;

import com.fasterxml.jackson.annotation.JsonRawValue;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Payment summary embedded in the order.
 * Mirrors the owning {@link PaymentRecord} so order views need no join.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderPayment {

    public static final String GATEWAY_METHOD = "razorpay";

    /**
     * Collection channel, always {@value #GATEWAY_METHOD} once a gateway order exists.
     */
    @Column(name = "payment_channel", length = 20)
    private String method;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", length = 20)
    private PaymentStatus status;

    @Column(name = "payment_razorpay_order_id", length = 100)
    private String razorpayOrderId;

    @Column(name = "payment_razorpay_payment_id", length = 100)
    private String razorpayPaymentId;

    @Column(name = "payment_razorpay_signature", length = 200)
    private String razorpaySignature;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", length = 20)
    private PaymentMethod paymentMethod;

    @Column(name = "payment_amount", precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "payment_error", length = 500)
    private String error;

    @JsonRawValue
    @Column(name = "payment_details", length = 10000)
    private String details;
}
