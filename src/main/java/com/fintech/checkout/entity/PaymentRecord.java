package com.fintech.checkout.entity;

import com.fasterxml.jackson.annotation.JsonRawValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One payment attempt for an order, keyed by the Razorpay order id.
 * <p>
 * The razorpay_payment_id is only known after the customer pays, and the
 * signature only after the checkout callback has been verified.
 */
@Entity
@Table(name = "payment_records", indexes = {
        @Index(name = "idx_payment_razorpay_order_id", columnList = "razorpay_order_id", unique = true),
        @Index(name = "idx_payment_razorpay_payment_id", columnList = "razorpay_payment_id"),
        @Index(name = "idx_payment_order_id", columnList = "order_id"),
        @Index(name = "idx_payment_status_created_at", columnList = "status, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "razorpay_order_id", nullable = false, unique = true, length = 100)
    private String razorpayOrderId;

    @Column(name = "razorpay_payment_id", length = 100)
    private String razorpayPaymentId;

    @Column(name = "razorpay_signature", length = 200)
    private String razorpaySignature;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Convert(converter = PaymentDetailConverter.class)
    @Column(name = "payment_detail", length = 1000)
    private PaymentDetail paymentDetail;

    /**
     * Payment entity exactly as last reported by the gateway.
     */
    @JsonRawValue
    @Column(name = "gateway_payload", length = 10000)
    private String gatewayPayload;

    @JsonRawValue
    @Column(name = "refund_details", length = 4000)
    private String refundDetails;

    @Column(name = "error_description", length = 500)
    private String errorDescription;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
