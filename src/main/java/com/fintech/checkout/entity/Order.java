package com.fintech.checkout.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A storefront order.
 * <p>
 * Line prices are captured when the order is placed; the embedded {@link OrderPayment}
 * is maintained by the payment reconciliation flow.
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_order_number", columnList = "order_number", unique = true),
        @Index(name = "idx_orders_razorpay_order_id", columnList = "payment_razorpay_order_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "order_number", nullable = false, length = 40)
    private String orderNumber;

    @Column(name = "user_id", length = 64)
    private String userId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_items", joinColumns = @JoinColumn(name = "order_id"))
    @Builder.Default
    private List<OrderLineItem> items = new ArrayList<>();

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal tax;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal total;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Embedded
    private OrderPayment payment;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (status == null) {
            status = OrderStatus.PENDING;
        }
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Returns the payment sub-record, creating an empty one if none was stored.
     * Hibernate loads an embeddable whose columns are all null as {@code null}.
     */
    public OrderPayment ensurePayment() {
        if (payment == null) {
            payment = new OrderPayment();
        }
        return payment;
    }

    /**
     * Recomputes subtotal from the line items and total as subtotal + tax.
     */
    public void recalculateTotals() {
        BigDecimal sum = BigDecimal.ZERO;
        for (OrderLineItem item : items) {
            sum = sum.add(item.lineTotal());
        }
        this.subtotal = sum;
        if (this.tax == null) {
            this.tax = BigDecimal.ZERO;
        }
        this.total = subtotal.add(tax);
    }
}
