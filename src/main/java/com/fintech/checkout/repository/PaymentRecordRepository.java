package com.fintech.checkout.repository;

import com.fintech.checkout.entity.PaymentRecord;
import com.fintech.checkout.entity.PaymentStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * Repository for payment attempts.
 */
@Repository
public interface PaymentRecordRepository extends JpaRepository<PaymentRecord, Long> {

    /**
     * Lookup by the globally unique Razorpay order id.
     */
    Optional<PaymentRecord> findByRazorpayOrderId(String razorpayOrderId);

    /**
     * Lookup by captured payment id. Refund webhooks only carry this identifier.
     */
    Optional<PaymentRecord> findFirstByRazorpayPaymentId(String razorpayPaymentId);

    /**
     * Most recent attempt for an order; initiation updates it in place.
     */
    Optional<PaymentRecord> findFirstByOrderIdOrderByCreatedAtDesc(String orderId);

    Page<PaymentRecord> findByStatus(PaymentStatus status, Pageable pageable);

    /**
     * Admin search. A record matches when its Razorpay order id is LIKE {@code pattern}
     * (lower-case, {@code !} as escape) or its order id is one of {@code orderIds}.
     * {@code to} is exclusive; a null status matches every status.
     */
    @Query("SELECT p FROM PaymentRecord p WHERE (:status IS NULL OR p.status = :status) " +
            "AND p.createdAt >= :from AND p.createdAt < :to " +
            "AND (LOWER(p.razorpayOrderId) LIKE :pattern ESCAPE '!' OR p.orderId IN :orderIds)")
    Page<PaymentRecord> search(
            @Param("status") PaymentStatus status,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to,
            @Param("pattern") String pattern,
            @Param("orderIds") Collection<String> orderIds,
            Pageable pageable
    );

    /**
     * Count payment attempts by status for the admin dashboard.
     */
    long countByStatus(PaymentStatus status);
}
