package com.fintech.checkout.repository;

import com.fintech.checkout.entity.Order;
import com.fintech.checkout.entity.OrderStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    /**
     * Find the order whose payment sub-record points at the given Razorpay order.
     * Used by webhook handlers, which only know the gateway identifiers.
     */
    Optional<Order> findByPaymentRazorpayOrderId(String razorpayOrderId);

    boolean existsByOrderNumber(String orderNumber);

    Page<Order> findByStatus(OrderStatus status, Pageable pageable);

    /**
     * Orders whose number contains the fragment; feeds the admin payment search.
     */
    List<Order> findByOrderNumberContainingIgnoreCase(String fragment);
}
