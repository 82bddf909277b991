package com.fintech.checkout.service;

import com.fintech.checkout.dto.CreateOrderRequest;
import com.fintech.checkout.entity.NotificationType;
import com.fintech.checkout.entity.Order;
import com.fintech.checkout.entity.OrderLineItem;
import com.fintech.checkout.entity.OrderPayment;
import com.fintech.checkout.entity.OrderStatus;
import com.fintech.checkout.entity.PaymentStatus;
import com.fintech.checkout.exception.OrderNotFoundException;
import com.fintech.checkout.exception.PaymentStateException;
import com.fintech.checkout.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.security.SecureRandom;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Order placement, lookups and fulfillment changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderService {

    private static final DateTimeFormatter ORDER_NUMBER_DATE = DateTimeFormatter.ofPattern("yyMMdd");
    private static final int ORDER_NUMBER_ATTEMPTS = 5;

    private final OrderRepository orderRepository;
    private final NotificationService notificationService;
    private final SecureRandom random = new SecureRandom();

    /**
     * Stores a new pending order. Subtotal and total are computed from the items;
     * whatever the storefront displayed is not trusted.
     */
    @Transactional
    public Order createOrder(CreateOrderRequest request) {
        List<OrderLineItem> items = new ArrayList<>();
        for (CreateOrderRequest.Item item : request.getItems()) {
            items.add(OrderLineItem.builder()
                    .productId(item.getProductId())
                    .name(item.getName())
                    .quantity(item.getQuantity())
                    .unitPrice(item.getUnitPrice().setScale(2, RoundingMode.HALF_UP))
                    .build());
        }
        Order order = Order.builder()
                .orderNumber(nextOrderNumber())
                .userId(request.getUserId())
                .items(items)
                .tax(request.getTax() == null ? BigDecimal.ZERO : request.getTax().setScale(2, RoundingMode.HALF_UP))
                .status(OrderStatus.PENDING)
                .build();
        order.recalculateTotals();

        Order saved = orderRepository.save(order);
        log.info("Order {} ({}) placed with {} items, total {}",
                saved.getId(), saved.getOrderNumber(), items.size(), saved.getTotal());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("orderId", saved.getId());
        data.put("orderNumber", saved.getOrderNumber());
        data.put("amount", saved.getTotal());
        notificationService.publish(NotificationType.ORDER,
                "New order #" + saved.getOrderNumber() + " received", data);
        return saved;
    }

    @Transactional(readOnly = true)
    public Order getOrder(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /**
     * @param status only orders in this status, or all when null
     */
    @Transactional(readOnly = true)
    public Page<Order> listOrders(OrderStatus status, Pageable pageable) {
        return status == null
                ? orderRepository.findAll(pageable)
                : orderRepository.findByStatus(status, pageable);
    }

    /**
     * Moves an order along its fulfillment lifecycle.
     *
     * @throws PaymentStateException if the order cannot move from its current status to {@code target}
     */
    @Transactional
    public Order updateStatus(String orderId, OrderStatus target) {
        Order order = getOrder(orderId);
        if (order.getStatus() == target) {
            return order;
        }
        return changeStatus(order, target, "Order #" + order.getOrderNumber() + " is now "
                + target.name().toLowerCase());
    }

    /**
     * Customer-side cancellation. Only an unpaid pending order can be cancelled this way;
     * cancelling a paid order needs an admin and a refund.
     */
    @Transactional
    public Order cancelOrder(String orderId) {
        Order order = getOrder(orderId);
        if (order.getStatus() == OrderStatus.CANCELLED) {
            return order;
        }
        OrderPayment payment = order.getPayment();
        boolean paid = payment != null && payment.getStatus() == PaymentStatus.COMPLETED;
        if (order.getStatus() != OrderStatus.PENDING || paid) {
            log.warn("Rejected customer cancellation of order {} in status {} (paid: {})",
                    orderId, order.getStatus(), paid);
            throw new PaymentStateException("Order " + order.getOrderNumber() + " can no longer be cancelled",
                    order.getStatus().name().toLowerCase(), OrderStatus.CANCELLED.name().toLowerCase());
        }
        return changeStatus(order, OrderStatus.CANCELLED,
                "Order #" + order.getOrderNumber() + " was cancelled by the customer");
    }

    private Order changeStatus(Order order, OrderStatus target, String message) {
        OrderStatus current = order.getStatus();
        if (!current.canTransitionTo(target)) {
            log.warn("Rejected order {} status change {} -> {}", order.getId(), current, target);
            throw new PaymentStateException("Order " + order.getOrderNumber() + " cannot move from "
                    + current.name().toLowerCase() + " to " + target.name().toLowerCase(),
                    current.name().toLowerCase(), target.name().toLowerCase());
        }

        order.setStatus(target);
        Order saved = orderRepository.save(order);
        log.info("Order {} status changed {} -> {}", saved.getId(), current, target);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("orderId", saved.getId());
        data.put("orderNumber", saved.getOrderNumber());
        data.put("previousStatus", current.name().toLowerCase());
        data.put("status", target.name().toLowerCase());
        notificationService.publish(NotificationType.ORDER, message, data);
        return saved;
    }

    // ORD-yyMMdd-nnnnnn
    private String nextOrderNumber() {
        String prefix = "ORD-" + LocalDate.now().format(ORDER_NUMBER_DATE) + "-";
        for (int attempt = 0; attempt < ORDER_NUMBER_ATTEMPTS; attempt++) {
            String candidate = prefix + String.format("%06d", random.nextInt(1_000_000));
            if (!orderRepository.existsByOrderNumber(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not allocate a unique order number");
    }
}
