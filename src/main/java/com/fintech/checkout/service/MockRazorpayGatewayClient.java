package com.fintech.checkout.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.checkout.dto.GatewayOrder;
import com.fintech.checkout.dto.GatewayPayment;
import com.fintech.checkout.exception.GatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory stand-in for Razorpay.
 * <p>
 * Used by the {@code test} profile and for local runs without gateway credentials.
 * Payments have to be registered with {@link #addPayment} before they can be fetched,
 * mirroring the real flow where the customer pays between order creation and verification.
 */
@Service
@ConditionalOnProperty(name = "razorpay.client", havingValue = "mock")
@Slf4j
public class MockRazorpayGatewayClient implements PaymentGatewayClient {

    private static final String GATEWAY_NAME = "MockRazorpay";
    private static final String ID_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final Map<String, ObjectNode> payments = new ConcurrentHashMap<>();
    private final List<GatewayOrder> createdOrders = new CopyOnWriteArrayList<>();
    private final SecureRandom random = new SecureRandom();
    private final ObjectMapper objectMapper;

    private volatile boolean simulateOutage = false;

    public MockRazorpayGatewayClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public GatewayOrder createOrder(long amountMinor, String currency, String receipt) {
        if (simulateOutage) {
            throw new GatewayException("Simulated Razorpay outage", GATEWAY_NAME);
        }
        if (amountMinor < 100) {
            throw new GatewayException("Razorpay order creation failed", GATEWAY_NAME,
                    "Order amount less than minimum amount allowed", false);
        }
        GatewayOrder order = GatewayOrder.builder()
                .id("order_" + randomId())
                .amount(amountMinor)
                .currency(currency)
                .receipt(receipt)
                .status("created")
                .build();
        createdOrders.add(order);
        log.debug("Mock Razorpay order {} created for receipt {}", order.getId(), receipt);
        return order;
    }

    @Override
    public GatewayPayment fetchPayment(String paymentId) {
        if (simulateOutage) {
            throw new GatewayException("Simulated Razorpay outage", GATEWAY_NAME);
        }
        ObjectNode payment = payments.get(paymentId);
        if (payment == null) {
            throw new GatewayException("Razorpay payment fetch failed", GATEWAY_NAME,
                    "The id provided does not exist", false);
        }
        return new GatewayPayment(payment.deepCopy());
    }

    @Override
    public String getGatewayName() {
        return GATEWAY_NAME;
    }

    // Methods for testing/simulation control

    /**
     * Registers a captured payment against a gateway order.
     *
     * @param attributes extra entity fields, e.g. {@code vpa} or a nested {@code card} map
     * @return the payment entity as the gateway would report it
     */
    public ObjectNode addPayment(String paymentId, String razorpayOrderId, long amountMinor,
                                 String method, Map<String, Object> attributes) {
        ObjectNode payment = objectMapper.createObjectNode();
        payment.put("id", paymentId);
        payment.put("entity", "payment");
        payment.put("order_id", razorpayOrderId);
        payment.put("amount", amountMinor);
        payment.put("currency", "INR");
        payment.put("status", "captured");
        if (method != null) {
            payment.put("method", method);
        }
        attributes.forEach((key, value) -> payment.set(key, objectMapper.valueToTree(value)));
        payments.put(paymentId, payment);
        return payment.deepCopy();
    }

    public List<GatewayOrder> getCreatedOrders() {
        return new ArrayList<>(createdOrders);
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Mock Razorpay outage simulation set to: {}", outage);
    }

    public void clearMockData() {
        payments.clear();
        createdOrders.clear();
    }

    private String randomId() {
        StringBuilder id = new StringBuilder(14);
        for (int i = 0; i < 14; i++) {
            id.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return id.toString();
    }
}
