package com.fintech.checkout.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.checkout.config.RazorpayProperties;
import com.fintech.checkout.dto.CreateGatewayOrderRequest;
import com.fintech.checkout.dto.GatewayOrder;
import com.fintech.checkout.dto.GatewayOrderResponse;
import com.fintech.checkout.dto.GatewayPayment;
import com.fintech.checkout.dto.PaymentStats;
import com.fintech.checkout.dto.ReconciliationOutcome;
import com.fintech.checkout.dto.VerificationResult;
import com.fintech.checkout.dto.VerifyPaymentRequest;
import com.fintech.checkout.entity.NotificationType;
import com.fintech.checkout.entity.Order;
import com.fintech.checkout.entity.OrderPayment;
import com.fintech.checkout.entity.OrderStatus;
import com.fintech.checkout.entity.PaymentDetail;
import com.fintech.checkout.entity.PaymentMethod;
import com.fintech.checkout.entity.PaymentRecord;
import com.fintech.checkout.entity.PaymentStatus;
import com.fintech.checkout.exception.GatewayException;
import com.fintech.checkout.exception.InvalidPaymentRequestException;
import com.fintech.checkout.exception.InvalidSignatureException;
import com.fintech.checkout.exception.OrderNotFoundException;
import com.fintech.checkout.exception.PaymentNotFoundException;
import com.fintech.checkout.exception.PaymentStateException;
import com.fintech.checkout.repository.OrderRepository;
import com.fintech.checkout.repository.PaymentRecordRepository;
import com.fintech.checkout.util.MoneyUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keeps orders and payment records in step with the Razorpay gateway.
 * <p>
 * Key Design Decisions:
 * 1. The gateway is the source of truth: verification re-fetches the payment instead of
 *    trusting the storefront's view of it
 * 2. Idempotency: re-applying a state a record already has is a no-op, so webhook
 *    redeliveries and verification retries are harmless
 * 3. Terminal states are guarded by {@link PaymentStatus#canTransitionTo}; a refunded
 *    payment never goes back to completed
 * 4. Concurrency: records carry a version; a verification racing a webhook for the
 *    same payment loses the version check, is retried and then sees the completed record
 */
@Service
@Slf4j
public class PaymentReconciliationService {

    private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Z]{3}$");

    private final PaymentRecordRepository paymentRecordRepository;
    private final OrderRepository orderRepository;
    private final PaymentGatewayClient gatewayClient;
    private final RazorpaySignatureVerifier signatureVerifier;
    private final PaymentMethodResolver methodResolver;
    private final NotificationService notificationService;
    private final RazorpayProperties razorpayProperties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    // Metrics
    private Counter initiationCounter;
    private Counter verificationCounter;
    private Counter invalidSignatureCounter;

    public PaymentReconciliationService(PaymentRecordRepository paymentRecordRepository,
                                        OrderRepository orderRepository,
                                        PaymentGatewayClient gatewayClient,
                                        RazorpaySignatureVerifier signatureVerifier,
                                        PaymentMethodResolver methodResolver,
                                        NotificationService notificationService,
                                        RazorpayProperties razorpayProperties,
                                        ObjectMapper objectMapper,
                                        MeterRegistry meterRegistry) {
        this.paymentRecordRepository = paymentRecordRepository;
        this.orderRepository = orderRepository;
        this.gatewayClient = gatewayClient;
        this.signatureVerifier = signatureVerifier;
        this.methodResolver = methodResolver;
        this.notificationService = notificationService;
        this.razorpayProperties = razorpayProperties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        initiationCounter = Counter.builder("payments.gateway_orders.created")
                .description("Gateway orders opened for storefront orders")
                .register(meterRegistry);

        verificationCounter = Counter.builder("payments.verifications.success")
                .description("Checkout callbacks verified and applied")
                .register(meterRegistry);

        invalidSignatureCounter = Counter.builder("payments.verifications.invalid_signature")
                .description("Checkout callbacks rejected for a bad signature")
                .register(meterRegistry);
    }

    /**
     * Opens a Razorpay order for a stored order and records the pending attempt.
     * <p>
     * Nothing is written if the gateway call fails.
     */
    @Transactional
    public GatewayOrderResponse createGatewayOrder(CreateGatewayOrderRequest request) {
        List<String> missing = new ArrayList<>();
        if (request.getAmount() == null) {
            missing.add("amount");
        }
        if (!StringUtils.hasText(request.getOrderId())) {
            missing.add("orderId");
        }
        if (!missing.isEmpty()) {
            throw new InvalidPaymentRequestException("Missing required fields: " + String.join(", ", missing), missing);
        }
        if (request.getAmount().signum() <= 0) {
            throw new InvalidPaymentRequestException("Invalid amount: must be a positive number");
        }

        String currency = StringUtils.hasText(request.getCurrency())
                ? request.getCurrency().trim().toUpperCase()
                : razorpayProperties.getDefaultCurrency();
        if (!CURRENCY_CODE.matcher(currency).matches()) {
            throw new InvalidPaymentRequestException("Invalid currency: must be a 3-letter ISO 4217 code");
        }
        Optional<PaymentMethod> requestedMethod = PaymentMethod.fromValue(request.getPaymentMethod());
        long amountMinor;
        try {
            amountMinor = MoneyUtils.toMinorUnits(request.getAmount());
        } catch (ArithmeticException e) {
            throw new InvalidPaymentRequestException("Invalid amount: too large");
        }

        Order order = orderRepository.findById(request.getOrderId())
                .orElseThrow(() -> new OrderNotFoundException(request.getOrderId()));
        if (request.getAmount().compareTo(order.getTotal()) != 0) {
            log.warn("Rejected initiation for order {}: amount {} does not match total {}",
                    order.getId(), request.getAmount(), order.getTotal());
            throw new InvalidPaymentRequestException("Payment amount does not match order total");
        }
        Optional<PaymentRecord> existing = paymentRecordRepository
                .findFirstByOrderIdOrderByCreatedAtDesc(order.getId());
        existing.ifPresent(record -> requireTransition(record, PaymentStatus.PENDING));

        log.info("Creating gateway order for order {}: {} {} ({} minor units)",
                order.getId(), request.getAmount(), currency, amountMinor);
        GatewayOrder gatewayOrder;
        try {
            gatewayOrder = gatewayClient.createOrder(amountMinor, currency, order.getId());
        } catch (GatewayException e) {
            log.error("Gateway order creation failed for order {}: {}", order.getId(), e.getMessage());
            String description = e.getGatewayDescription() != null ? e.getGatewayDescription() : e.getMessage();
            throw new GatewayException("Payment initiation failed", e.getGatewayName(), description, e.isRetryable());
        }

        PaymentRecord record;
        if (existing.isPresent()) {
            record = existing.get();
            log.info("Re-initiating payment {} for order {}: gateway order {} replaces {}",
                    record.getId(), order.getId(), gatewayOrder.getId(), record.getRazorpayOrderId());
            record.setRazorpayOrderId(gatewayOrder.getId());
            record.setAmount(request.getAmount());
            record.setCurrency(currency);
            record.setStatus(PaymentStatus.PENDING);
            record.setErrorDescription(null);
            requestedMethod.ifPresent(record::setPaymentMethod);
        } else {
            record = PaymentRecord.builder()
                    .orderId(order.getId())
                    .userId(order.getUserId())
                    .razorpayOrderId(gatewayOrder.getId())
                    .amount(request.getAmount())
                    .currency(currency)
                    .status(PaymentStatus.PENDING)
                    .paymentMethod(requestedMethod.orElse(PaymentMethod.CARD))
                    .build();
        }
        record = paymentRecordRepository.save(record);

        OrderPayment payment = order.ensurePayment();
        payment.setMethod(OrderPayment.GATEWAY_METHOD);
        payment.setStatus(PaymentStatus.PENDING);
        payment.setRazorpayOrderId(gatewayOrder.getId());
        payment.setAmount(request.getAmount());
        orderRepository.save(order);

        initiationCounter.increment();

        return GatewayOrderResponse.builder()
                .orderId(gatewayOrder.getId())
                .amount(gatewayOrder.getAmount())
                .currency(gatewayOrder.getCurrency())
                .paymentMethod(requestedMethod.orElse(record.getPaymentMethod()))
                .build();
    }

    /**
     * Verifies a checkout callback and marks the payment and order as paid.
     * <p>
     * Calling this again for an already completed payment re-checks the signature and
     * succeeds without changing anything of substance.
     */
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50)
    )
    @Transactional
    public VerificationResult verifyPayment(VerifyPaymentRequest request) {
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(request.getRazorpayOrderId())) {
            missing.add("razorpay_order_id");
        }
        if (!StringUtils.hasText(request.getRazorpayPaymentId())) {
            missing.add("razorpay_payment_id");
        }
        if (!StringUtils.hasText(request.getRazorpaySignature())) {
            missing.add("razorpay_signature");
        }
        if (!StringUtils.hasText(request.getOrderId())) {
            missing.add("order_id");
        }
        if (!missing.isEmpty()) {
            log.warn("Payment verification rejected, missing fields: {}", missing);
            throw new InvalidPaymentRequestException("Missing required payment verification fields", missing);
        }

        if (!signatureVerifier.isValidPaymentSignature(request.getRazorpayOrderId(),
                request.getRazorpayPaymentId(), request.getRazorpaySignature())) {
            invalidSignatureCounter.increment();
            log.error("SECURITY: invalid payment signature for Razorpay order {} / payment {} (order {})",
                    request.getRazorpayOrderId(), request.getRazorpayPaymentId(), request.getOrderId());
            throw new InvalidSignatureException("Invalid payment signature");
        }

        GatewayPayment gatewayPayment = gatewayClient.fetchPayment(request.getRazorpayPaymentId());
        PaymentMethod method = methodResolver.resolve(gatewayPayment.getMethod(), request.getPaymentMethod());
        PaymentDetail detail = methodResolver.extractDetail(method, gatewayPayment.getEntity());
        log.debug("Gateway reports method '{}' for payment {}, resolved to {}",
                gatewayPayment.getMethod(), gatewayPayment.getId(), method);

        PaymentRecord record = paymentRecordRepository.findByRazorpayOrderId(request.getRazorpayOrderId())
                .orElseThrow(() -> new PaymentNotFoundException(request.getRazorpayOrderId()));
        Order order = orderRepository.findById(request.getOrderId())
                .orElseThrow(() -> new OrderNotFoundException(request.getOrderId()));

        if (!record.getOrderId().equals(order.getId())) {
            throw new InvalidPaymentRequestException("Razorpay order " + record.getRazorpayOrderId()
                    + " does not belong to order " + order.getId());
        }
        boolean alreadyCompleted = record.getStatus() == PaymentStatus.COMPLETED;
        if (alreadyCompleted && !request.getRazorpayPaymentId().equals(record.getRazorpayPaymentId())) {
            throw new PaymentStateException("Payment for Razorpay order " + record.getRazorpayOrderId()
                    + " was already completed by another payment",
                    record.getStatus().value(), PaymentStatus.COMPLETED.value());
        }
        requireTransition(record, PaymentStatus.COMPLETED);
        if (record.getAmount().compareTo(order.getTotal()) != 0
                || gatewayPayment.getAmount() != MoneyUtils.toMinorUnits(order.getTotal())) {
            log.warn("Payment {} amount (record {}, gateway {} minor) does not match order {} total {}",
                    request.getRazorpayPaymentId(), record.getAmount(), gatewayPayment.getAmount(),
                    order.getId(), order.getTotal());
            throw new InvalidPaymentRequestException("Payment amount does not match order total");
        }

        record.setRazorpayPaymentId(request.getRazorpayPaymentId());
        record.setRazorpaySignature(request.getRazorpaySignature());
        record.setStatus(PaymentStatus.COMPLETED);
        record.setPaymentMethod(method);
        record.setPaymentDetail(detail);
        record.setGatewayPayload(toJson(gatewayPayment.getEntity()));
        record.setErrorDescription(null);
        record = paymentRecordRepository.save(record);

        OrderPayment payment = order.ensurePayment();
        payment.setMethod(OrderPayment.GATEWAY_METHOD);
        payment.setStatus(PaymentStatus.COMPLETED);
        payment.setRazorpayOrderId(record.getRazorpayOrderId());
        payment.setRazorpayPaymentId(request.getRazorpayPaymentId());
        payment.setRazorpaySignature(request.getRazorpaySignature());
        payment.setPaymentMethod(method);
        payment.setAmount(record.getAmount());
        payment.setDetails(record.getGatewayPayload());
        payment.setError(null);
        confirmIfPending(order);
        orderRepository.save(order);

        verificationCounter.increment();
        log.info("Payment {} verified for order {} via {}{}", request.getRazorpayPaymentId(), order.getId(),
                method.value(), alreadyCompleted ? " (already completed)" : "");

        return VerificationResult.builder()
                .payment(record)
                .resolvedMethod(method)
                .alreadyCompleted(alreadyCompleted)
                .build();
    }

    /**
     * Applies a {@code payment.captured} webhook.
     * Unknown gateway orders are logged and skipped.
     */
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50)
    )
    @Transactional
    public ReconciliationOutcome applyPaymentCaptured(GatewayPayment captured) {
        Optional<Order> maybeOrder = orderRepository.findByPaymentRazorpayOrderId(captured.getOrderId());
        if (maybeOrder.isEmpty()) {
            log.warn("payment.captured for unknown Razorpay order {} (payment {})",
                    captured.getOrderId(), captured.getId());
            return ReconciliationOutcome.UNMATCHED;
        }
        Order order = maybeOrder.get();
        Optional<PaymentRecord> maybeRecord = paymentRecordRepository.findByRazorpayOrderId(captured.getOrderId());

        PaymentMethod hint = maybeRecord.map(PaymentRecord::getPaymentMethod)
                .orElse(order.ensurePayment().getPaymentMethod());
        PaymentMethod method = methodResolver.resolve(captured.getMethod(), hint == null ? null : hint.value());
        String payload = toJson(captured.getEntity());

        if (maybeRecord.isPresent()) {
            PaymentRecord record = maybeRecord.get();
            if (record.getStatus() == PaymentStatus.COMPLETED) {
                if (!Objects.equals(record.getRazorpayPaymentId(), captured.getId())) {
                    log.warn("Razorpay order {} already completed by payment {}; ignoring capture of {}",
                            captured.getOrderId(), record.getRazorpayPaymentId(), captured.getId());
                    return ReconciliationOutcome.IGNORED;
                }
                log.info("Payment {} already completed, capture is a redelivery", captured.getId());
                return ReconciliationOutcome.DUPLICATE;
            }
            if (!record.getStatus().canTransitionTo(PaymentStatus.COMPLETED)) {
                log.warn("Ignoring capture of {}: payment record {} is {}",
                        captured.getId(), record.getId(), record.getStatus());
                return ReconciliationOutcome.IGNORED;
            }
        }
        if (!capturedAmountMatches(order, maybeRecord.orElse(null), captured)) {
            return ReconciliationOutcome.IGNORED;
        }

        if (maybeRecord.isPresent()) {
            PaymentRecord record = maybeRecord.get();
            record.setStatus(PaymentStatus.COMPLETED);
            record.setRazorpayPaymentId(captured.getId());
            record.setPaymentMethod(method);
            record.setPaymentDetail(methodResolver.extractDetail(method, captured.getEntity()));
            record.setGatewayPayload(payload);
            record.setErrorDescription(null);
            paymentRecordRepository.save(record);
        } else {
            log.warn("No payment record for Razorpay order {}, updating order {} only",
                    captured.getOrderId(), order.getId());
        }

        OrderPayment payment = order.ensurePayment();
        payment.setStatus(PaymentStatus.COMPLETED);
        payment.setRazorpayPaymentId(captured.getId());
        payment.setPaymentMethod(method);
        payment.setDetails(payload);
        payment.setError(null);
        confirmIfPending(order);
        orderRepository.save(order);

        log.info("Payment {} captured for order {}", captured.getId(), order.getId());
        notifyPayment(order, captured.getId(), captured.getAmount(), currencyOf(captured), "success", null,
                "Payment of %s received for order #%s");
        return ReconciliationOutcome.APPLIED;
    }

    private boolean capturedAmountMatches(Order order, PaymentRecord record, GatewayPayment captured) {
        long expectedMinor = MoneyUtils.toMinorUnits(order.getTotal());
        boolean recordMatches = record == null || record.getAmount().compareTo(order.getTotal()) == 0;
        if (recordMatches && captured.getAmount() == expectedMinor) {
            return true;
        }
        log.error("Ignoring capture of {} for order {}: captured {} minor, recorded {}, order total {}",
                captured.getId(), order.getId(), captured.getAmount(),
                record == null ? "n/a" : record.getAmount(), order.getTotal());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("orderId", order.getId());
        data.put("paymentId", captured.getId());
        data.put("capturedAmount", MoneyUtils.fromMinorUnits(captured.getAmount()));
        data.put("orderTotal", order.getTotal());
        notificationService.publish(NotificationType.SYSTEM,
                String.format("Captured amount for order #%s does not match its total", order.getOrderNumber()),
                data);
        return false;
    }

    /**
     * Applies a {@code payment.failed} webhook.
     * A completed or refunded payment is never demoted by a late failure of another attempt.
     */
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50)
    )
    @Transactional
    public ReconciliationOutcome applyPaymentFailed(GatewayPayment failed) {
        Optional<Order> maybeOrder = orderRepository.findByPaymentRazorpayOrderId(failed.getOrderId());
        if (maybeOrder.isEmpty()) {
            log.warn("payment.failed for unknown Razorpay order {} (payment {})", failed.getOrderId(), failed.getId());
            return ReconciliationOutcome.UNMATCHED;
        }
        Order order = maybeOrder.get();
        String error = failed.getErrorDescription();
        Optional<PaymentRecord> maybeRecord = paymentRecordRepository.findByRazorpayOrderId(failed.getOrderId());

        if (maybeRecord.isPresent()) {
            PaymentRecord record = maybeRecord.get();
            if (record.getStatus() == PaymentStatus.FAILED && Objects.equals(record.getErrorDescription(), error)) {
                log.info("Payment {} already failed, event is a redelivery", failed.getId());
                return ReconciliationOutcome.DUPLICATE;
            }
            if (!record.getStatus().canTransitionTo(PaymentStatus.FAILED)) {
                log.warn("Not marking payment record {} as failed: it is {} (failed attempt {})",
                        record.getId(), record.getStatus(), failed.getId());
                return ReconciliationOutcome.IGNORED;
            }
            record.setStatus(PaymentStatus.FAILED);
            record.setErrorDescription(truncate(error, 500));
            record.setGatewayPayload(toJson(failed.getEntity()));
            paymentRecordRepository.save(record);
        }

        OrderPayment payment = order.ensurePayment();
        if (payment.getStatus() == PaymentStatus.COMPLETED || payment.getStatus() == PaymentStatus.REFUNDED) {
            log.warn("Order {} payment is {}, not marking it failed", order.getId(), payment.getStatus());
            return ReconciliationOutcome.IGNORED;
        }
        payment.setStatus(PaymentStatus.FAILED);
        payment.setError(truncate(error, 500));
        orderRepository.save(order);

        log.info("Payment {} failed for order {}: {}", failed.getId(), order.getId(), error);
        notifyPayment(order, failed.getId(), failed.getAmount(), currencyOf(failed), "failed", error,
                "Payment of %s failed for order #%s");
        return ReconciliationOutcome.APPLIED;
    }

    /**
     * Applies a {@code refund.created} webhook. Refunded is final.
     */
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 50)
    )
    @Transactional
    public ReconciliationOutcome applyRefundCreated(JsonNode refund) {
        String paymentId = refund.path("payment_id").asText(null);
        String refundId = refund.path("id").asText(null);
        long amountMinor = refund.path("amount").asLong(0L);

        Optional<PaymentRecord> maybeRecord = paymentId == null
                ? Optional.empty()
                : paymentRecordRepository.findFirstByRazorpayPaymentId(paymentId);
        if (maybeRecord.isEmpty()) {
            log.warn("refund.created {} for unknown payment {}", refundId, paymentId);
            return ReconciliationOutcome.UNMATCHED;
        }
        PaymentRecord record = maybeRecord.get();
        Optional<Order> maybeOrder = orderRepository.findById(record.getOrderId());
        if (maybeOrder.isEmpty()) {
            log.warn("refund.created {}: order {} of payment {} not found", refundId, record.getOrderId(), paymentId);
            return ReconciliationOutcome.UNMATCHED;
        }
        Order order = maybeOrder.get();

        if (record.getStatus() == PaymentStatus.REFUNDED) {
            log.info("Payment {} already refunded, refund {} is a redelivery", paymentId, refundId);
            return ReconciliationOutcome.DUPLICATE;
        }
        if (!record.getStatus().canTransitionTo(PaymentStatus.REFUNDED)) {
            log.warn("Ignoring refund {}: payment record {} is {}", refundId, record.getId(), record.getStatus());
            return ReconciliationOutcome.IGNORED;
        }
        record.setStatus(PaymentStatus.REFUNDED);
        record.setRefundDetails(toJson(refund));
        paymentRecordRepository.save(record);

        order.ensurePayment().setStatus(PaymentStatus.REFUNDED);
        orderRepository.save(order);

        log.info("Payment {} refunded for order {} (refund {})", paymentId, order.getId(), refundId);
        String currency = refund.path("currency").asText(record.getCurrency());
        notifyPayment(order, paymentId, amountMinor, currency, "refunded", null,
                "Refund of %s processed for order #%s");
        return ReconciliationOutcome.APPLIED;
    }

    /**
     * Get payment counts per status.
     */
    public PaymentStats getStats() {
        return PaymentStats.builder()
                .pendingCount(paymentRecordRepository.countByStatus(PaymentStatus.PENDING))
                .completedCount(paymentRecordRepository.countByStatus(PaymentStatus.COMPLETED))
                .failedCount(paymentRecordRepository.countByStatus(PaymentStatus.FAILED))
                .refundedCount(paymentRecordRepository.countByStatus(PaymentStatus.REFUNDED))
                .build();
    }

    private void requireTransition(PaymentRecord record, PaymentStatus target) {
        if (!record.getStatus().canTransitionTo(target)) {
            log.warn("Rejected transition of payment record {} from {} to {}",
                    record.getId(), record.getStatus(), target);
            throw new PaymentStateException("Payment for Razorpay order " + record.getRazorpayOrderId()
                    + " is " + record.getStatus().value() + " and cannot become " + target.value(),
                    record.getStatus().value(), target.value());
        }
    }

    private void confirmIfPending(Order order) {
        if (order.getStatus() == OrderStatus.PENDING) {
            order.setStatus(OrderStatus.CONFIRMED);
        } else if (order.getStatus() == OrderStatus.CANCELLED) {
            log.warn("Payment completed for cancelled order {}; order left cancelled", order.getId());
        }
    }

    private void notifyPayment(Order order, String paymentId, long amountMinor, String currency,
                               String status, String error, String template) {
        BigDecimal amount = MoneyUtils.fromMinorUnits(amountMinor);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("paymentId", paymentId);
        data.put("orderId", order.getId());
        data.put("orderNumber", order.getOrderNumber());
        data.put("amount", amount);
        data.put("status", status);
        if (error != null) {
            data.put("error", error);
        }
        notificationService.publish(NotificationType.PAYMENT,
                String.format(template, formatAmount(amount, currency), order.getOrderNumber()), data);
    }

    private static String formatAmount(BigDecimal amount, String currency) {
        if (currency == null || "INR".equalsIgnoreCase(currency)) {
            return "₹" + amount.toPlainString();
        }
        return currency.toUpperCase() + " " + amount.toPlainString();
    }

    private static String currencyOf(GatewayPayment payment) {
        JsonNode currency = payment.getEntity().get("currency");
        return currency == null || currency.isNull() ? null : currency.asText();
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize gateway entity: {}", e.getMessage());
            return null;
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
