package com.fintech.checkout.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.checkout.dto.GatewayPayment;
import com.fintech.checkout.dto.ReconciliationOutcome;
import com.fintech.checkout.dto.WebhookEventType;
import com.fintech.checkout.exception.InvalidSignatureException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Authenticates Razorpay webhook deliveries and hands them to {@link PaymentReconciliationService}.
 * <p>
 * Razorpay redelivers anything that is not acknowledged with a 2xx, so once the
 * signature checks out every delivery is acknowledged, including ones that fail to apply.
 */
@Service
@Slf4j
public class RazorpayWebhookService {

    private final RazorpaySignatureVerifier signatureVerifier;
    private final PaymentReconciliationService reconciliationService;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private Counter rejectedCounter;
    private Counter failedCounter;

    public RazorpayWebhookService(RazorpaySignatureVerifier signatureVerifier,
                                  PaymentReconciliationService reconciliationService,
                                  ObjectMapper objectMapper,
                                  MeterRegistry meterRegistry) {
        this.signatureVerifier = signatureVerifier;
        this.reconciliationService = reconciliationService;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        rejectedCounter = Counter.builder("payments.webhooks.rejected")
                .description("Webhook deliveries rejected for a bad signature")
                .register(meterRegistry);

        failedCounter = Counter.builder("payments.webhooks.failed")
                .description("Authenticated webhook deliveries that could not be applied")
                .register(meterRegistry);
    }

    /**
     * @param rawBody   request body exactly as received
     * @param signature value of the {@code x-razorpay-signature} header, may be null
     * @return how the event was applied, empty when it was not processed at all
     * @throws InvalidSignatureException if the signature is missing or does not match
     */
    public Optional<ReconciliationOutcome> handle(byte[] rawBody, String signature) {
        if (!signatureVerifier.isValidWebhookSignature(rawBody, signature)) {
            rejectedCounter.increment();
            log.error("SECURITY: webhook signature verification failed ({} bytes, header {})",
                    rawBody == null ? 0 : rawBody.length, signature == null ? "absent" : "present");
            throw new InvalidSignatureException("Invalid signature");
        }

        JsonNode event;
        try {
            event = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            failedCounter.increment();
            log.error("Webhook body is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }

        String eventName = event.path("event").asText(null);
        Optional<WebhookEventType> type = WebhookEventType.fromEventName(eventName);
        if (type.isEmpty()) {
            log.info("Ignoring webhook event '{}'", eventName);
            return Optional.empty();
        }

        try {
            ReconciliationOutcome outcome = dispatch(type.get(), event.path("payload"));
            log.info("Webhook {} processed: {}", eventName, outcome);
            meterRegistry.counter("payments.webhooks.processed",
                    "event", type.get().getEventName(), "outcome", outcome.name().toLowerCase()).increment();
            return Optional.of(outcome);
        } catch (RuntimeException e) {
            failedCounter.increment();
            log.error("Error processing webhook {}: {}", eventName, e.getMessage(), e);
            return Optional.empty();
        }
    }

    private ReconciliationOutcome dispatch(WebhookEventType type, JsonNode payload) {
        return switch (type) {
            case PAYMENT_CAPTURED -> reconciliationService.applyPaymentCaptured(
                    new GatewayPayment(requireEntity(payload, "payment")));
            case PAYMENT_FAILED -> reconciliationService.applyPaymentFailed(
                    new GatewayPayment(requireEntity(payload, "payment")));
            case REFUND_CREATED -> reconciliationService.applyRefundCreated(
                    requireEntity(payload, "refund"));
        };
    }

    private static JsonNode requireEntity(JsonNode payload, String name) {
        JsonNode entity = payload.path(name).path("entity");
        if (!entity.isObject()) {
            throw new IllegalArgumentException("Webhook payload has no " + name + ".entity");
        }
        return entity;
    }
}
