package com.fintech.checkout.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.checkout.dto.GatewayOrder;
import com.fintech.checkout.dto.GatewayPayment;
import com.fintech.checkout.exception.GatewayException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.Map;

/**
 * Razorpay REST API client.
 * <p>
 * Order creation is not retried: a timed-out create may still have succeeded at
 * Razorpay and a second call would open a second gateway order. Payment fetches are
 * read-only and retried on transient failures.
 */
@Service
@ConditionalOnProperty(name = "razorpay.client", havingValue = "live", matchIfMissing = true)
@Slf4j
public class RazorpayGatewayClient implements PaymentGatewayClient {

    private static final String GATEWAY_NAME = "Razorpay";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public RazorpayGatewayClient(RestClient razorpayRestClient, ObjectMapper objectMapper) {
        this.restClient = razorpayRestClient;
        this.objectMapper = objectMapper;
    }

    @Override
    @CircuitBreaker(name = "razorpayApi", fallbackMethod = "createOrderFallback")
    public GatewayOrder createOrder(long amountMinor, String currency, String receipt) {
        log.debug("Creating Razorpay order: amount={} {}, receipt={}", amountMinor, currency, receipt);
        try {
            GatewayOrder order = restClient.post()
                    .uri("/orders")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of(
                            "amount", amountMinor,
                            "currency", currency,
                            "receipt", receipt))
                    .retrieve()
                    .body(GatewayOrder.class);
            if (order == null || order.getId() == null) {
                throw new GatewayException("Razorpay returned an empty order", GATEWAY_NAME, null, false);
            }
            log.info("Razorpay order {} created for receipt {}", order.getId(), receipt);
            return order;
        } catch (RestClientResponseException e) {
            throw translate("Razorpay order creation failed", e);
        } catch (ResourceAccessException e) {
            throw new GatewayException("Could not reach Razorpay", GATEWAY_NAME, e);
        }
    }

    @Override
    @CircuitBreaker(name = "razorpayApi", fallbackMethod = "fetchPaymentFallback")
    @Retryable(
            retryFor = GatewayException.class,
            exceptionExpression = "retryable",
            maxAttempts = 3,
            backoff = @Backoff(delay = 500, multiplier = 2)
    )
    public GatewayPayment fetchPayment(String paymentId) {
        log.debug("Fetching Razorpay payment {}", paymentId);
        try {
            JsonNode entity = restClient.get()
                    .uri("/payments/{id}", paymentId)
                    .retrieve()
                    .body(JsonNode.class);
            if (entity == null || !entity.isObject()) {
                throw new GatewayException("Razorpay returned an empty payment", GATEWAY_NAME, null, false);
            }
            return new GatewayPayment(entity);
        } catch (RestClientResponseException e) {
            throw translate("Razorpay payment fetch failed", e);
        } catch (ResourceAccessException e) {
            throw new GatewayException("Could not reach Razorpay", GATEWAY_NAME, e);
        }
    }

    /**
     * Called when the circuit is open or the call failed.
     * Gateway errors pass through unchanged so callers still see the upstream description.
     */
    public GatewayOrder createOrderFallback(long amountMinor, String currency, String receipt, Throwable throwable) {
        throw asGatewayException(throwable);
    }

    public GatewayPayment fetchPaymentFallback(String paymentId, Throwable throwable) {
        throw asGatewayException(throwable);
    }

    @Override
    public String getGatewayName() {
        return GATEWAY_NAME;
    }

    private GatewayException asGatewayException(Throwable throwable) {
        if (throwable instanceof GatewayException gatewayException) {
            return gatewayException;
        }
        log.warn("Razorpay call short-circuited: {}", throwable.getMessage());
        return new GatewayException("Razorpay API is temporarily unavailable", GATEWAY_NAME, throwable);
    }

    /**
     * Razorpay errors look like {@code {"error":{"code":"BAD_REQUEST_ERROR","description":"..."}}}.
     */
    private GatewayException translate(String message, RestClientResponseException e) {
        String description = null;
        try {
            JsonNode body = objectMapper.readTree(e.getResponseBodyAsString());
            JsonNode node = body == null ? null : body.path("error").path("description");
            if (node != null && node.isTextual()) {
                description = node.asText();
            }
        } catch (JsonProcessingException parseError) {
            log.debug("Razorpay error body is not JSON: {}", parseError.getMessage());
        }
        boolean retryable = e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == 429;
        log.warn("{}: HTTP {} {}", message, e.getStatusCode().value(), description);
        return new GatewayException(message, GATEWAY_NAME, description, retryable);
    }
}
