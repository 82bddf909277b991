package com.fintech.checkout.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.checkout.config.RazorpayProperties;
import com.fintech.checkout.dto.CreateGatewayOrderRequest;
import com.fintech.checkout.dto.GatewayOrder;
import com.fintech.checkout.dto.GatewayOrderResponse;
import com.fintech.checkout.dto.GatewayPayment;
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
import com.fintech.checkout.exception.PaymentStateException;
import com.fintech.checkout.repository.OrderRepository;
import com.fintech.checkout.repository.PaymentRecordRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PaymentReconciliationService.
 * <p>
 * Tests cover:
 * - Gateway order initiation and amount conversion
 * - Signature checking and verification
 * - Webhook-driven status changes and their idempotency
 */
@ExtendWith(MockitoExtension.class)
class PaymentReconciliationServiceTest {

    private static final String KEY_SECRET = "unit_key_secret";
    private static final String ORDER_ID = "3f1c2a9e-order";
    private static final String ORDER_NUMBER = "ORD-1001";
    private static final String RZP_ORDER_ID = "order_Nx7Q2mTfY3kLpA";
    private static final String RZP_PAYMENT_ID = "pay_Nx7QkP0s1Vq8Zc";

    @Mock
    private PaymentRecordRepository paymentRecordRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private NotificationService notificationService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private PaymentReconciliationService service;

    @BeforeEach
    void setUp() {
        RazorpayProperties properties = new RazorpayProperties();
        properties.setKeyId("rzp_test_unit");
        properties.setKeySecret(KEY_SECRET);
        properties.setWebhookSecret("unit_webhook_secret");

        service = new PaymentReconciliationService(
                paymentRecordRepository,
                orderRepository,
                gatewayClient,
                new RazorpaySignatureVerifier(properties),
                new PaymentMethodResolver(),
                notificationService,
                properties,
                objectMapper,
                new SimpleMeterRegistry()
        );
        service.initMetrics();
    }

    @Nested
    @DisplayName("Gateway order initiation")
    class InitiationTests {

        @Test
        @DisplayName("Should send 499.00 to the gateway as 49900 paise with the order id as receipt")
        void shouldConvertAmountToMinorUnits() {
            // Given
            Order order = order(OrderStatus.PENDING, null);
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order));
            when(gatewayClient.createOrder(49900L, "INR", ORDER_ID))
                    .thenReturn(gatewayOrder(49900L));
            when(paymentRecordRepository.save(any(PaymentRecord.class)))
                    .thenAnswer(invocation -> invocation.getArgument(0));

            // When
            GatewayOrderResponse response = service.createGatewayOrder(CreateGatewayOrderRequest.builder()
                    .amount(new BigDecimal("499.00"))
                    .orderId(ORDER_ID)
                    .paymentMethod("upi")
                    .build());

            // Then
            assertThat(response.getOrderId()).isEqualTo(RZP_ORDER_ID);
            assertThat(response.getAmount()).isEqualTo(49900L);
            assertThat(response.getCurrency()).isEqualTo("INR");
            assertThat(response.getPaymentMethod()).isEqualTo(PaymentMethod.UPI);

            ArgumentCaptor<PaymentRecord> captor = ArgumentCaptor.forClass(PaymentRecord.class);
            verify(paymentRecordRepository).save(captor.capture());
            PaymentRecord saved = captor.getValue();
            assertThat(saved.getStatus()).isEqualTo(PaymentStatus.PENDING);
            assertThat(saved.getRazorpayOrderId()).isEqualTo(RZP_ORDER_ID);
            assertThat(saved.getOrderId()).isEqualTo(ORDER_ID);
            assertThat(saved.getUserId()).isEqualTo("user-42");

            assertThat(order.getPayment().getMethod()).isEqualTo(OrderPayment.GATEWAY_METHOD);
            assertThat(order.getPayment().getStatus()).isEqualTo(PaymentStatus.PENDING);
            assertThat(order.getPayment().getRazorpayOrderId()).isEqualTo(RZP_ORDER_ID);
        }

        @Test
        @DisplayName("Should name every missing field and not call the gateway")
        void shouldRejectMissingFields() {
            assertThatThrownBy(() -> service.createGatewayOrder(new CreateGatewayOrderRequest()))
                    .isInstanceOf(InvalidPaymentRequestException.class)
                    .satisfies(ex -> assertThat(((InvalidPaymentRequestException) ex).getMissingFields())
                            .containsExactly("amount", "orderId"));

            verifyNoInteractions(gatewayClient, paymentRecordRepository);
        }

        @Test
        @DisplayName("Should reject a zero amount")
        void shouldRejectNonPositiveAmount() {
            assertThatThrownBy(() -> service.createGatewayOrder(CreateGatewayOrderRequest.builder()
                    .amount(BigDecimal.ZERO)
                    .orderId(ORDER_ID)
                    .build()))
                    .isInstanceOf(InvalidPaymentRequestException.class)
                    .hasMessageContaining("positive");

            verifyNoInteractions(gatewayClient);
        }

        @Test
        @DisplayName("Should refuse to re-initiate a completed payment without calling the gateway")
        void shouldRejectInitiationOfCompletedPayment() {
            // Given
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.CONFIRMED, null)));
            when(paymentRecordRepository.findFirstByOrderIdOrderByCreatedAtDesc(ORDER_ID))
                    .thenReturn(Optional.of(record(PaymentStatus.COMPLETED)));

            // When / Then
            assertThatThrownBy(() -> service.createGatewayOrder(CreateGatewayOrderRequest.builder()
                    .amount(new BigDecimal("499.00"))
                    .orderId(ORDER_ID)
                    .build()))
                    .isInstanceOf(PaymentStateException.class);

            verifyNoInteractions(gatewayClient);
            verify(paymentRecordRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should write nothing when the gateway rejects the order")
        void shouldNotWriteWhenGatewayFails() {
            // Given
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.PENDING, null)));
            when(gatewayClient.createOrder(anyLong(), anyString(), anyString()))
                    .thenThrow(new GatewayException("Razorpay order creation failed", "Razorpay",
                            "Authentication failed", false));

            // When / Then
            assertThatThrownBy(() -> service.createGatewayOrder(CreateGatewayOrderRequest.builder()
                    .amount(new BigDecimal("499.00"))
                    .orderId(ORDER_ID)
                    .build()))
                    .isInstanceOf(GatewayException.class)
                    .hasMessage("Payment initiation failed")
                    .satisfies(ex -> assertThat(((GatewayException) ex).getGatewayDescription())
                            .isEqualTo("Authentication failed"));

            verify(paymentRecordRepository, never()).save(any());
            verify(orderRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should reset a failed attempt to pending and keep its method for the generic hint")
        void shouldReinitiateFailedAttempt() {
            // Given
            PaymentRecord failed = record(PaymentStatus.FAILED);
            failed.setPaymentMethod(PaymentMethod.NETBANKING);
            failed.setErrorDescription("Payment was declined");
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.PENDING, null)));
            when(paymentRecordRepository.findFirstByOrderIdOrderByCreatedAtDesc(ORDER_ID))
                    .thenReturn(Optional.of(failed));
            when(gatewayClient.createOrder(49900L, "INR", ORDER_ID)).thenReturn(GatewayOrder.builder()
                    .id("order_SecondAttempt01").amount(49900L).currency("INR").receipt(ORDER_ID).build());
            when(paymentRecordRepository.save(any(PaymentRecord.class)))
                    .thenAnswer(invocation -> invocation.getArgument(0));

            // When
            GatewayOrderResponse response = service.createGatewayOrder(CreateGatewayOrderRequest.builder()
                    .amount(new BigDecimal("499.00"))
                    .orderId(ORDER_ID)
                    .paymentMethod("razorpay")
                    .build());

            // Then
            assertThat(failed.getStatus()).isEqualTo(PaymentStatus.PENDING);
            assertThat(failed.getRazorpayOrderId()).isEqualTo("order_SecondAttempt01");
            assertThat(failed.getPaymentMethod()).isEqualTo(PaymentMethod.NETBANKING);
            assertThat(failed.getErrorDescription()).isNull();
            assertThat(response.getPaymentMethod()).isEqualTo(PaymentMethod.NETBANKING);
        }
        @Test
        @DisplayName("Should reject an amount that differs from the order total before calling the gateway")
        void shouldRejectAmountOtherThanOrderTotal() {
            // Given
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.PENDING, null)));

            // When / Then
            assertThatThrownBy(() -> service.createGatewayOrder(CreateGatewayOrderRequest.builder()
                    .amount(new BigDecimal("100.00"))
                    .orderId(ORDER_ID)
                    .build()))
                    .isInstanceOf(InvalidPaymentRequestException.class)
                    .hasMessage("Payment amount does not match order total");

            verifyNoInteractions(gatewayClient, paymentRecordRepository);
            verify(orderRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should reject a currency that is not a three-letter code")
        void shouldRejectMalformedCurrency() {
            assertThatThrownBy(() -> service.createGatewayOrder(CreateGatewayOrderRequest.builder()
                    .amount(new BigDecimal("499.00"))
                    .currency("RUPEE")
                    .orderId(ORDER_ID)
                    .build()))
                    .isInstanceOf(InvalidPaymentRequestException.class)
                    .hasMessageContaining("currency");

            verifyNoInteractions(gatewayClient, paymentRecordRepository, orderRepository);
        }

        @Test
        @DisplayName("Should reject an amount too large to express in paise")
        void shouldRejectOverflowingAmount() {
            assertThatThrownBy(() -> service.createGatewayOrder(CreateGatewayOrderRequest.builder()
                    .amount(new BigDecimal("1e18"))
                    .orderId(ORDER_ID)
                    .build()))
                    .isInstanceOf(InvalidPaymentRequestException.class)
                    .hasMessage("Invalid amount: too large");

            verifyNoInteractions(gatewayClient, paymentRecordRepository, orderRepository);
        }
    }

    @Nested
    @DisplayName("Checkout callback verification")
    class VerificationTests {

        @Test
        @DisplayName("Should list exactly the missing fields in request order")
        void shouldListMissingFields() {
            VerifyPaymentRequest request = VerifyPaymentRequest.builder()
                    .razorpayPaymentId(RZP_PAYMENT_ID)
                    .build();

            assertThatThrownBy(() -> service.verifyPayment(request))
                    .isInstanceOf(InvalidPaymentRequestException.class)
                    .hasMessage("Missing required payment verification fields")
                    .satisfies(ex -> assertThat(((InvalidPaymentRequestException) ex).getMissingFields())
                            .containsExactly("razorpay_order_id", "razorpay_signature", "order_id"));
        }

        @Test
        @DisplayName("Should reject a tampered signature before touching the gateway or the database")
        void shouldRejectTamperedSignature() {
            // Given
            String genuine = signature(RZP_ORDER_ID, RZP_PAYMENT_ID);
            String tampered = (genuine.charAt(0) == 'a' ? "b" : "a") + genuine.substring(1);

            // When / Then
            assertThatThrownBy(() -> service.verifyPayment(verifyRequest(tampered, "upi")))
                    .isInstanceOf(InvalidSignatureException.class);

            verifyNoInteractions(gatewayClient, paymentRecordRepository, orderRepository, notificationService);
        }

        @Test
        @DisplayName("Should complete the payment with the method reported by the gateway")
        void shouldCompletePaymentWithGatewayMethod() {
            // Given
            PaymentRecord record = record(PaymentStatus.PENDING);
            Order order = order(OrderStatus.PENDING, RZP_ORDER_ID);
            when(gatewayClient.fetchPayment(RZP_PAYMENT_ID)).thenReturn(new GatewayPayment(
                    paymentEntity("upi_intent", Map.of("upi", Map.of("vpa", "asha@okhdfc")))));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order));
            when(paymentRecordRepository.save(any(PaymentRecord.class)))
                    .thenAnswer(invocation -> invocation.getArgument(0));

            // When
            VerificationResult result = service.verifyPayment(
                    verifyRequest(signature(RZP_ORDER_ID, RZP_PAYMENT_ID), "card"));

            // Then
            assertThat(result.getResolvedMethod()).isEqualTo(PaymentMethod.UPI);
            assertThat(result.getMessage()).isEqualTo("Payment successful via upi");
            assertThat(result.isAlreadyCompleted()).isFalse();

            assertThat(record.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(record.getRazorpayPaymentId()).isEqualTo(RZP_PAYMENT_ID);
            assertThat(record.getPaymentDetail()).isEqualTo(new PaymentDetail.Upi("asha@okhdfc"));
            assertThat(record.getGatewayPayload()).contains(RZP_PAYMENT_ID);

            assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(order.getPayment().getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(order.getPayment().getPaymentMethod()).isEqualTo(PaymentMethod.UPI);
            verify(orderRepository).save(order);
        }

        @Test
        @DisplayName("Should succeed again for an already completed payment with the same id")
        void shouldBeIdempotentForSamePayment() {
            // Given
            PaymentRecord record = record(PaymentStatus.COMPLETED);
            record.setRazorpayPaymentId(RZP_PAYMENT_ID);
            Order order = order(OrderStatus.CONFIRMED, RZP_ORDER_ID);
            when(gatewayClient.fetchPayment(RZP_PAYMENT_ID)).thenReturn(new GatewayPayment(
                    paymentEntity("card", Map.of("card", Map.of("last4", "4242", "network", "Visa")))));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order));
            when(paymentRecordRepository.save(any(PaymentRecord.class)))
                    .thenAnswer(invocation -> invocation.getArgument(0));

            // When
            VerificationResult result = service.verifyPayment(
                    verifyRequest(signature(RZP_ORDER_ID, RZP_PAYMENT_ID), null));

            // Then
            assertThat(result.isAlreadyCompleted()).isTrue();
            assertThat(record.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(record.getPaymentDetail()).isEqualTo(new PaymentDetail.Card("4242", "Visa", "unknown"));
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        }

        @Test
        @DisplayName("Should reject a second payment for an already completed gateway order")
        void shouldRejectDifferentPaymentForCompletedOrder() {
            // Given
            PaymentRecord record = record(PaymentStatus.COMPLETED);
            record.setRazorpayPaymentId("pay_EarlierPayment01");
            when(gatewayClient.fetchPayment(RZP_PAYMENT_ID))
                    .thenReturn(new GatewayPayment(paymentEntity("card", Map.of())));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.CONFIRMED, RZP_ORDER_ID)));

            // When / Then
            assertThatThrownBy(() -> service.verifyPayment(
                    verifyRequest(signature(RZP_ORDER_ID, RZP_PAYMENT_ID), null)))
                    .isInstanceOf(PaymentStateException.class);
            verify(paymentRecordRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should never complete a refunded payment")
        void shouldRejectVerificationOfRefundedPayment() {
            // Given
            PaymentRecord record = record(PaymentStatus.REFUNDED);
            record.setRazorpayPaymentId(RZP_PAYMENT_ID);
            when(gatewayClient.fetchPayment(RZP_PAYMENT_ID))
                    .thenReturn(new GatewayPayment(paymentEntity("card", Map.of())));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.CONFIRMED, RZP_ORDER_ID)));

            // When / Then
            assertThatThrownBy(() -> service.verifyPayment(
                    verifyRequest(signature(RZP_ORDER_ID, RZP_PAYMENT_ID), null)))
                    .isInstanceOf(PaymentStateException.class)
                    .satisfies(ex -> {
                        PaymentStateException state = (PaymentStateException) ex;
                        assertThat(state.getCurrentStatus()).isEqualTo("refunded");
                        assertThat(state.getRequestedStatus()).isEqualTo("completed");
                    });
            assertThat(record.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
            verify(paymentRecordRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should reject a payment whose amount differs from the order total")
        void shouldRejectAmountMismatch() {
            // Given
            PaymentRecord record = record(PaymentStatus.PENDING);
            record.setAmount(new BigDecimal("1.00"));
            when(gatewayClient.fetchPayment(RZP_PAYMENT_ID))
                    .thenReturn(new GatewayPayment(paymentEntity("card", Map.of())));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.PENDING, RZP_ORDER_ID)));

            // When / Then
            assertThatThrownBy(() -> service.verifyPayment(
                    verifyRequest(signature(RZP_ORDER_ID, RZP_PAYMENT_ID), null)))
                    .isInstanceOf(InvalidPaymentRequestException.class)
                    .hasMessageContaining("does not match");
            assertThat(record.getStatus()).isEqualTo(PaymentStatus.PENDING);
        }
        @Test
        @DisplayName("Should reject a payment the gateway reports for a different amount")
        void shouldRejectGatewayAmountMismatch() {
            // Given
            ObjectNode underpaid = paymentEntity("card", Map.of());
            underpaid.put("amount", 10000L);
            PaymentRecord record = record(PaymentStatus.PENDING);
            Order order = order(OrderStatus.PENDING, RZP_ORDER_ID);
            when(gatewayClient.fetchPayment(RZP_PAYMENT_ID)).thenReturn(new GatewayPayment(underpaid));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order));

            // When / Then
            assertThatThrownBy(() -> service.verifyPayment(
                    verifyRequest(signature(RZP_ORDER_ID, RZP_PAYMENT_ID), null)))
                    .isInstanceOf(InvalidPaymentRequestException.class)
                    .hasMessage("Payment amount does not match order total");
            assertThat(record.getStatus()).isEqualTo(PaymentStatus.PENDING);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            verify(paymentRecordRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Webhook reconciliation")
    class WebhookTests {

        @Test
        @DisplayName("Should complete the payment and confirm the order on payment.captured")
        void shouldApplyCapture() {
            // Given
            PaymentRecord record = record(PaymentStatus.PENDING);
            record.setPaymentMethod(PaymentMethod.WALLET);
            Order order = order(OrderStatus.PENDING, RZP_ORDER_ID);
            when(orderRepository.findByPaymentRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(order));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));

            // When
            ReconciliationOutcome outcome = service.applyPaymentCaptured(
                    new GatewayPayment(paymentEntity("wallet", Map.of("wallet", "paytm"))));

            // Then
            assertThat(outcome).isEqualTo(ReconciliationOutcome.APPLIED);
            assertThat(record.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(record.getPaymentDetail()).isEqualTo(new PaymentDetail.Wallet("paytm"));
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
            assertThat(order.getPayment().getRazorpayPaymentId()).isEqualTo(RZP_PAYMENT_ID);
            verify(notificationService).publish(eq(NotificationType.PAYMENT),
                    eq("Payment of ₹499.00 received for order #" + ORDER_NUMBER), anyMap());
        }

        @Test
        @DisplayName("Should not confirm an order when the captured amount is short of its total")
        void shouldIgnoreUnderpaidCapture() {
            // Given
            ObjectNode underpaid = paymentEntity("card", Map.of());
            underpaid.put("amount", 10000L);
            PaymentRecord record = record(PaymentStatus.PENDING);
            Order order = order(OrderStatus.PENDING, RZP_ORDER_ID);
            when(orderRepository.findByPaymentRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(order));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));

            // When
            ReconciliationOutcome outcome = service.applyPaymentCaptured(new GatewayPayment(underpaid));

            // Then
            assertThat(outcome).isEqualTo(ReconciliationOutcome.IGNORED);
            assertThat(record.getStatus()).isEqualTo(PaymentStatus.PENDING);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getPayment().getStatus()).isEqualTo(PaymentStatus.PENDING);
            verify(paymentRecordRepository, never()).save(any());
            verify(orderRepository, never()).save(any());
            verify(notificationService).publish(eq(NotificationType.SYSTEM),
                    eq("Captured amount for order #" + ORDER_NUMBER + " does not match its total"), anyMap());
            verify(notificationService, never()).publish(eq(NotificationType.PAYMENT), anyString(), anyMap());
        }

        @Test
        @DisplayName("Should not confirm an order whose payment record was opened for another amount")
        void shouldIgnoreCaptureOfMismatchedRecord() {
            // Given
            PaymentRecord record = record(PaymentStatus.PENDING);
            record.setAmount(new BigDecimal("100.00"));
            Order order = order(OrderStatus.PENDING, RZP_ORDER_ID);
            when(orderRepository.findByPaymentRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(order));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));

            // When
            ReconciliationOutcome outcome = service.applyPaymentCaptured(
                    new GatewayPayment(paymentEntity("card", Map.of())));

            // Then
            assertThat(outcome).isEqualTo(ReconciliationOutcome.IGNORED);
            assertThat(record.getStatus()).isEqualTo(PaymentStatus.PENDING);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            verify(orderRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should acknowledge a capture for an unknown gateway order without side effects")
        void shouldSkipCaptureForUnknownOrder() {
            ReconciliationOutcome outcome = service.applyPaymentCaptured(
                    new GatewayPayment(paymentEntity("card", Map.of())));

            assertThat(outcome).isEqualTo(ReconciliationOutcome.UNMATCHED);
            verify(paymentRecordRepository, never()).save(any());
            verifyNoInteractions(notificationService);
        }

        @Test
        @DisplayName("Should treat a redelivered capture as a no-op")
        void shouldIgnoreDuplicateCapture() {
            // Given
            PaymentRecord record = record(PaymentStatus.COMPLETED);
            record.setRazorpayPaymentId(RZP_PAYMENT_ID);
            when(orderRepository.findByPaymentRazorpayOrderId(RZP_ORDER_ID))
                    .thenReturn(Optional.of(order(OrderStatus.CONFIRMED, RZP_ORDER_ID)));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));

            // When
            ReconciliationOutcome outcome = service.applyPaymentCaptured(
                    new GatewayPayment(paymentEntity("card", Map.of())));

            // Then
            assertThat(outcome).isEqualTo(ReconciliationOutcome.DUPLICATE);
            verify(paymentRecordRepository, never()).save(any());
            verify(orderRepository, never()).save(any());
            verifyNoInteractions(notificationService);
        }

        @Test
        @DisplayName("Should never demote a completed payment on payment.failed")
        void shouldNotDemoteCompletedPayment() {
            // Given
            PaymentRecord record = record(PaymentStatus.COMPLETED);
            record.setRazorpayPaymentId(RZP_PAYMENT_ID);
            Order order = order(OrderStatus.CONFIRMED, RZP_ORDER_ID);
            order.getPayment().setStatus(PaymentStatus.COMPLETED);
            when(orderRepository.findByPaymentRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(order));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));

            // When
            ReconciliationOutcome outcome = service.applyPaymentFailed(new GatewayPayment(
                    failedEntity("pay_LateFailure0001", "Payment was declined by the bank")));

            // Then
            assertThat(outcome).isEqualTo(ReconciliationOutcome.IGNORED);
            assertThat(record.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            assertThat(order.getPayment().getStatus()).isEqualTo(PaymentStatus.COMPLETED);
            verify(paymentRecordRepository, never()).save(any());
            verifyNoInteractions(notificationService);
        }

        @Test
        @DisplayName("Should mark a pending payment failed with the gateway's reason")
        void shouldApplyFailure() {
            // Given
            PaymentRecord record = record(PaymentStatus.PENDING);
            Order order = order(OrderStatus.PENDING, RZP_ORDER_ID);
            when(orderRepository.findByPaymentRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(order));
            when(paymentRecordRepository.findByRazorpayOrderId(RZP_ORDER_ID)).thenReturn(Optional.of(record));

            // When
            ReconciliationOutcome outcome = service.applyPaymentFailed(new GatewayPayment(
                    failedEntity(RZP_PAYMENT_ID, "Payment was declined by the bank")));

            // Then
            assertThat(outcome).isEqualTo(ReconciliationOutcome.APPLIED);
            assertThat(record.getStatus()).isEqualTo(PaymentStatus.FAILED);
            assertThat(record.getErrorDescription()).isEqualTo("Payment was declined by the bank");
            assertThat(order.getPayment().getStatus()).isEqualTo(PaymentStatus.FAILED);
            assertThat(order.getPayment().getError()).isEqualTo("Payment was declined by the bank");
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            verify(notificationService).publish(eq(NotificationType.PAYMENT),
                    eq("Payment of ₹499.00 failed for order #" + ORDER_NUMBER), anyMap());
        }

        @Test
        @DisplayName("Should refund a completed payment on refund.created")
        void shouldApplyRefund() {
            // Given
            PaymentRecord record = record(PaymentStatus.COMPLETED);
            record.setRazorpayPaymentId(RZP_PAYMENT_ID);
            Order order = order(OrderStatus.CONFIRMED, RZP_ORDER_ID);
            order.getPayment().setStatus(PaymentStatus.COMPLETED);
            when(paymentRecordRepository.findFirstByRazorpayPaymentId(RZP_PAYMENT_ID)).thenReturn(Optional.of(record));
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order));

            // When
            ReconciliationOutcome outcome = service.applyRefundCreated(refundEntity(19900L));

            // Then
            assertThat(outcome).isEqualTo(ReconciliationOutcome.APPLIED);
            assertThat(record.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
            assertThat(record.getRefundDetails()).contains("rfnd_Nx8A0bC1dE2fG3");
            assertThat(order.getPayment().getStatus()).isEqualTo(PaymentStatus.REFUNDED);
            verify(notificationService).publish(eq(NotificationType.PAYMENT),
                    eq("Refund of ₹199.00 processed for order #" + ORDER_NUMBER), anyMap());
        }

        @Test
        @DisplayName("Should treat a refund of an already refunded payment as a no-op")
        void shouldIgnoreDuplicateRefund() {
            // Given
            PaymentRecord record = record(PaymentStatus.REFUNDED);
            record.setRazorpayPaymentId(RZP_PAYMENT_ID);
            when(paymentRecordRepository.findFirstByRazorpayPaymentId(RZP_PAYMENT_ID)).thenReturn(Optional.of(record));
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.CONFIRMED, RZP_ORDER_ID)));

            // When
            ReconciliationOutcome outcome = service.applyRefundCreated(refundEntity(49900L));

            // Then
            assertThat(outcome).isEqualTo(ReconciliationOutcome.DUPLICATE);
            verify(paymentRecordRepository, never()).save(any());
            verifyNoInteractions(notificationService);
        }

        @Test
        @DisplayName("Should not refund a payment that was never completed")
        void shouldIgnoreRefundOfPendingPayment() {
            // Given
            PaymentRecord record = record(PaymentStatus.PENDING);
            record.setRazorpayPaymentId(RZP_PAYMENT_ID);
            when(paymentRecordRepository.findFirstByRazorpayPaymentId(RZP_PAYMENT_ID)).thenReturn(Optional.of(record));
            when(orderRepository.findById(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.PENDING, RZP_ORDER_ID)));

            // When
            ReconciliationOutcome outcome = service.applyRefundCreated(refundEntity(49900L));

            // Then
            assertThat(outcome).isEqualTo(ReconciliationOutcome.IGNORED);
            assertThat(record.getStatus()).isEqualTo(PaymentStatus.PENDING);
        }

        @Test
        @DisplayName("Should skip a refund for an unknown payment")
        void shouldSkipRefundForUnknownPayment() {
            ReconciliationOutcome outcome = service.applyRefundCreated(refundEntity(49900L));

            assertThat(outcome).isEqualTo(ReconciliationOutcome.UNMATCHED);
            verifyNoInteractions(orderRepository, notificationService);
        }
    }

    // Helper methods

    private Order order(OrderStatus status, String razorpayOrderId) {
        Order order = Order.builder()
                .id(ORDER_ID)
                .orderNumber(ORDER_NUMBER)
                .userId("user-42")
                .subtotal(new BigDecimal("422.88"))
                .tax(new BigDecimal("76.12"))
                .total(new BigDecimal("499.00"))
                .status(status)
                .build();
        if (razorpayOrderId != null) {
            order.setPayment(OrderPayment.builder()
                    .method(OrderPayment.GATEWAY_METHOD)
                    .status(PaymentStatus.PENDING)
                    .razorpayOrderId(razorpayOrderId)
                    .amount(new BigDecimal("499.00"))
                    .build());
        }
        return order;
    }

    private PaymentRecord record(PaymentStatus status) {
        return PaymentRecord.builder()
                .id(7L)
                .orderId(ORDER_ID)
                .userId("user-42")
                .razorpayOrderId(RZP_ORDER_ID)
                .amount(new BigDecimal("499.00"))
                .currency("INR")
                .paymentMethod(PaymentMethod.CARD)
                .status(status)
                .build();
    }

    private GatewayOrder gatewayOrder(long amountMinor) {
        return GatewayOrder.builder()
                .id(RZP_ORDER_ID)
                .amount(amountMinor)
                .currency("INR")
                .receipt(ORDER_ID)
                .status("created")
                .build();
    }

    private ObjectNode paymentEntity(String method, Map<String, Object> attributes) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", RZP_PAYMENT_ID);
        node.put("entity", "payment");
        node.put("order_id", RZP_ORDER_ID);
        node.put("amount", 49900L);
        node.put("currency", "INR");
        node.put("status", "captured");
        node.put("method", method);
        attributes.forEach((key, value) -> node.set(key, objectMapper.valueToTree(value)));
        return node;
    }

    private ObjectNode failedEntity(String paymentId, String reason) {
        ObjectNode node = paymentEntity("card", Map.of());
        node.put("id", paymentId);
        node.put("status", "failed");
        node.put("error_description", reason);
        return node;
    }

    private JsonNode refundEntity(long amountMinor) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", "rfnd_Nx8A0bC1dE2fG3");
        node.put("entity", "refund");
        node.put("payment_id", RZP_PAYMENT_ID);
        node.put("amount", amountMinor);
        node.put("currency", "INR");
        return node;
    }

    private VerifyPaymentRequest verifyRequest(String signature, String method) {
        return VerifyPaymentRequest.builder()
                .razorpayOrderId(RZP_ORDER_ID)
                .razorpayPaymentId(RZP_PAYMENT_ID)
                .razorpaySignature(signature)
                .paymentMethod(method)
                .orderId(ORDER_ID)
                .build();
    }

    private static String signature(String razorpayOrderId, String razorpayPaymentId) {
        return RazorpaySignatureVerifier.sign(KEY_SECRET,
                (razorpayOrderId + "|" + razorpayPaymentId).getBytes(StandardCharsets.UTF_8));
    }
}
