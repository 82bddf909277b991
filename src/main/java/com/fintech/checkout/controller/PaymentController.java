package com.fintech.checkout.controller;

import com.fintech.checkout.dto.ApiResult;
import com.fintech.checkout.dto.CreateGatewayOrderRequest;
import com.fintech.checkout.dto.GatewayConfigStatus;
import com.fintech.checkout.dto.GatewayOrderResponse;
import com.fintech.checkout.dto.VerificationResult;
import com.fintech.checkout.dto.VerifyPaymentRequest;
import com.fintech.checkout.entity.PaymentRecord;
import com.fintech.checkout.service.GatewayConfigurationService;
import com.fintech.checkout.service.PaymentReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Storefront-facing payment API.
 * <p>
 * Provides endpoints for:
 * - Opening a Razorpay order before the checkout widget is shown
 * - Verifying the checkout callback
 * - Checking whether the gateway credentials are configured
 */
@RestController
@RequestMapping("/api/payment")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Payment", description = "Razorpay checkout initiation and verification")
public class PaymentController {

    private final PaymentReconciliationService reconciliationService;
    private final GatewayConfigurationService configurationService;

    @Operation(
            summary = "Create gateway order",
            description = "Opens a Razorpay order for a stored order. The amount is given in rupees and sent to the gateway in paise."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Gateway order created"),
            @ApiResponse(responseCode = "400", description = "Missing fields or invalid amount"),
            @ApiResponse(responseCode = "404", description = "Order not found"),
            @ApiResponse(responseCode = "409", description = "Order is already paid or refunded"),
            @ApiResponse(responseCode = "502", description = "Razorpay rejected the request or is unavailable")
    })
    @PostMapping("/create-order")
    public ResponseEntity<ApiResult<GatewayOrderResponse>> createOrder(@RequestBody CreateGatewayOrderRequest request) {
        log.info("Create gateway order requested for order {}", request.getOrderId());
        return ResponseEntity.ok(ApiResult.ok(reconciliationService.createGatewayOrder(request)));
    }

    @Operation(
            summary = "Verify checkout callback",
            description = "Checks the Razorpay signature, fetches the payment from Razorpay and marks the order as paid."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payment verified"),
            @ApiResponse(responseCode = "400", description = "Missing fields, bad signature or amount mismatch"),
            @ApiResponse(responseCode = "404", description = "Payment record or order not found"),
            @ApiResponse(responseCode = "409", description = "Payment can no longer be completed")
    })
    @PostMapping("/verify")
    public ResponseEntity<ApiResult<PaymentRecord>> verify(@RequestBody VerifyPaymentRequest request) {
        VerificationResult result = reconciliationService.verifyPayment(request);
        return ResponseEntity.ok(ApiResult.ok(result.getPayment(), result.getMessage()));
    }

    @Operation(
            summary = "Gateway configuration status",
            description = "Reports which Razorpay settings are present. Never returns their values."
    )
    @ApiResponse(responseCode = "200", description = "Configuration status")
    @GetMapping("/config-status")
    public ResponseEntity<ApiResult<GatewayConfigStatus>> configStatus() {
        return ResponseEntity.ok(ApiResult.ok(configurationService.getStatus()));
    }
}
