package com.fintech.checkout.controller;

import com.fintech.checkout.config.OpenApiConfig;
import com.fintech.checkout.exception.InvalidSignatureException;
import com.fintech.checkout.service.RazorpayWebhookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives Razorpay webhook deliveries.
 * The body is taken as raw bytes because the signature covers the exact payload.
 */
@RestController
@RequestMapping("/api/payment/webhook")
@RequiredArgsConstructor
@Tag(name = "Webhook", description = "Razorpay webhook receiver")
public class RazorpayWebhookController {

    private final RazorpayWebhookService webhookService;

    @Operation(summary = "Razorpay webhook",
            description = "Handles payment.captured, payment.failed and refund.created. Other events are acknowledged and ignored.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Delivery acknowledged"),
            @ApiResponse(responseCode = "400", description = "Signature missing or invalid")
    })
    @PostMapping(consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Map<String, Object>> receive(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(name = OpenApiConfig.SIGNATURE_HEADER, required = false) String signature) {
        try {
            webhookService.handle(body, signature);
        } catch (InvalidSignatureException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.ok(Map.of("received", true));
    }
}
