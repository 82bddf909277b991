package com.fintech.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request to open a Razorpay order for a stored storefront order.
 * Amount is in the currency's major unit (rupees for INR).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateGatewayOrderRequest {

    private BigDecimal amount;

    /**
     * ISO 4217 code; the configured default currency is used when absent.
     */
    private String currency;

    private String orderId;

    /**
     * Method the customer picked in the storefront. A hint only; the gateway
     * reports the method actually used once the payment is made.
     */
    private String paymentMethod;
}
