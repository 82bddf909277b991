package com.fintech.checkout.dto;

import com.fintech.checkout.entity.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the storefront needs to open the Razorpay checkout widget.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayOrderResponse {

    /**
     * Razorpay order id.
     */
    private String orderId;

    /**
     * Amount in the currency's minor unit.
     */
    private long amount;

    private String currency;

    private PaymentMethod paymentMethod;
}
