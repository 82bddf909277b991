package com.fintech.checkout.service;

import com.fintech.checkout.dto.GatewayOrder;
import com.fintech.checkout.dto.GatewayPayment;
import com.fintech.checkout.exception.GatewayException;

/**
 * Interface for talking to the payment gateway.
 * <p>
 * {@link RazorpayGatewayClient} calls the Razorpay REST API;
 * {@link MockRazorpayGatewayClient} keeps gateway state in memory for tests and local runs.
 */
public interface PaymentGatewayClient {

    /**
     * Creates a gateway-side order that the checkout widget will collect against.
     *
     * @param amountMinor amount in the currency's minor unit
     * @param currency    ISO 4217 currency code
     * @param receipt     our order id, echoed back by the gateway
     * @throws GatewayException if the gateway rejects the request or cannot be reached
     */
    GatewayOrder createOrder(long amountMinor, String currency, String receipt) throws GatewayException;

    /**
     * Fetches the authoritative payment entity.
     *
     * @throws GatewayException if the payment is unknown or the gateway cannot be reached
     */
    GatewayPayment fetchPayment(String paymentId) throws GatewayException;

    /**
     * Returns the name of the gateway, used in logs and error payloads.
     */
    String getGatewayName();
}
