package com.fintech.checkout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Checkout Payment Service
 * <p>
 * Takes an order from "awaiting payment" to "confirmed" against the Razorpay gateway
 * and keeps our payment records in step with the gateway afterwards.
 * <p>
 * Key Features:
 * - Gateway order initiation for a stored order
 * - Signed checkout callback verification
 * - Webhook-driven capture, failure and refund handling
 * - Admin notifications for every payment state change
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class CheckoutPaymentApplication {

    public static void main(String[] args) {
        SpringApplication.run(CheckoutPaymentApplication.class, args);
    }
}
