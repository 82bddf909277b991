package com.fintech.checkout.exception;

/**
 * Thrown when a call to the payment gateway fails.
 * This could be due to network issues, timeouts, rejected requests or gateway downtime.
 */
public class GatewayException extends PaymentException {

    private final String gatewayName;
    private final String gatewayDescription;
    private final boolean isRetryable;

    public GatewayException(String message, String gatewayName) {
        super(message);
        this.gatewayName = gatewayName;
        this.gatewayDescription = null;
        this.isRetryable = true;
    }

    public GatewayException(String message, String gatewayName, String gatewayDescription,
                            boolean isRetryable) {
        super(message);
        this.gatewayName = gatewayName;
        this.gatewayDescription = gatewayDescription;
        this.isRetryable = isRetryable;
    }

    public GatewayException(String message, String gatewayName, Throwable cause) {
        super(message, cause);
        this.gatewayName = gatewayName;
        this.gatewayDescription = null;
        this.isRetryable = true;
    }

    public String getGatewayName() {
        return gatewayName;
    }

    /**
     * Error description returned by the gateway, if it sent one.
     */
    public String getGatewayDescription() {
        return gatewayDescription;
    }

    /**
     * Indicates if this error is transient and the call can be retried.
     * Rejected requests (bad amount, authentication failure) are not retryable.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
