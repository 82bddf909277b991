package com.fintech.checkout.config;

import com.fintech.checkout.dto.GatewayConfigStatus;
import com.fintech.checkout.service.GatewayConfigurationService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.stereotype.Component;

/**
 * Reports the gateway as down while any credential is missing. Shown under {@code /actuator/health} as {@code razorpay}.
 */
@Component("razorpay")
@RequiredArgsConstructor
public class RazorpayHealthIndicator extends AbstractHealthIndicator {

    private final GatewayConfigurationService configurationService;

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        GatewayConfigStatus status = configurationService.getStatus();
        if (status.isConfigured()) {
            builder.up();
        } else {
            builder.down().withDetail("missing", status.getMissing());
        }
        builder.withDetail("client", status.getGatewayClient());
    }
}
