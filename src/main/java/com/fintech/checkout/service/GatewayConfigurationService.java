package com.fintech.checkout.service;

import com.fintech.checkout.config.RazorpayProperties;
import com.fintech.checkout.dto.GatewayConfigStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Reports which gateway settings are present without exposing their values.
 */
@Service
@RequiredArgsConstructor
public class GatewayConfigurationService {

    private final RazorpayProperties properties;
    private final PaymentGatewayClient gatewayClient;

    public GatewayConfigStatus getStatus() {
        List<String> missing = properties.missingSettings();
        return GatewayConfigStatus.builder()
                .configured(missing.isEmpty())
                .keyId(StringUtils.hasText(properties.getKeyId()))
                .keySecret(StringUtils.hasText(properties.getKeySecret()))
                .webhookSecret(StringUtils.hasText(properties.getWebhookSecret()))
                .missing(missing)
                .gatewayClient(gatewayClient.getGatewayName())
                .build();
    }
}
