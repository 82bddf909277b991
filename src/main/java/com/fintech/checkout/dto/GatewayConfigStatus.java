package com.fintech.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Which gateway settings are present. Never carries the values themselves.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayConfigStatus {

    private boolean configured;
    private boolean keyId;
    private boolean keySecret;
    private boolean webhookSecret;
    private List<String> missing;
    private String gatewayClient;
}
