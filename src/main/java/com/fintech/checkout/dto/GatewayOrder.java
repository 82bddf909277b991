package com.fintech.checkout.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Order entity returned by the Razorpay Orders API (subset we use).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GatewayOrder {

    private String id;

    /**
     * Amount in minor units.
     */
    private long amount;

    private String currency;

    private String receipt;

    private String status;
}
