package com.fintech.checkout.entity;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Instrument-specific details of a captured payment.
 * Exactly one variant exists per payment, chosen by the resolved {@link PaymentMethod}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PaymentDetail.Upi.class, name = "upi"),
        @JsonSubTypes.Type(value = PaymentDetail.Netbanking.class, name = "netbanking"),
        @JsonSubTypes.Type(value = PaymentDetail.Wallet.class, name = "wallet"),
        @JsonSubTypes.Type(value = PaymentDetail.Card.class, name = "card")
})
public sealed interface PaymentDetail permits
        PaymentDetail.Upi,
        PaymentDetail.Netbanking,
        PaymentDetail.Wallet,
        PaymentDetail.Card {

    String UNKNOWN = "unknown";

    record Upi(String vpa) implements PaymentDetail {
    }

    record Netbanking(String bank, String ifsc) implements PaymentDetail {
    }

    record Wallet(String name) implements PaymentDetail {
    }

    record Card(String last4, String network, String issuer) implements PaymentDetail {
    }
}
