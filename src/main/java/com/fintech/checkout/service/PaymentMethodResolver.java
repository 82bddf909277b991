package com.fintech.checkout.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.checkout.entity.PaymentDetail;
import com.fintech.checkout.entity.PaymentMethod;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Normalizes the gateway's payment method and extracts the matching instrument details.
 * <p>
 * The gateway's report wins over whatever the storefront declared. Razorpay has moved
 * instrument fields around between API versions, so each detail field is looked up in
 * every place it has been seen and falls back to {@value PaymentDetail#UNKNOWN}.
 */
@Component
public class PaymentMethodResolver {

    private static final Map<String, PaymentMethod> GATEWAY_METHODS = Map.of(
            "upi", PaymentMethod.UPI,
            "upi_intent", PaymentMethod.UPI,
            "netbanking", PaymentMethod.NETBANKING,
            "wallet", PaymentMethod.WALLET,
            "emi", PaymentMethod.EMI,
            "card", PaymentMethod.CARD
    );

    /**
     * @param gatewayMethod method reported by the gateway, may be null
     * @param clientHint    method declared by the storefront, may be null
     */
    public PaymentMethod resolve(String gatewayMethod, String clientHint) {
        if (gatewayMethod != null) {
            PaymentMethod mapped = GATEWAY_METHODS.get(gatewayMethod.trim().toLowerCase());
            if (mapped != null) {
                return mapped;
            }
        }
        return PaymentMethod.fromValue(clientHint).orElse(PaymentMethod.CARD);
    }

    /**
     * Builds the detail variant for {@code method} from a gateway payment entity.
     * EMI payments are card-backed and carry the card variant.
     */
    public PaymentDetail extractDetail(PaymentMethod method, JsonNode payment) {
        return switch (method) {
            case UPI -> new PaymentDetail.Upi(
                    firstText(payment, "vpa", "upi.vpa", "upi_intent.vpa"));
            case NETBANKING -> new PaymentDetail.Netbanking(
                    firstText(payment, "bank", "netbanking.bank_name"),
                    firstText(payment, "ifsc", "netbanking.ifsc"));
            case WALLET -> new PaymentDetail.Wallet(
                    firstText(payment, "wallet", "wallet.name"));
            case CARD, EMI -> new PaymentDetail.Card(
                    firstText(payment, "card.last4", "card.last4_digits"),
                    firstText(payment, "card.network", "card.card_network"),
                    firstText(payment, "card.issuer", "card.issuer_name"));
        };
    }

    private static String firstText(JsonNode root, String... paths) {
        if (root != null) {
            for (String path : paths) {
                JsonNode node = root;
                for (String segment : path.split("\\.")) {
                    node = node.path(segment);
                }
                if (node.isValueNode() && !node.isNull() && !node.asText().isBlank()) {
                    return node.asText();
                }
            }
        }
        return PaymentDetail.UNKNOWN;
    }
}
