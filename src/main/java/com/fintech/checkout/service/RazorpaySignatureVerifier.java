package com.fintech.checkout.service;

import com.fintech.checkout.config.RazorpayProperties;
import com.fintech.checkout.exception.PaymentException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Razorpay HMAC-SHA256 signatures.
 * <p>
 * Checkout callbacks are signed with the API key secret over {@code "order_id|payment_id"};
 * webhook deliveries are signed with the webhook secret over the raw request body.
 * Both are lowercase hex.
 */
@Component
@RequiredArgsConstructor
public class RazorpaySignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final RazorpayProperties properties;

    public boolean isValidPaymentSignature(String razorpayOrderId, String razorpayPaymentId, String signature) {
        String payload = razorpayOrderId + "|" + razorpayPaymentId;
        String expected = sign(requireSecret(properties.getKeySecret(), RazorpayProperties.KEY_SECRET),
                payload.getBytes(StandardCharsets.UTF_8));
        return constantTimeEquals(expected, signature);
    }

    public boolean isValidWebhookSignature(byte[] rawBody, String signature) {
        if (rawBody == null || !StringUtils.hasText(signature)) {
            return false;
        }
        String expected = sign(requireSecret(properties.getWebhookSecret(), RazorpayProperties.WEBHOOK_SECRET),
                rawBody);
        return constantTimeEquals(expected, signature);
    }

    /**
     * Hex-encoded HMAC-SHA256 of {@code payload} under {@code secret}.
     */
    public static String sign(String secret, byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }

    private static boolean constantTimeEquals(String expected, String supplied) {
        if (supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                supplied.getBytes(StandardCharsets.UTF_8));
    }

    private static String requireSecret(String secret, String settingName) {
        if (!StringUtils.hasText(secret)) {
            throw new PaymentException(settingName + " is not configured");
        }
        return secret;
    }
}
