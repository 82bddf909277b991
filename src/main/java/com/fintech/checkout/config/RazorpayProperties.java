package com.fintech.checkout.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Razorpay gateway settings.
 * <p>
 * Credentials are allowed to be blank at startup so that the service can still
 * report which of them are missing through {@link #missingSettings()}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "razorpay")
public class RazorpayProperties {

    public static final String KEY_ID = "RAZORPAY_KEY_ID";
    public static final String KEY_SECRET = "RAZORPAY_KEY_SECRET";
    public static final String WEBHOOK_SECRET = "RAZORPAY_WEBHOOK_SECRET";

    /** Which gateway client to wire: {@code live} or {@code mock}. */
    @Pattern(regexp = "live|mock")
    private String client = "live";

    @NotBlank
    private String baseUrl = "https://api.razorpay.com/v1";

    private String keyId;

    private String keySecret;

    /** Shared secret configured on the Razorpay dashboard for webhook deliveries. */
    private String webhookSecret;

    @Pattern(regexp = "^[A-Z]{3}$")
    private String defaultCurrency = "INR";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(15);

    /**
     * Names of the environment settings that are not configured.
     * Values are never included.
     */
    public List<String> missingSettings() {
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(keyId)) {
            missing.add(KEY_ID);
        }
        if (!StringUtils.hasText(keySecret)) {
            missing.add(KEY_SECRET);
        }
        if (!StringUtils.hasText(webhookSecret)) {
            missing.add(WEBHOOK_SECRET);
        }
        return missing;
    }
}
