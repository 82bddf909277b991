package com.fintech.checkout.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * HTTP client for the Razorpay REST API.
 * Authenticates with HTTP basic auth (key id / key secret).
 */
@Configuration
@ConditionalOnProperty(name = "razorpay.client", havingValue = "live", matchIfMissing = true)
@Slf4j
public class RazorpayClientConfig {

    @Bean
    public RestClient razorpayRestClient(RestClient.Builder builder, RazorpayProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());

        List<String> missing = properties.missingSettings();
        if (!missing.isEmpty()) {
            log.warn("Razorpay settings missing: {}", missing);
        }

        return builder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeaders(headers -> {
                    if (properties.getKeyId() != null && properties.getKeySecret() != null) {
                        headers.setBasicAuth(properties.getKeyId(), properties.getKeySecret());
                    }
                })
                .build();
    }
}
