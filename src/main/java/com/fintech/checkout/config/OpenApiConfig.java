package com.fintech.checkout.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * API document for the checkout endpoints. The webhook signature header is
 * registered as a reusable component so clients replaying events can find it.
 */
@Configuration
public class OpenApiConfig {

    public static final String SIGNATURE_HEADER = "X-Razorpay-Signature";

    @Bean
    public OpenAPI checkoutPaymentOpenAPI(@Value("${server.port:8080}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Checkout Payment Service API")
                        .description("Razorpay order creation, checkout callback verification and webhook intake for storefront orders.")
                        .version("1.0.0"))
                .externalDocs(new ExternalDocumentation()
                        .description("Razorpay webhook payloads")
                        .url("https://razorpay.com/docs/webhooks/payloads/payments/"))
                .components(new Components()
                        .addParameters("razorpaySignature", new HeaderParameter()
                                .name(SIGNATURE_HEADER)
                                .description("Hex HMAC-SHA256 of the raw request body keyed with the webhook secret")
                                .required(true)
                                .schema(new StringSchema())))
                .servers(List.of(new Server().url("http://localhost:" + port).description("Local")));
    }
}
