package com.flagship.member_payments.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client for payment gateways. Every call is bounded by connect and read timeouts.
 */
@Configuration
public class GatewayConfig {

    @Bean("gatewayRestTemplate")
    public RestTemplate gatewayRestTemplate(RestTemplateBuilder builder,
                                            @Value("${gateway.timeout.connect-ms:5000}") long connectTimeoutMs,
                                            @Value("${gateway.timeout.read-ms:10000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
