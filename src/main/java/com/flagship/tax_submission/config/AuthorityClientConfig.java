package com.flagship.tax_submission.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client used to reach the tax authority gateway.
 *
 * Timeouts are per attempt; retries are driven by the transmission retry engine.
 */
@Configuration
public class AuthorityClientConfig {

    @Bean
    public RestTemplate authorityRestTemplate(
            RestTemplateBuilder builder,
            @Value("${authority.gateway.base-url:http://localhost:8089}") String baseUrl,
            @Value("${authority.gateway.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${authority.gateway.read-timeout-ms:30000}") long readTimeoutMs) {
        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
