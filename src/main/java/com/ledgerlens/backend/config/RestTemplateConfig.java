package com.ledgerlens.backend.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP clients for the classification service. Classify and feedback calls get separate
 * read timeouts so a slow classify never holds a feedback call hostage.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate classifierRestTemplate(RestTemplateBuilder builder, ClassifierProperties properties) {
        return build(builder, properties.getClassifyTimeout(), 30);
    }

    @Bean
    public RestTemplate feedbackRestTemplate(RestTemplateBuilder builder, ClassifierProperties properties) {
        return build(builder, properties.getFeedbackTimeout(), 15);
    }

    private static RestTemplate build(RestTemplateBuilder builder, int timeoutSeconds, int fallbackSeconds) {
        if (timeoutSeconds <= 0) timeoutSeconds = fallbackSeconds;
        Duration timeout = Duration.ofSeconds(timeoutSeconds);

        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
