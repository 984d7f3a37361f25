package com.ledgerlens.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Remote category classifier settings.
 *
 * Example:
 * ledgerlens.classifier.base-url=${LEDGERLENS_CLASSIFIER_URL:http://localhost:8000}
 */
@Data
@Component
@ConfigurationProperties(prefix = "ledgerlens.classifier")
public class ClassifierProperties {

    /**
     * Base URL of the classification service; "/api/v1/classify" and "/api/v1/feedback" are appended.
     */
    private String baseUrl = "http://localhost:8000";

    /**
     * When false, imports go straight to the keyword classifier.
     */
    private boolean enabled = true;

    /**
     * Timeout in seconds for a batch classify call. The remote model can take a while on a cold start.
     */
    private int classifyTimeout = 30;

    private int feedbackTimeout = 15;

    public boolean isConfigured() {
        return enabled && baseUrl != null && !baseUrl.isBlank();
    }
}
