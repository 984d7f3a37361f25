package com.ledgerlens.backend.services.imports.classification;

import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ledgerlens.backend.config.ClassifierProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Sends manual category corrections back to the classification service so it can learn
 * from them. Fire-and-forget: failures are logged and dropped.
 */
@Slf4j
@Component
public class ClassificationFeedbackClient {

    static final String FEEDBACK_PATH = "/api/v1/feedback";

    private final RestTemplate restTemplate;
    private final ClassifierProperties properties;

    public ClassificationFeedbackClient(
            @Qualifier("feedbackRestTemplate") RestTemplate restTemplate,
            ClassifierProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Async("classificationFeedbackExecutor")
    public void sendCorrections(Map<String, String> corrections, String accessToken) {
        send(corrections, accessToken);
    }

    void send(Map<String, String> corrections, String accessToken) {
        if (corrections == null || corrections.isEmpty() || !properties.isConfigured()) return;

        String url = RemoteBatchClassifier.trimTrailingSlash(properties.getBaseUrl()) + FEEDBACK_PATH;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (accessToken != null && !accessToken.isBlank()) {
            headers.setBearerAuth(accessToken);
        }

        try {
            FeedbackResponse response = restTemplate.postForObject(
                    url, new HttpEntity<>(new FeedbackRequest(corrections), headers), FeedbackResponse.class);
            log.info("[ClassificationFeedback] sent corrections={} status={} updated={}",
                    corrections.size(),
                    response != null ? response.status() : null,
                    response != null ? response.updatedCategories() : null);
        } catch (RestClientException e) {
            log.warn("[ClassificationFeedback] failed to send {} corrections: {}", corrections.size(), e.getMessage());
        }
    }

    record FeedbackRequest(Map<String, String> corrections) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FeedbackResponse(String status, @JsonProperty("updated_categories") List<String> updatedCategories) {
    }
}
