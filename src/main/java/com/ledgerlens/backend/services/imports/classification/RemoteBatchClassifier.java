package com.ledgerlens.backend.services.imports.classification;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import com.ledgerlens.backend.config.ClassifierProperties;
import com.ledgerlens.backend.exceptions.RemoteCallTimeoutException;

import lombok.extern.slf4j.Slf4j;

/**
 * Client for the category model: {@code POST /api/v1/classify} with {@code {"descriptions": [...]}},
 * answered by a JSON object description to category.
 */
@Slf4j
@Component
public class RemoteBatchClassifier implements Classifier {

    static final String CLASSIFY_PATH = "/api/v1/classify";

    private static final ParameterizedTypeReference<Map<String, String>> RESPONSE_TYPE = new ParameterizedTypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ClassifierProperties properties;

    public RemoteBatchClassifier(
            @Qualifier("classifierRestTemplate") RestTemplate restTemplate,
            ClassifierProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public Map<String, String> classify(List<ClassificationQuery> queries, String accessToken) {
        if (queries.isEmpty()) return Map.of();
        if (!properties.isConfigured()) {
            throw new IllegalStateException("Remote classifier is disabled");
        }

        List<String> descriptions = queries.stream().map(ClassificationQuery::description).toList();
        String url = trimTrailingSlash(properties.getBaseUrl()) + CLASSIFY_PATH;

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (accessToken != null && !accessToken.isBlank()) {
            headers.setBearerAuth(accessToken);
        }
        HttpEntity<ClassifyRequest> request = new HttpEntity<>(new ClassifyRequest(descriptions), headers);

        log.info("[RemoteClassifier] classifying {} descriptions url={}", descriptions.size(), url);
        try {
            ResponseEntity<Map<String, String>> response = restTemplate.exchange(url, HttpMethod.POST, request, RESPONSE_TYPE);
            Map<String, String> body = response.getBody();
            return body == null ? Map.of() : body;
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new RemoteCallTimeoutException("Classification request",
                        properties.getClassifyTimeout() * 1000L, e);
            }
            throw e;
        } catch (HttpStatusCodeException e) {
            String payload = e.getResponseBodyAsString();
            throw new IllegalStateException("Classifier error status=" + e.getStatusCode() + " body="
                    + (payload.length() > 500 ? payload.substring(0, 500) : payload), e);
        }
    }

    static String trimTrailingSlash(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    record ClassifyRequest(List<String> descriptions) {
    }
}
