package com.ledgerlens.backend.services.imports.classification;

import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Tries the remote classifier and, if it fails for any reason, answers with the keyword
 * classifier instead. Never throws.
 */
@Slf4j
@Primary
@Component
public class FallbackClassifier implements Classifier {

    private final Classifier primary;
    private final Classifier fallback;

    @Autowired
    public FallbackClassifier(RemoteBatchClassifier primary, KeywordClassifier fallback) {
        this((Classifier) primary, (Classifier) fallback);
    }

    FallbackClassifier(Classifier primary, Classifier fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public Map<String, String> classify(List<ClassificationQuery> queries, String accessToken) {
        try {
            return primary.classify(queries, accessToken);
        } catch (RuntimeException e) {
            log.warn("[Classification] remote classifier unavailable, using keyword classifier: {}", e.getMessage());
            return fallback.classify(queries, accessToken);
        }
    }
}
