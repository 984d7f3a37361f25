package com.ledgerlens.backend.services.imports.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ledgerlens.backend.exceptions.RemoteCallTimeoutException;

class FallbackClassifierTest {

    private final Classifier remote = mock(Classifier.class);
    private final Classifier keywords = mock(Classifier.class);
    private final FallbackClassifier classifier = new FallbackClassifier(remote, keywords);

    private final List<ClassificationQuery> queries = List.of(new ClassificationQuery("Uber trip", "Uber"));

    @Test
    void usesRemoteWhenItAnswers() {
        when(remote.classify(queries, "tok")).thenReturn(Map.of("Uber trip", "Travel"));

        assertEquals("Travel", classifier.classify(queries, "tok").get("Uber trip"));
        verify(keywords, never()).classify(anyList(), any());
    }

    @Test
    void fallsBackToKeywordsOnFailure() {
        when(remote.classify(queries, "tok"))
                .thenThrow(new RemoteCallTimeoutException("Classification request", 30000, null));
        when(keywords.classify(queries, "tok")).thenReturn(Map.of("Uber trip", "Transport"));

        assertEquals("Transport", classifier.classify(queries, "tok").get("Uber trip"));
    }

    @Test
    void fallsBackWithRealKeywordClassifier() {
        FallbackClassifier real = new FallbackClassifier(remote, new KeywordClassifier());
        when(remote.classify(queries, null)).thenThrow(new IllegalStateException("Remote classifier is disabled"));

        assertEquals("Transport", real.classify(queries, null).get("Uber trip"));
    }
}
