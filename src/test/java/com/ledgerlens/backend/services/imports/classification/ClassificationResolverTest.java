package com.ledgerlens.backend.services.imports.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.ledgerlens.backend.services.imports.CanonicalTransaction;

class ClassificationResolverTest {

    private final Classifier classifier = mock(Classifier.class);
    private final ClassificationResolver resolver = new ClassificationResolver(classifier);

    private static CanonicalTransaction tx(String description, String merchant) {
        return CanonicalTransaction.builder()
                .date(Instant.parse("2024-02-15T00:00:00Z"))
                .amount(new BigDecimal("-100"))
                .currency("INR")
                .description(description)
                .merchant(merchant)
                .paymentMethod("upi")
                .status("completed")
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void oneRemoteCallPerBatchAndCategoryAppliedToWholeGroup() {
        CanonicalTransaction first = tx("SWIGGY ORDER #123", "Swiggy");
        CanonicalTransaction second = tx("SWIGGY ORDER #456", "Swiggy");
        CanonicalTransaction other = tx("Corner shop", "Unknown");

        when(classifier.classify(anyList(), eq("tok"))).thenReturn(Map.of("SWIGGY ORDER #123", "Food"));

        resolver.resolve(List.of(first, second, other), "tok");

        ArgumentCaptor<List<ClassificationQuery>> captor = ArgumentCaptor.forClass(List.class);
        verify(classifier, times(1)).classify(captor.capture(), eq("tok"));
        assertEquals(List.of(new ClassificationQuery("SWIGGY ORDER #123", "Swiggy"),
                new ClassificationQuery("Corner shop", "Unknown")), captor.getValue());

        assertEquals("Food", first.getCategory());
        assertEquals("Food", second.getCategory());
        assertEquals(CanonicalTransaction.UNCATEGORIZED, other.getCategory());
    }

    @Test
    void groupMembersInheritTheRepresentativeAnswerOverTheirOwnMerchant() {
        ClassificationResolver keywords = new ClassificationResolver(new KeywordClassifier());
        CanonicalTransaction first = tx("CARD PAYMENT #123", "Swiggy");
        CanonicalTransaction second = tx("CARD PAYMENT #456", "Uber");

        keywords.resolve(List.of(first, second), null);

        assertEquals("Transport", new KeywordClassifier().classifyOne("CARD PAYMENT #456", "Uber"));
        assertEquals("Food", first.getCategory());
        assertEquals("Food", second.getCategory());
    }

    @Test
    void emptyBatchDoesNotCallClassifier() {
        resolver.resolve(List.of(), null);

        verifyNoInteractions(classifier);
    }
}
