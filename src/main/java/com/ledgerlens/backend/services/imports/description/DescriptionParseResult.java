package com.ledgerlens.backend.services.imports.description;

import java.util.Map;

import com.ledgerlens.backend.enums.NarrationType;

/**
 * What a bank-specific parser made of one narration.
 */
public record DescriptionParseResult(
        String merchant,
        String cleanDescription,
        NarrationType type,
        Map<String, String> meta
) {
    public DescriptionParseResult {
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    public static DescriptionParseResult unknown(String narration) {
        return new DescriptionParseResult("Unknown", narration, NarrationType.UNKNOWN, Map.of());
    }

    public boolean isResolved() {
        return type != NarrationType.UNKNOWN;
    }
}
