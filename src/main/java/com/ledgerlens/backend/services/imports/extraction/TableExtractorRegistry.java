package com.ledgerlens.backend.services.imports.extraction;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.enums.ImportFileKind;

/**
 * Picks the extractor for a file kind. Unknown kinds produce no rows.
 */
@Component
public class TableExtractorRegistry {

    private final List<StatementTableExtractor> extractors;

    public TableExtractorRegistry(List<StatementTableExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public List<Map<String, Object>> extract(ImportFileKind kind, byte[] content, String password) {
        if (kind == null || kind == ImportFileKind.UNKNOWN) return List.of();
        for (StatementTableExtractor extractor : extractors) {
            if (extractor.supports(kind)) {
                return extractor.extract(content, password);
            }
        }
        return List.of();
    }
}
