package com.ledgerlens.backend.services.imports.extraction;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.backend.enums.ImportFileKind;
import com.ledgerlens.backend.exceptions.StatementFormatException;

import lombok.RequiredArgsConstructor;

/**
 * Accepts a top-level array or an object wrapping a {@code transactions} array.
 * Entries that are not JSON objects are dropped.
 */
@Component
@RequiredArgsConstructor
public class JsonStatementExtractor implements StatementTableExtractor {

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Override
    public boolean supports(ImportFileKind kind) {
        return kind == ImportFileKind.JSON;
    }

    @Override
    public List<Map<String, Object>> extract(byte[] content, String password) {
        if (content == null || content.length == 0) return List.of();

        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (IOException e) {
            throw new StatementFormatException("Invalid JSON file. Please check the file format.", e);
        }
        if (root == null || root.isMissingNode()) return List.of();

        JsonNode entries = null;
        if (root.isArray()) {
            entries = root;
        } else if (root.isObject() && root.path("transactions").isArray()) {
            entries = root.get("transactions");
        }
        if (entries == null || entries.isEmpty()) return List.of();

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode entry : entries) {
            if (entry != null && entry.isObject()) {
                rows.add(objectMapper.convertValue(entry, ROW_TYPE));
            }
        }

        if (rows.isEmpty()) {
            throw new StatementFormatException("JSON file contains no valid transaction objects.");
        }
        return rows;
    }
}
