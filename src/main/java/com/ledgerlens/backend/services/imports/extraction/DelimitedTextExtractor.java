package com.ledgerlens.backend.services.imports.extraction;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import com.ledgerlens.backend.enums.ImportFileKind;
import com.ledgerlens.backend.exceptions.StatementFormatException;

import lombok.extern.slf4j.Slf4j;

/**
 * CSV, TSV and plain text statements. The delimiter is sniffed from the header line.
 */
@Slf4j
@Component
public class DelimitedTextExtractor implements StatementTableExtractor {

    static final char[] CANDIDATE_DELIMITERS = {',', '\t', '|', ';'};

    @Override
    public boolean supports(ImportFileKind kind) {
        return kind == ImportFileKind.CSV || kind == ImportFileKind.TEXT;
    }

    @Override
    public List<Map<String, Object>> extract(byte[] content, String password) {
        if (content == null || content.length == 0) return List.of();
        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return extractText(text);
    }

    public List<Map<String, Object>> extractText(String text) {
        if (text == null) return List.of();

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) lines.add(trimmed);
        }
        if (lines.isEmpty()) return List.of();

        char delimiter = sniffDelimiter(lines.get(0));
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();

        List<Map<String, Object>> rows = new ArrayList<>();
        try (CSVParser parser = format.parse(new StringReader(String.join("\n", lines)))) {
            List<String> headers = null;
            for (CSVRecord record : parser) {
                if (headers == null) {
                    headers = new ArrayList<>();
                    for (String h : record) headers.add(h == null ? "" : h);
                    continue;
                }
                rows.add(toRow(headers, record));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new StatementFormatException("Could not parse delimited text: " + e.getMessage(), e);
        }

        log.debug("[DelimitedText] delimiter='{}' rows={}", printable(delimiter), rows.size());
        return rows;
    }

    static char sniffDelimiter(String headerLine) {
        char selected = ',';
        int bestScore = -1;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int score = countFields(headerLine, candidate);
            if (score > bestScore) {
                bestScore = score;
                selected = candidate;
            }
        }
        return selected;
    }

    private static int countFields(String line, char delimiter) {
        int count = 1;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == delimiter) count++;
        }
        return count;
    }

    // Missing trailing cells become "", a repeated header keeps the last value
    private static Map<String, Object> toRow(List<String> headers, CSVRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String value = i < record.size() ? record.get(i) : "";
            row.put(headers.get(i), value == null ? "" : value);
        }
        return row;
    }

    private static String printable(char c) {
        return c == '\t' ? "\\t" : String.valueOf(c);
    }
}
