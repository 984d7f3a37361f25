package com.ledgerlens.backend.services.imports.extraction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bank spreadsheets often start with a block of account metadata, so the first row is
 * rarely the real header. This finds the row that actually names the columns.
 */
final class SpreadsheetHeaderRepair {

    static final List<String> HEADER_KEYWORDS = List.of(
            "date", "txn", "transaction", "value", "description", "narration",
            "debit", "credit", "amount", "withdrawal", "deposit", "balance",
            "ref", "chq", "cheque", "particulars", "remark"
    );

    static final int MAX_SCAN_ROWS = 30;

    private SpreadsheetHeaderRepair() {
    }

    static List<Map<String, Object>> repair(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) return rows == null ? List.of() : rows;

        List<String> keys = new ArrayList<>(rows.get(0).keySet());
        boolean allSynthetic = !keys.isEmpty()
                && keys.stream().allMatch(k -> k.startsWith(SpreadsheetTableExtractor.EMPTY_HEADER));
        boolean headersLookGood = !allSynthetic && keys.stream().anyMatch(SpreadsheetHeaderRepair::looksLikeHeader);
        if (headersLookGood) return rows;

        int headerIndex = -1;
        int scan = Math.min(rows.size(), MAX_SCAN_ROWS);
        for (int i = 0; i < scan; i++) {
            long matches = rows.get(i).values().stream()
                    .map(SpreadsheetHeaderRepair::text)
                    .filter(SpreadsheetHeaderRepair::looksLikeHeader)
                    .count();
            if (matches >= 2) {
                headerIndex = i;
                break;
            }
        }

        if (headerIndex == -1) {
            if (!allSynthetic) return rows;
            return rebuild(rows, keys, 0);
        }
        return rebuild(rows, keys, headerIndex);
    }

    private static List<Map<String, Object>> rebuild(List<Map<String, Object>> rows, List<String> keys, int headerIndex) {
        Map<String, Object> headerRow = rows.get(headerIndex);
        List<String> headers = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            String value = text(headerRow.get(keys.get(i)));
            headers.add(value.isEmpty() ? "column_" + (i + 1) : value);
        }

        List<Map<String, Object>> out = new ArrayList<>();
        for (int r = headerIndex + 1; r < rows.size(); r++) {
            Map<String, Object> source = rows.get(r);
            Map<String, Object> row = new LinkedHashMap<>();
            boolean blank = true;
            for (int i = 0; i < keys.size(); i++) {
                Object value = source.get(keys.get(i));
                if (!text(value).isEmpty()) blank = false;
                row.put(headers.get(i), value == null ? "" : value);
            }
            if (!blank) out.add(row);
        }
        return out;
    }

    private static boolean looksLikeHeader(String value) {
        String lower = value.toLowerCase(Locale.ROOT).trim();
        for (String kw : HEADER_KEYWORDS) {
            if (lower.contains(kw)) return true;
        }
        return false;
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }
}
