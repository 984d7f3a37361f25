package com.ledgerlens.backend.services.imports.normalization;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Case and punctuation insensitive view over a raw row, so "Transaction Date",
 * "transaction_date" and "TransactionDate" resolve to the same key.
 */
public final class HeaderLookup {

    private final Map<String, String> values = new HashMap<>();

    private HeaderLookup() {
    }

    public static HeaderLookup of(Map<String, Object> row) {
        HeaderLookup lookup = new HeaderLookup();
        if (row == null) return lookup;
        for (Map.Entry<String, Object> e : row.entrySet()) {
            // later duplicates win, same as the row map itself
            lookup.values.put(normalizeHeader(e.getKey()), toText(e.getValue()));
        }
        return lookup;
    }

    public static String normalizeHeader(String header) {
        if (header == null) return "";
        return header.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    /**
     * First non-empty value among the aliases, in order; "" when none has a value.
     */
    public String first(String... aliases) {
        for (String alias : aliases) {
            String v = values.get(alias);
            if (v != null && !v.isEmpty()) return v;
        }
        return "";
    }

    public boolean has(String alias) {
        return values.containsKey(alias);
    }

    public String get(String alias) {
        return values.getOrDefault(alias, "");
    }

    static String toText(Object value) {
        if (value == null) return "";
        return String.valueOf(value).trim();
    }
}
