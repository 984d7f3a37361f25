package com.ledgerlens.backend.services.imports.classification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Collapses descriptions that differ only in ids, dates or amounts
 * ("SWIGGY ORDER #12345" and "SWIGGY ORDER #67890" both become "swiggy order #ORDER"),
 * so one classifier lookup serves the whole group.
 */
public final class DescriptionNormalizer {

    private record Replacement(Pattern pattern, String replacement) {
    }

    private static final List<Replacement> REPLACEMENTS = List.of(
            // order numbers: #12345, #123-4567890-1234567
            new Replacement(Pattern.compile("#\\d+[-\\d]*"), "#ORDER"),
            new Replacement(Pattern.compile("\\btxn_\\d+", Pattern.CASE_INSENSITIVE), "txn_XXXXX"),
            new Replacement(Pattern.compile("UPI/([^/]+)/\\d+", Pattern.CASE_INSENSITIVE), "upi/$1/XXXXXXXXX"),
            // numbered UPI handles: swiggy-12345@ybl
            new Replacement(Pattern.compile("-\\d+@"), "-XXXXX@"),
            new Replacement(Pattern.compile("\\b\\d{1,2}[/-]\\d{1,2}[/-]\\d{4}\\b"), "DD/MM/YYYY"),
            new Replacement(Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b"), "YYYY-MM-DD"),
            new Replacement(Pattern.compile("\\b(RS\\.?|INR|₹)\\s*(\\d+\\.?\\d*)", Pattern.CASE_INSENSITIVE), "$1 XXXX.XX"),
            new Replacement(Pattern.compile("\\b\\d{5,}\\b"), "XXXXX")
    );

    private DescriptionNormalizer() {
    }

    public static String normalize(String description) {
        if (description == null) return "";
        String normalized = description.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) return "";

        for (Replacement r : REPLACEMENTS) {
            normalized = r.pattern().matcher(normalized).replaceAll(r.replacement());
        }
        return normalized;
    }

    /**
     * Normalized key to the distinct originals sharing it, both in first-seen order.
     * Descriptions that normalize to "" are left out.
     */
    public static Map<String, List<String>> group(List<String> descriptions) {
        Map<String, Set<String>> groups = new LinkedHashMap<>();
        for (String description : descriptions) {
            String key = normalize(description);
            if (key.isEmpty()) continue;
            groups.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(description);
        }

        Map<String, List<String>> out = new LinkedHashMap<>();
        groups.forEach((k, v) -> out.put(k, new ArrayList<>(v)));
        return out;
    }
}
