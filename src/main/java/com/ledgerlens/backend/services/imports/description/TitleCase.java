package com.ledgerlens.backend.services.imports.description;

import java.util.Locale;

public final class TitleCase {

    private TitleCase() {
    }

    /**
     * "SHAIK  YASMEEN" -> "Shaik Yasmeen". Splits on single spaces and drops empty parts.
     */
    public static String of(String value) {
        if (value == null) return "";
        StringBuilder out = new StringBuilder(value.length());
        for (String part : value.toLowerCase(Locale.ROOT).split(" ")) {
            if (part.isEmpty()) continue;
            if (out.length() > 0) out.append(' ');
            out.append(Character.toUpperCase(part.charAt(0))).append(part, 1, part.length());
        }
        return out.toString();
    }
}
