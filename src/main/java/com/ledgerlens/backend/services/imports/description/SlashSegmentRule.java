package com.ledgerlens.backend.services.imports.description;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits slash/pipe/arrow delimited narrations and keeps the first segment that is not a code,
 * an id, a bank name or a channel token.
 */
public class SlashSegmentRule implements NarrationRule {

    private static final Pattern SEPARATORS = Pattern.compile("[/|>]");
    private static final Pattern PUNCTUATION = Pattern.compile("[._-]+");

    private static final Pattern[] NOISE_PATTERNS = {
            Pattern.compile("^[A-Z0-9._-]{10,}$"),
            Pattern.compile("^[0-9]{6,}$"),
            Pattern.compile("^ICI[A-Z0-9]+$"),
            Pattern.compile("^[A-Z]{2,5}\\d{6,}$")
    };

    private static final Set<String> NOISE_WORDS = Set.of(
            "UPI", "IMPS", "NEFT", "RTGS", "ACH", "NACH", "CREDIT", "DEBIT", "PAYMENT", "TRANSFER",
            "BANK", "AXIS BANK", "HDFC BANK", "SBI", "ICICI", "YES BANK", "KOTAK", "WDL", "TFR", "POS", "MB"
    );

    @Override
    public Optional<String> apply(String narration) {
        if (!narration.contains("/")) return Optional.empty();

        for (String raw : SEPARATORS.split(narration)) {
            String part = raw.trim();
            if (part.isEmpty() || isNoise(part)) continue;
            if (part.length() < 3 || part.contains("@")) continue;
            return Optional.of(TitleCase.of(PUNCTUATION.matcher(part).replaceAll(" ")));
        }
        return Optional.empty();
    }

    static boolean isNoise(String segment) {
        String upper = segment.trim().toUpperCase(Locale.ROOT);
        if (upper.isEmpty()) return true;
        for (Pattern p : NOISE_PATTERNS) {
            if (p.matcher(upper).matches()) return true;
        }
        return NOISE_WORDS.contains(upper);
    }
}
