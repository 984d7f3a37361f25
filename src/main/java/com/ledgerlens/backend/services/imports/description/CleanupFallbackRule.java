package com.ledgerlens.backend.services.imports.description;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Last resort: strip channel tokens, digits and punctuation and title-case what is left.
 * Always produces a value.
 */
public class CleanupFallbackRule implements NarrationRule {

    static final String IMPORTED_TRANSACTION = "Imported transaction";
    static final int MAX_LENGTH = 64;

    private static final Pattern CHANNEL_TOKENS = Pattern.compile(
            "\\b(UPI|IMPS|NEFT|RTGS|ACH|NACH|WDL|TFR|POS|MB|DR|CR|DEP|OTHPG|SBIPG|PURCH|ATM)\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<String> apply(String narration) {
        String cleaned = CHANNEL_TOKENS.matcher(narration).replaceAll("")
                .replaceAll("[0-9]+", " ")
                .replaceAll("[^a-zA-Z\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();

        if (cleaned.isEmpty()) return Optional.of(IMPORTED_TRANSACTION);
        if (cleaned.length() <= MAX_LENGTH) return Optional.of(TitleCase.of(cleaned));
        return Optional.of(TitleCase.of(cleaned.substring(0, MAX_LENGTH - 3).trim()) + "...");
    }
}
