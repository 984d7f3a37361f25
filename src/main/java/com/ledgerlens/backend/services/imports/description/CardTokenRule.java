package com.ledgerlens.backend.services.imports.description;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Bare gateway tokens such as "PYU.XR12AB34CD" carry no merchant.
 */
public class CardTokenRule implements NarrationRule {

    private static final Pattern TOKEN = Pattern.compile("^[A-Z]{2,5}\\.[A-Z0-9-]{8,}$", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<String> apply(String narration) {
        return TOKEN.matcher(narration).matches() ? Optional.of("Card/UPI transaction") : Optional.empty();
    }
}
