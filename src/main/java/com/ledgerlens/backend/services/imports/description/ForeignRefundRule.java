package com.ledgerlens.backend.services.imports.description;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Card refunds credited through Visa remittance: "DEP TFR VISA-IN-RMT:300710245915SWIGGY" -> "Swiggy".
 */
public class ForeignRefundRule implements NarrationRule {

    private static final Pattern REFUND = Pattern.compile(
            "DEP\\s+TFR\\s+VISA-IN-RMT:[0-9]+([A-Za-z]+)", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<String> apply(String narration) {
        Matcher m = REFUND.matcher(narration);
        if (!m.find()) return Optional.empty();

        String name = m.group(1).trim();
        Optional<String> known = KnownMerchants.GENERIC.match(name);
        if (known.isPresent()) return known;
        return name.length() > 2 ? Optional.of(TitleCase.of(name)) : Optional.empty();
    }
}
