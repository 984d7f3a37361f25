package com.ledgerlens.backend.services.imports.description;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "POS ATM PURCH OTHPG 3157043273 36Swiggy 911311221" -> "Swiggy".
 */
public class PosPurchaseRule implements NarrationRule {

    private static final Pattern POS = Pattern.compile(
            "POS\\s+ATM\\s+PURCH\\s+\\w+\\s+\\d+\\s*\\n?\\s*\\d*([A-Za-z*]+[A-Za-z\\s]*)",
            Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<String> apply(String narration) {
        Matcher m = POS.matcher(narration);
        if (!m.find()) return Optional.empty();

        String merchant = m.group(1).replaceFirst("^\\d+", "").replace("*", "").trim();
        merchant = merchant.replaceFirst("\\s+\\d+$", "").trim();
        if (merchant.length() <= 2) return Optional.empty();

        String name = merchant;
        return Optional.of(KnownMerchants.GENERIC.match(name).orElseGet(() -> TitleCase.of(name)));
    }
}
