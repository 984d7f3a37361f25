package com.ledgerlens.backend.services.imports.description;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * "WDL TFR INB Amazon Seller Services... AT 04413 PBB NELLORE" -> "Amazon".
 */
public class InternetBankingRule implements NarrationRule {

    private static final Pattern INB = Pattern.compile("\\bINB\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CHANNEL_TOKENS = Pattern.compile("\\b(WDL|TFR|INB)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BRANCH_SUFFIX = Pattern.compile("\\bAT\\s+\\d+.*", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<String> apply(String narration) {
        if (!INB.matcher(narration).find()) return Optional.empty();

        String rest = CHANNEL_TOKENS.matcher(narration).replaceAll("");
        rest = BRANCH_SUFFIX.matcher(rest).replaceFirst("").trim();
        if (rest.length() <= 2) return Optional.empty();

        String name = rest;
        return Optional.of(KnownMerchants.GENERIC.match(name).orElseGet(() -> TitleCase.of(name)));
    }
}
