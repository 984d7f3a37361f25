package com.ledgerlens.backend.services.imports.description;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Branch cash deposits and cash deposit machine (CEMTEX) credits.
 */
public class CashDepositRule implements NarrationRule {

    static final String CASH_DEPOSIT = "Cash Deposit";

    private static final Pattern CASH = Pattern.compile("CASH\\s+DEPOSIT", Pattern.CASE_INSENSITIVE);
    private static final Pattern CEMTEX = Pattern.compile("CEMTEX\\s+DEP", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER_TOKEN = Pattern.compile("\\b\\d+\\b");

    @Override
    public Optional<String> apply(String narration) {
        if (CASH.matcher(narration).find()) return Optional.of(CASH_DEPOSIT);
        if (!CEMTEX.matcher(narration).find()) return Optional.empty();

        String rest = CEMTEX.matcher(narration).replaceFirst("");
        rest = NUMBER_TOKEN.matcher(rest).replaceAll("").trim();
        if (rest.length() <= 2) return Optional.of(CASH_DEPOSIT);

        String name = rest;
        return Optional.of(KnownMerchants.GENERIC.match(name).orElseGet(() -> TitleCase.of(name)));
    }
}
