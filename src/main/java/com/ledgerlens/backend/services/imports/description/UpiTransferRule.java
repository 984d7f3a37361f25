package com.ledgerlens.backend.services.imports.description;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "WDL TFR UPI/DR/931523643407/SHAIK YA/SBIN/..." -> "Shaik Ya". Also covers IMPS and NEFT
 * narrations and the UPVDR/UPS spellings some banks use.
 */
public class UpiTransferRule implements NarrationRule {

    private static final Pattern UPI = Pattern.compile(
            "(?:UPI|UPVDR|UPS|IMPS|NEFT)(?:/|-)(?:DR|CR)?(?:/|-)?\\d+(?:/|-)([^/]+)(?:/|-)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_NOISE = Pattern.compile("[0-9._-]+$");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");

    @Override
    public Optional<String> apply(String narration) {
        Matcher m = UPI.matcher(narration);
        if (!m.find()) return Optional.empty();

        String name = TRAILING_NOISE.matcher(m.group(1).trim()).replaceAll("").trim();
        if (name.length() <= 2 || DIGITS.matcher(name).matches()) return Optional.empty();

        return Optional.of(KnownMerchants.GENERIC.match(name).orElseGet(() -> TitleCase.of(name)));
    }
}
