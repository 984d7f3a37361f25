package com.ledgerlens.backend.services.imports.normalization;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statement amount text to a decimal. Currency markers, grouping commas, whitespace and
 * parentheses are dropped; parentheses do not negate. Trailing text after the number
 * ("1200.50Cr") is ignored. Values with more integer digits than a {@code numeric(19,2)} column
 * holds are unparseable; values below half a paisa read as zero.
 */
public final class AmountParser {

    private static final Pattern INR = Pattern.compile("INR", Pattern.CASE_INSENSITIVE);
    private static final Pattern NOISE = Pattern.compile("[₹,\\s\\u00a0()]");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    static final int MAX_INTEGER_DIGITS = 17;

    private AmountParser() {
    }

    /**
     * @return the parsed amount, or {@code null} when nothing numeric is left after cleanup
     */
    public static BigDecimal parse(String value) {
        if (value == null) return null;
        String cleaned = INR.matcher(value).replaceAll("");
        cleaned = NOISE.matcher(cleaned).replaceAll("");
        if (cleaned.isEmpty()) return null;

        Matcher m = LEADING_NUMBER.matcher(cleaned);
        if (!m.find()) return null;
        BigDecimal amount;
        try {
            amount = new BigDecimal(m.group());
        } catch (NumberFormatException e) {
            return null;
        }
        if (amount.signum() == 0) return BigDecimal.ZERO;

        // long: precision - scale overflows int for exponents near the int range
        long integerDigits = (long) amount.precision() - amount.scale();
        if (integerDigits > MAX_INTEGER_DIGITS) return null;
        if (integerDigits < -2) return BigDecimal.ZERO;
        return amount.scale() > 2 ? amount.setScale(2, RoundingMode.HALF_UP) : amount;
    }

    /**
     * Same as {@link #parse(String)} but treats unparseable text as zero.
     */
    public static BigDecimal parseOrZero(String value) {
        BigDecimal parsed = parse(value);
        return parsed == null ? BigDecimal.ZERO : parsed;
    }
}
