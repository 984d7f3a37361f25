package com.ledgerlens.backend.services.imports.normalization;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.services.imports.CanonicalTransaction;
import com.ledgerlens.backend.services.imports.description.DescriptionParseResult;
import com.ledgerlens.backend.services.imports.description.DescriptionResolver;
import com.ledgerlens.backend.services.imports.description.KnownMerchants;
import com.ledgerlens.backend.services.imports.description.sbi.SbiNarrationParser;

import lombok.RequiredArgsConstructor;

/**
 * Maps one raw row, whatever its column names, onto a {@link CanonicalTransaction}.
 * Rows without a usable date are rejected (empty result); the fingerprint is left unset.
 */
@Component
@RequiredArgsConstructor
public class RowNormalizer {

    static final List<String> DATE_ALIASES = List.of("date", "transactiondate", "txndate", "valuedate", "postingdate");
    static final String DEFAULT_DESCRIPTION = "Imported";

    private static final Pattern CREDIT_TYPE = Pattern.compile("income|credit|deposit");
    private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Za-z]{3}$");

    private static final Pattern PM_UPI = Pattern.compile("\\bupi\\b|upvdr|upi/");
    private static final Pattern PM_POS = Pattern.compile("\\bpos\\b|pos atm");
    private static final Pattern PM_ATM = Pattern.compile("\\batm\\b|atm wdl|atm cash");
    private static final Pattern PM_NEFT = Pattern.compile("\\bneft\\b");
    private static final Pattern PM_IMPS = Pattern.compile("\\bimps\\b");
    private static final Pattern PM_INB = Pattern.compile("\\binb\\b|internet banking");
    private static final Pattern PM_CARD = Pattern.compile("visa|mastercard|rupay");

    private final StatementDateParser dateParser;
    private final DescriptionResolver descriptionResolver;
    private final SbiNarrationParser sbiNarrationParser;
    private final ImportProperties importProperties;

    public Optional<CanonicalTransaction> normalize(Map<String, Object> row) {
        HeaderLookup lookup = HeaderLookup.of(row);

        Optional<Instant> date = resolveDate(lookup);
        if (date.isEmpty()) return Optional.empty();

        String rawDescription = collapseWhitespace(
                lookup.first("description", "details", "narration", "particulars", "remarks"));
        if (rawDescription.isEmpty()) rawDescription = DEFAULT_DESCRIPTION;

        DescriptionParseResult sbi = sbiNarrationParser.parse(rawDescription);
        String description = sbi.isResolved() ? sbi.cleanDescription() : descriptionResolver.resolve(rawDescription);
        if (description == null || description.isEmpty()) description = rawDescription;

        String merchant = resolveMerchant(lookup, sbi, description);
        String paymentMethod = resolvePaymentMethod(lookup, sbi, rawDescription);

        Map<String, Object> rawData = new LinkedHashMap<>();
        if (row != null) rawData.putAll(row);
        rawData.putAll(sbi.meta());
        rawData.put("sbi_type", sbi.type().wireValue());

        return Optional.of(CanonicalTransaction.builder()
                .date(date.get())
                .amount(resolveAmount(lookup))
                .currency(resolveCurrency(lookup))
                .description(description)
                .merchant(merchant)
                .paymentMethod(paymentMethod)
                .status(normalizeStatus(lookup.get("status")))
                .rawData(rawData)
                .build());
    }

    private Optional<Instant> resolveDate(HeaderLookup lookup) {
        for (String alias : DATE_ALIASES) {
            Optional<Instant> parsed = dateParser.parse(lookup.get(alias));
            if (parsed.isPresent()) return parsed;
        }
        return Optional.empty();
    }

    /**
     * Split withdrawal/deposit columns win over a single amount column. Otherwise the type column
     * decides the sign, and a missing or blank type counts as an expense.
     */
    static BigDecimal resolveAmount(HeaderLookup lookup) {
        BigDecimal withdrawal = firstNonZero(AmountParser.parse(lookup.get("withdrawal")), AmountParser.parse(lookup.get("debit")));
        BigDecimal deposit = firstNonZero(AmountParser.parse(lookup.get("deposit")), AmountParser.parse(lookup.get("credit")));

        if (withdrawal.signum() > 0 || deposit.signum() > 0) {
            return deposit.signum() > 0 ? deposit.abs() : withdrawal.abs().negate();
        }

        BigDecimal amount = AmountParser.parseOrZero(lookup.get("amount"));
        String type = lookup.get("type").toLowerCase(Locale.ROOT);
        return CREDIT_TYPE.matcher(type).find() ? amount.abs() : amount.abs().negate();
    }

    private String resolveCurrency(HeaderLookup lookup) {
        String currency = lookup.get("currency");
        if (CURRENCY_CODE.matcher(currency).matches()) return currency.toUpperCase(Locale.ROOT);
        return importProperties.defaultCurrency();
    }

    private static String resolveMerchant(HeaderLookup lookup, DescriptionParseResult sbi, String description) {
        if (!CanonicalTransaction.UNKNOWN_MERCHANT.equals(sbi.merchant())) return sbi.merchant();

        String column = lookup.first("merchant", "merchantname", "product", "merchantcategory", "seller", "vendor");
        if (!column.isEmpty()) return column;

        return KnownMerchants.GENERIC.match(description).orElse(CanonicalTransaction.UNKNOWN_MERCHANT);
    }

    private static String resolvePaymentMethod(HeaderLookup lookup, DescriptionParseResult sbi, String rawDescription) {
        String column = lookup.first("paymentmethod", "mode", "paymenttype");
        if (!column.isEmpty()) return column;
        if (sbi.isResolved()) return sbi.type().wireValue();
        return inferPaymentMethod(rawDescription);
    }

    static String inferPaymentMethod(String rawDescription) {
        String d = rawDescription.toLowerCase(Locale.ROOT);
        if (PM_UPI.matcher(d).find()) return "upi";
        if (PM_POS.matcher(d).find()) return "pos";
        if (PM_ATM.matcher(d).find()) return "atm";
        if (PM_NEFT.matcher(d).find()) return "neft";
        if (PM_IMPS.matcher(d).find()) return "imps";
        if (PM_INB.matcher(d).find()) return "inb";
        if (PM_CARD.matcher(d).find()) return "card";
        return "unknown";
    }

    static String normalizeStatus(String value) {
        String status = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        if (status.contains("refund")) return "refunded";
        if (status.contains("cancel")) return "cancelled";
        if (status.contains("fail")) return "failed";
        if (status.contains("complete") || status.contains("success")) return "completed";
        return status.isEmpty() ? "completed" : status;
    }

    // SBI exports embed line breaks inside narrations
    static String collapseWhitespace(String value) {
        return value.replaceAll("\\s*\\n\\s*", " ")
                .replaceAll("\\s{2,}", " ")
                .trim();
    }

    private static BigDecimal firstNonZero(BigDecimal first, BigDecimal second) {
        if (first != null && first.signum() != 0) return first;
        if (second != null && second.signum() != 0) return second;
        return BigDecimal.ZERO;
    }
}
