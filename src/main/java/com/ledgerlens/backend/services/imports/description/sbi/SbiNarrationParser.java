package com.ledgerlens.backend.services.imports.description.sbi;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.enums.NarrationType;
import com.ledgerlens.backend.services.imports.description.DescriptionParseResult;
import com.ledgerlens.backend.services.imports.description.KnownMerchants;

/**
 * State Bank of India narrations. SBI packs UPI, card, ATM, net banking and deposit details
 * into fixed-width fields, e.g.
 * <pre>
 * WDL TFR UPI/DR/931523643407/SHAIK YA/SBIN/skya smeen1/Paym... AT 04413 PBB NELLORE
 * POS ATM PURCH OTHPG 3155010693 17Pho*PHONEPE RECHARGE BANGALORE
 * ATM WDL ATM CASH 1957 SP OFFICE DARGAMITTA, NELLORE
 * </pre>
 * Patterns are tried in order; anything unrecognized comes back as {@link NarrationType#UNKNOWN}
 * with the narration untouched.
 */
@Component
public class SbiNarrationParser {

    private static final Pattern UPI = Pattern.compile(
            "^(WDL|DEP) TFR\\s+UPI/(DR|CR)/([^/]+)/([^/]+)/([^/]+)/([^/]+)/([^\\s/]+)");
    private static final Pattern POS = Pattern.compile("^POS ATM PURCH\\s+(\\S+)\\s+(\\S+)\\s+(.*)$");
    private static final Pattern ATM = Pattern.compile("^ATM WDL\\s+ATM CASH\\s+(.*)$");
    private static final Pattern INB = Pattern.compile("^WDL TFR\\s+INB\\s+(.*?)(?:\\.\\.\\.|\\s+AT\\s+\\d+)");
    private static final Pattern CASH_SELF_PREFIX = Pattern.compile("^CASH DEPOSIT SELF\\s+AT\\s*");
    private static final Pattern CDM = Pattern.compile("^CEMTEX DEP\\s+(\\S+)");
    private static final Pattern DEP_TFR = Pattern.compile("^DEP TFR\\s+(.*)");
    private static final Pattern WDL_TFR = Pattern.compile("^WDL TFR\\s+(.*)");

    // card reference glued to the merchant: "17Pho*PHONEPE RECHARGE"
    private static final Pattern POS_REF_PREFIX = Pattern.compile("^\\d+[a-zA-Z0-9]*\\*");

    private final KnownMerchants merchants = KnownMerchants.SBI;
    private final List<Function<String, Optional<DescriptionParseResult>>> patterns = List.of(
            this::parseUpi,
            this::parsePos,
            this::parseAtm,
            this::parseInternetBanking,
            this::parseSelfDeposit,
            this::parseCashDepositMachine,
            this::parseRefund,
            this::parseTransferToMerchant
    );

    public DescriptionParseResult parse(String narration) {
        if (narration == null) return DescriptionParseResult.unknown("");
        for (Function<String, Optional<DescriptionParseResult>> pattern : patterns) {
            Optional<DescriptionParseResult> result = pattern.apply(narration);
            if (result.isPresent()) return result.get();
        }
        return DescriptionParseResult.unknown(narration);
    }

    private Optional<DescriptionParseResult> parseUpi(String narration) {
        Matcher m = UPI.matcher(narration);
        if (!m.find()) return Optional.empty();

        String mode = m.group(2);
        String utr = m.group(3);
        String name = cleanName(m.group(4));
        String bank = m.group(5);
        String upiId = cleanName(m.group(6));
        String app = cleanName(m.group(7));

        String merchant = merchants.matchFields(name, upiId, app).orElse(name);
        String description = "CR".equals(mode) ? "UPI Received from " + merchant : "UPI Transfer to " + merchant;

        return Optional.of(new DescriptionParseResult(merchant, description, NarrationType.UPI,
                meta("utr", utr, "bank", bank, "mode", mode, "app", app)));
    }

    private Optional<DescriptionParseResult> parsePos(String narration) {
        Matcher m = POS.matcher(narration);
        if (!m.matches()) return Optional.empty();

        String gateway = m.group(1);
        String ref = m.group(2);
        List<String> parts = new ArrayList<>(splitWords(m.group(3)));
        String location = parts.size() > 1 ? parts.remove(parts.size() - 1) : "";
        String merchantRaw = String.join(" ", parts);

        String merchant = POS_REF_PREFIX.matcher(merchantRaw).replaceFirst("");
        merchant = merchant.replaceFirst("^\\*", "").trim();
        merchant = merchants.matchFields(merchant, merchantRaw).orElse(merchant);

        String description = "POS Purchase at " + merchant + (location.isEmpty() ? "" : " (" + location + ")");
        return Optional.of(new DescriptionParseResult(merchant, description, NarrationType.POS,
                meta("ref", ref, "location", location, "gateway", gateway)));
    }

    private Optional<DescriptionParseResult> parseAtm(String narration) {
        Matcher m = ATM.matcher(narration);
        if (!m.matches()) return Optional.empty();

        List<String> parts = splitWords(m.group(1));
        String atmId = parts.isEmpty() ? "" : parts.get(0);
        int locationStart = 1;
        // short second token is part of the terminal id: "1957 SP"
        if (parts.size() > 1 && parts.get(1).length() <= 3) {
            atmId = parts.get(0) + " " + parts.get(1);
            locationStart = 2;
        }
        String location = parts.size() > locationStart
                ? String.join(" ", parts.subList(locationStart, parts.size()))
                : "";

        String description = "ATM Cash Withdrawal" + (location.isEmpty() ? "" : " at " + location);
        return Optional.of(new DescriptionParseResult("ATM Withdrawal", description, NarrationType.ATM,
                meta("atmId", atmId, "location", location)));
    }

    private Optional<DescriptionParseResult> parseInternetBanking(String narration) {
        Matcher m = INB.matcher(narration);
        if (!m.find()) return Optional.empty();

        String name = cleanName(m.group(1));
        String merchant = merchants.matchFields(name).orElse(name);
        String prefix = merchant.startsWith("Gift") ? "Online Transfer:" : "Online Transfer to";

        return Optional.of(new DescriptionParseResult(merchant, prefix + " " + merchant, NarrationType.INB, Map.of()));
    }

    private Optional<DescriptionParseResult> parseSelfDeposit(String narration) {
        if (!narration.startsWith("CASH DEPOSIT SELF")) return Optional.empty();

        String branch = CASH_SELF_PREFIX.matcher(narration).replaceFirst("").trim();
        String description = "Cash Deposit" + (branch.isEmpty() ? "" : " at " + branch);
        return Optional.of(new DescriptionParseResult("Self Deposit", description, NarrationType.CASH_DEPOSIT,
                meta("branch", branch)));
    }

    private Optional<DescriptionParseResult> parseCashDepositMachine(String narration) {
        Matcher m = CDM.matcher(narration);
        if (!m.find()) return Optional.empty();

        String ref = m.group(1);
        Optional<String> known = merchants.matchFields(narration);
        String merchant = known.orElse("Cash Deposit Machine");
        String description = known
                .map(k -> "CDM Deposit via " + k + " (Ref: " + ref + ")")
                .orElse("CDM Deposit (Ref: " + ref + ")");

        return Optional.of(new DescriptionParseResult(merchant, description, NarrationType.CASH_DEPOSIT,
                meta("ref", ref)));
    }

    private Optional<DescriptionParseResult> parseRefund(String narration) {
        Matcher m = DEP_TFR.matcher(narration);
        if (!m.find()) return Optional.empty();
        return merchants.matchFields(m.group(1))
                .map(k -> new DescriptionParseResult(k, "Refund from " + k, NarrationType.UPI, Map.of()));
    }

    private Optional<DescriptionParseResult> parseTransferToMerchant(String narration) {
        Matcher m = WDL_TFR.matcher(narration);
        if (!m.find()) return Optional.empty();
        return merchants.matchFields(m.group(1))
                .map(k -> new DescriptionParseResult(k, "Payment to " + k, NarrationType.UPI, Map.of()));
    }

    static String cleanName(String raw) {
        return raw.replaceAll("\\s{2,}", " ")
                .replaceFirst("[._-]+$", "")
                .trim();
    }

    private static List<String> splitWords(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return List.of();
        return Arrays.asList(trimmed.split("\\s+"));
    }

    private static Map<String, String> meta(String... pairs) {
        Map<String, String> meta = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            meta.put(pairs[i], pairs[i + 1]);
        }
        return meta;
    }
}
