package com.ledgerlens.backend.services.imports.description;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

/**
 * Turns a raw bank narration into a short readable description by running an ordered list of
 * {@link NarrationRule}s; the first rule that answers wins.
 */
@Component
public class DescriptionResolver {

    private final List<NarrationRule> rules;

    public DescriptionResolver() {
        this(defaultRules());
    }

    public DescriptionResolver(List<NarrationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<NarrationRule> defaultRules() {
        return List.of(
                new KnownMerchantRule(KnownMerchants.GENERIC),
                new UpiTransferRule(),
                new PosPurchaseRule(),
                new ForeignRefundRule(),
                new AtmWithdrawalRule(),
                new CashDepositRule(),
                new InternetBankingRule(),
                new SlashSegmentRule(),
                new CardTokenRule(),
                new CleanupFallbackRule()
        );
    }

    public String resolve(String rawNarration) {
        if (rawNarration == null || rawNarration.isBlank()) return CleanupFallbackRule.IMPORTED_TRANSACTION;
        String narration = rawNarration.replaceAll("\\s+", " ").trim();

        for (NarrationRule rule : rules) {
            Optional<String> result = rule.apply(narration);
            if (result.isPresent() && !result.get().isEmpty()) return result.get();
        }
        return narration;
    }
}
