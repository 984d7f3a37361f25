package com.ledgerlens.backend.services.imports.description;

import java.util.Optional;
import java.util.regex.Pattern;

public class AtmWithdrawalRule implements NarrationRule {

    private static final Pattern ATM_WDL = Pattern.compile("ATM\\s+WDL", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<String> apply(String narration) {
        return ATM_WDL.matcher(narration).find() ? Optional.of("ATM Withdrawal") : Optional.empty();
    }
}
