package com.ledgerlens.backend.services.imports.description;

import java.util.Optional;

public class KnownMerchantRule implements NarrationRule {

    private final KnownMerchants merchants;

    public KnownMerchantRule(KnownMerchants merchants) {
        this.merchants = merchants;
    }

    @Override
    public Optional<String> apply(String narration) {
        return merchants.match(narration);
    }
}
