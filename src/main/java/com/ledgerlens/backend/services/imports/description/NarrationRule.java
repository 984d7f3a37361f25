package com.ledgerlens.backend.services.imports.description;

import java.util.Optional;

/**
 * One step of the generic narration cascade. Receives the narration trimmed and with
 * whitespace runs collapsed; returns a readable description or empty to defer to the next rule.
 */
@FunctionalInterface
public interface NarrationRule {

    Optional<String> apply(String narration);
}
