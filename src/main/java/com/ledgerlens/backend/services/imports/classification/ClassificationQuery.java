package com.ledgerlens.backend.services.imports.classification;

/**
 * A description to classify; the merchant is only used by local matching.
 */
public record ClassificationQuery(String description, String merchant) {
}
