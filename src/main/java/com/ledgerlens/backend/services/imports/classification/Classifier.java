package com.ledgerlens.backend.services.imports.classification;

import java.util.List;
import java.util.Map;

/**
 * Assigns spending categories to descriptions. A description missing from the returned map
 * means "no confident prediction".
 */
public interface Classifier {

    Map<String, String> classify(List<ClassificationQuery> queries, String accessToken);
}
