package com.ledgerlens.backend.services.imports.classification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.ledgerlens.backend.services.imports.CanonicalTransaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies a batch with one classifier call: rows are grouped by normalized description,
 * the first description seen in each group is sent as its representative and the answer is
 * applied to every row of the group.
 * <p>
 * Only the representative is ever classified. The other raw descriptions of a group, and their
 * merchants, inherit its answer even when their own keywords would point elsewhere; this holds for
 * the keyword fallback too.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClassificationResolver {

    private final Classifier classifier;

    public void resolve(List<CanonicalTransaction> rows, String accessToken) {
        if (rows == null || rows.isEmpty()) return;

        Map<String, List<CanonicalTransaction>> groups = new LinkedHashMap<>();
        for (CanonicalTransaction row : rows) {
            String key = DescriptionNormalizer.normalize(row.getDescription());
            if (key.isEmpty()) continue;
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        if (groups.isEmpty()) return;

        List<ClassificationQuery> queries = groups.values().stream()
                .map(group -> group.get(0))
                .map(first -> new ClassificationQuery(first.getDescription(), first.getMerchant()))
                .toList();

        Map<String, String> categories = classifier.classify(queries, accessToken);

        int applied = 0;
        for (List<CanonicalTransaction> group : groups.values()) {
            String category = categories.get(group.get(0).getDescription());
            if (category == null || category.isBlank()) continue;
            for (CanonicalTransaction row : group) {
                row.setCategory(category);
                applied++;
            }
        }

        log.info("[Classification] rows={} groups={} categorized={}", rows.size(), groups.size(), applied);
    }
}
