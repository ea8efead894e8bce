package com.groceryai.domain.extraction.model;

import java.util.List;
import java.util.Map;

/**
 * Aggregate confidence statistics over a batch of items.
 *
 * @param averageConfidence   mean confidence, rounded to 3 decimals
 * @param minConfidence       lowest confidence, rounded to 3 decimals
 * @param maxConfidence       highest confidence, rounded to 3 decimals
 * @param distribution        item count per confidence level (all four levels present)
 * @param lowConfidenceItems  items below the threshold, in input order
 * @param totalItems          number of items
 * @param threshold           the threshold used to select low-confidence items
 */
public record BatchConfidenceReport(
        double averageConfidence,
        double minConfidence,
        double maxConfidence,
        Map<ConfidenceLevel, Integer> distribution,
        List<LowConfidenceItem> lowConfidenceItems,
        int totalItems,
        double threshold
) {
    public BatchConfidenceReport {
        distribution = Map.copyOf(distribution);
        lowConfidenceItems = List.copyOf(lowConfidenceItems);
    }

    public int itemsBelowThreshold() {
        return lowConfidenceItems.size();
    }

    public record LowConfidenceItem(String name, double confidence, List<UncertaintyReason> reasons) {}
}
