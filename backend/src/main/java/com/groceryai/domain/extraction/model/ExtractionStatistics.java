package com.groceryai.domain.extraction.model;

/**
 * Statistics over an item list. HIGH and MEDIUM items count as high confidence,
 * LOW and VERY_LOW as low confidence.
 */
public record ExtractionStatistics(
        int totalItems,
        int highConfidenceCount,
        int lowConfidenceCount,
        double averageConfidence,
        int uncertainItemsCount
) {}
