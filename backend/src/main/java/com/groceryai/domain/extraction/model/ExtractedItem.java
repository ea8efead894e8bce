package com.groceryai.domain.extraction.model;

import java.util.List;

/**
 * A grocery line item recovered from model output.
 *
 * @param name               normalized product name (never blank)
 * @param quantity           positive quantity, 1.0 when the model gave none
 * @param unit               normalized unit, "piece" when the model gave none
 * @param specifications     de-duplicated, trimmed, non-empty specification strings
 * @param confidence         confidence in [0, 1]
 * @param originalText       the source text span the item came from ("" when unknown)
 * @param uncertaintyReasons reasons found by the extraction heuristics
 */
public record ExtractedItem(
        String name,
        double quantity,
        String unit,
        List<String> specifications,
        double confidence,
        String originalText,
        List<UncertaintyReason> uncertaintyReasons
) {
    public static final double DEFAULT_QUANTITY = 1.0;
    public static final String DEFAULT_UNIT = "piece";

    public ExtractedItem {
        specifications = specifications == null ? List.of() : List.copyOf(specifications);
        uncertaintyReasons = uncertaintyReasons == null ? List.of() : List.copyOf(uncertaintyReasons);
        originalText = originalText == null ? "" : originalText;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public ConfidenceLevel confidenceLevel() {
        return ConfidenceLevel.of(confidence);
    }

    public boolean isUncertain() {
        return confidence < 0.7 || !uncertaintyReasons.isEmpty();
    }

    public boolean hasOriginalText() {
        return !originalText.isEmpty();
    }

    public ExtractedItem withConfidence(double newConfidence) {
        return new ExtractedItem(name, quantity, unit, specifications, newConfidence, originalText, uncertaintyReasons);
    }

    public ExtractedItem withUncertainty(double newConfidence, List<UncertaintyReason> reasons) {
        return new ExtractedItem(name, quantity, unit, specifications, newConfidence, originalText, reasons);
    }
}
