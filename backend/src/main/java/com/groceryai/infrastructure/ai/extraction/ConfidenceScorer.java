package com.groceryai.infrastructure.ai.extraction;

import com.groceryai.domain.extraction.model.BatchConfidenceReport;
import com.groceryai.domain.extraction.model.BatchConfidenceReport.LowConfidenceItem;
import com.groceryai.domain.extraction.model.ConfidenceLevel;
import com.groceryai.domain.extraction.model.ExtractedItem;
import com.groceryai.domain.extraction.model.ExtractionResult;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-factor item confidence and batch statistics.
 * <p>
 * Item score = 0.5 model + 0.2 completeness + 0.15 specificity + 0.15 consistency.
 */
public class ConfidenceScorer {

    static final double MODEL_CONFIDENCE_WEIGHT = 0.5;
    static final double COMPLETENESS_WEIGHT = 0.2;
    static final double SPECIFICITY_WEIGHT = 0.15;
    static final double CONSISTENCY_WEIGHT = 0.15;

    public static final double DEFAULT_THRESHOLD = 0.7;

    private final double baseThreshold;

    public ConfidenceScorer(double baseThreshold) {
        this.baseThreshold = baseThreshold;
    }

    public ConfidenceScorer() {
        this(DEFAULT_THRESHOLD);
    }

    public double calculateItemConfidence(ExtractedItem item) {
        double score = MODEL_CONFIDENCE_WEIGHT * item.confidence()
                + COMPLETENESS_WEIGHT * completeness(item)
                + SPECIFICITY_WEIGHT * specificity(item)
                + CONSISTENCY_WEIGHT * consistency(item);
        return round3(score);
    }

    /**
     * New result whose item confidences are the calibrated values. The input is not modified.
     */
    public ExtractionResult recalibrate(ExtractionResult result) {
        List<ExtractedItem> calibrated = result.items().stream()
                .map(item -> item.withConfidence(calculateItemConfidence(item)))
                .toList();
        return result.withItems(calibrated);
    }

    public BatchConfidenceReport calculateBatchConfidence(List<ExtractedItem> items) {
        return calculateBatchConfidence(items, baseThreshold);
    }

    public BatchConfidenceReport calculateBatchConfidence(List<ExtractedItem> items, double threshold) {
        Map<ConfidenceLevel, Integer> distribution = new EnumMap<>(ConfidenceLevel.class);
        for (ConfidenceLevel level : ConfidenceLevel.values()) {
            distribution.put(level, 0);
        }
        if (items.isEmpty()) {
            return new BatchConfidenceReport(0.0, 0.0, 0.0, distribution, List.of(), 0, threshold);
        }

        double sum = 0.0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (ExtractedItem item : items) {
            double confidence = item.confidence();
            sum += confidence;
            min = Math.min(min, confidence);
            max = Math.max(max, confidence);
            distribution.merge(item.confidenceLevel(), 1, Integer::sum);
        }

        List<LowConfidenceItem> lowConfidence = items.stream()
                .filter(item -> item.confidence() < threshold)
                .map(item -> new LowConfidenceItem(item.name(), item.confidence(), item.uncertaintyReasons()))
                .toList();

        return new BatchConfidenceReport(round3(sum / items.size()), round3(min), round3(max),
                distribution, lowConfidence, items.size(), threshold);
    }

    double completeness(ExtractedItem item) {
        double score = 0.0;
        if (item.name().length() >= 2) {
            score += 0.4;
        }
        if (item.quantity() != 1.0 || item.hasOriginalText()) {
            score += 0.2;
        }
        if (!ExtractedItem.DEFAULT_UNIT.equals(item.unit())) {
            score += 0.2;
        }
        if (!item.specifications().isEmpty()) {
            score += 0.1;
        }
        if (item.hasOriginalText()) {
            score += 0.1;
        }
        return Math.min(1.0, score);
    }

    double specificity(ExtractedItem item) {
        double score = 0.5;
        int words = item.name().trim().split("\\s+").length;
        if (words > 1) {
            score += 0.1;
        }
        if (words > 2) {
            score += 0.1;
        }
        score += 0.1 * Math.min(item.specifications().size(), 3);
        return Math.min(1.0, score);
    }

    double consistency(ExtractedItem item) {
        double score = 0.7;
        String unit = item.unit();
        if (item.quantity() > 100 && "piece".equals(unit)) {
            score -= 0.2;
        }
        if (item.quantity() < 0.01 && ("kg".equals(unit) || "lb".equals(unit))) {
            score -= 0.2;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
