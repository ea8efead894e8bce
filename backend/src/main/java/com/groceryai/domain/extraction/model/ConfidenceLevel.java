package com.groceryai.domain.extraction.model;

public enum ConfidenceLevel {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    VERY_LOW("very_low");

    private final String label;

    ConfidenceLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * HIGH &ge; 0.85, MEDIUM &ge; 0.70, LOW &ge; 0.50, otherwise VERY_LOW.
     */
    public static ConfidenceLevel of(double confidence) {
        if (confidence >= 0.85) {
            return HIGH;
        }
        if (confidence >= 0.70) {
            return MEDIUM;
        }
        if (confidence >= 0.50) {
            return LOW;
        }
        return VERY_LOW;
    }
}
