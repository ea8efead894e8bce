package com.groceryai.infrastructure.ai.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.groceryai.domain.extraction.model.ExtractedItem;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads quantities the model may emit as numbers, decimal strings, fractions ("1/2")
 * or mixed numbers ("1 1/2"). Anything unusable becomes {@link ExtractedItem#DEFAULT_QUANTITY}.
 */
public final class QuantityParser {

    private static final Pattern MIXED_NUMBER = Pattern.compile("^(\\d+)\\s+(\\d+)\\s*/\\s*(\\d+)$");
    private static final Pattern FRACTION = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*/\\s*(\\d+(?:\\.\\d+)?)$");

    private QuantityParser() {
    }

    public static double parse(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return ExtractedItem.DEFAULT_QUANTITY;
        }
        if (value.isNumber()) {
            return positiveOrDefault(value.asDouble());
        }
        if (value.isTextual()) {
            return parse(value.asText());
        }
        return ExtractedItem.DEFAULT_QUANTITY;
    }

    public static double parse(String value) {
        if (value == null) {
            return ExtractedItem.DEFAULT_QUANTITY;
        }
        String text = value.trim();

        Matcher mixed = MIXED_NUMBER.matcher(text);
        if (mixed.matches()) {
            double denominator = Double.parseDouble(mixed.group(3));
            if (denominator == 0) {
                return ExtractedItem.DEFAULT_QUANTITY;
            }
            return positiveOrDefault(Double.parseDouble(mixed.group(1)) + Double.parseDouble(mixed.group(2)) / denominator);
        }

        Matcher fraction = FRACTION.matcher(text);
        if (fraction.matches()) {
            double denominator = Double.parseDouble(fraction.group(2));
            if (denominator == 0) {
                return ExtractedItem.DEFAULT_QUANTITY;
            }
            return positiveOrDefault(Double.parseDouble(fraction.group(1)) / denominator);
        }

        try {
            return positiveOrDefault(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return ExtractedItem.DEFAULT_QUANTITY;
        }
    }

    private static double positiveOrDefault(double quantity) {
        if (Double.isNaN(quantity) || Double.isInfinite(quantity) || quantity <= 0) {
            return ExtractedItem.DEFAULT_QUANTITY;
        }
        return quantity;
    }
}
