package com.groceryai.infrastructure.ai.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.groceryai.domain.extraction.model.ExtractedItem;
import com.groceryai.domain.extraction.model.ExtractionResult;
import com.groceryai.domain.extraction.model.UncertaintyReason;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns model text into typed grocery items. Never throws: text without a usable payload
 * yields an empty result that keeps the raw text as unrecognized.
 */
@Slf4j
public class GroceryItemExtractor {

    public static final double DEFAULT_CONFIDENCE = 0.75;
    public static final double DEFAULT_UNCERTAINTY_THRESHOLD = 0.7;

    public static final String PARSE_FAILURE_NOTE = "Failed to parse response as JSON";

    private static final Set<String> BULK_KEYWORDS = Set.of("rice", "flour", "sugar", "salt", "beans", "pasta");
    private static final Pattern AMBIGUOUS_NAME = Pattern.compile(
            "\\b(thing|things|stuff|item|items|food|something)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final JsonBlockLocator jsonBlockLocator;
    private final double uncertaintyThreshold;

    public GroceryItemExtractor(JsonBlockLocator jsonBlockLocator, double uncertaintyThreshold) {
        this.jsonBlockLocator = jsonBlockLocator;
        this.uncertaintyThreshold = uncertaintyThreshold;
    }

    public GroceryItemExtractor(JsonBlockLocator jsonBlockLocator) {
        this(jsonBlockLocator, DEFAULT_UNCERTAINTY_THRESHOLD);
    }

    public ExtractionResult extract(String responseText) {
        Optional<JsonBlockLocator.Located> located = jsonBlockLocator.locate(responseText);
        if (located.isEmpty()) {
            log.error("Failed to extract JSON from response ({} chars)",
                    responseText == null ? 0 : responseText.length());
            return ExtractionResult.failed(responseText, PARSE_FAILURE_NOTE);
        }

        JsonNode root = located.get().node();
        JsonNode rawItems = root.isArray() ? root : root.path("items");
        List<ExtractedItem> items = new ArrayList<>();
        for (JsonNode rawItem : rawItems) {
            if (!rawItem.isObject()) {
                log.warn("Skipping non-object item: {}", abbreviate(rawItem.toString()));
                continue;
            }
            parseItem(rawItem).map(this::applyUncertainty).ifPresent(items::add);
        }

        logUncertainItems(items);

        List<String> unrecognized = root.isObject() ? stringList(root.get("unrecognized_text")) : List.of();
        String notes = root.isObject() ? root.path("parsing_notes").asText("") : "";
        return new ExtractionResult(items, unrecognized, notes, responseText);
    }

    private Optional<ExtractedItem> parseItem(JsonNode raw) {
        String name = normalizeName(raw.path("name").asText(""));
        if (name.isEmpty()) {
            log.warn("Skipping item without a name: {}", abbreviate(raw.toString()));
            return Optional.empty();
        }

        double quantity = QuantityParser.parse(raw.get("quantity"));
        JsonNode rawUnit = raw.get("unit");
        String unit = UnitNormalizer.normalize(rawUnit != null && rawUnit.isValueNode() && !rawUnit.isNull()
                ? rawUnit.asText() : null);
        List<String> specifications = stringList(raw.get("specifications"));
        double confidence = parseConfidence(raw.get("confidence"));

        JsonNode source = raw.hasNonNull("original_text") ? raw.get("original_text") : raw.get("raw_text_segment");
        String originalText = source != null && source.isValueNode() ? source.asText() : "";

        return Optional.of(new ExtractedItem(name, quantity, unit, specifications, confidence, originalText, List.of()));
    }

    /**
     * Flags heuristically doubtful items and lowers an otherwise confident score by 0.1 per
     * reason, never below 0.5.
     */
    ExtractedItem applyUncertainty(ExtractedItem item) {
        List<UncertaintyReason> reasons = new ArrayList<>();
        String lowerName = item.name().toLowerCase(Locale.ROOT);

        if (item.quantity() == ExtractedItem.DEFAULT_QUANTITY && !item.hasOriginalText()) {
            reasons.add(UncertaintyReason.AMBIGUOUS_QUANTITY);
        }
        if (ExtractedItem.DEFAULT_UNIT.equals(item.unit())
                && BULK_KEYWORDS.stream().anyMatch(lowerName::contains)) {
            reasons.add(UncertaintyReason.UNCLEAR_UNIT);
        }
        if (AMBIGUOUS_NAME.matcher(lowerName).find()) {
            reasons.add(UncertaintyReason.AMBIGUOUS_ITEM);
        }
        if (item.name().length() < 3) {
            reasons.add(UncertaintyReason.INCOMPLETE_INFORMATION);
        }

        double confidence = item.confidence();
        if (!reasons.isEmpty() && confidence >= 0.7) {
            confidence = Math.max(0.5, confidence - 0.1 * reasons.size());
        }
        return item.withUncertainty(confidence, reasons);
    }

    private void logUncertainItems(List<ExtractedItem> items) {
        List<ExtractedItem> uncertain = items.stream()
                .filter(item -> item.confidence() < uncertaintyThreshold)
                .toList();
        if (uncertain.isEmpty()) {
            return;
        }
        log.warn("Found {} item(s) below confidence threshold {}", uncertain.size(), uncertaintyThreshold);
        for (ExtractedItem item : uncertain) {
            log.warn("  - {} (confidence: {}, reasons: {}, source: '{}')", item.name(), item.confidence(),
                    item.uncertaintyReasons().stream().map(UncertaintyReason::code).toList(),
                    abbreviate(item.originalText()));
        }
    }

    private static double parseConfidence(JsonNode value) {
        double confidence = DEFAULT_CONFIDENCE;
        if (value != null && value.isNumber()) {
            confidence = value.asDouble();
        } else if (value != null && value.isTextual()) {
            try {
                confidence = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                confidence = DEFAULT_CONFIDENCE;
            }
        }
        if (Double.isNaN(confidence)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    /**
     * Accepts a string or an array; returns trimmed, non-empty, de-duplicated values in order.
     */
    private static List<String> stringList(JsonNode value) {
        if (value == null || value.isNull()) {
            return List.of();
        }
        Set<String> values = new LinkedHashSet<>();
        if (value.isArray()) {
            for (JsonNode element : value) {
                if (element.isValueNode() && !element.isNull()) {
                    addIfPresent(values, element.asText());
                }
            }
        } else if (value.isValueNode()) {
            addIfPresent(values, value.asText());
        }
        return List.copyOf(values);
    }

    private static void addIfPresent(Set<String> values, String value) {
        String trimmed = value.trim();
        if (!trimmed.isEmpty()) {
            values.add(trimmed);
        }
    }

    private static String normalizeName(String name) {
        return WHITESPACE.matcher(name.trim()).replaceAll(" ");
    }

    private static String abbreviate(String text) {
        return text.length() <= 100 ? text : text.substring(0, 100) + "...";
    }
}
