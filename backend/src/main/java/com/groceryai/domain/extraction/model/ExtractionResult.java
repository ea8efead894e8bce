package com.groceryai.domain.extraction.model;

import java.util.List;

/**
 * Items recovered from one model response. Statistics are computed from the item list
 * on every call and never stored.
 *
 * @param items            extracted items
 * @param unrecognizedText text fragments the model could not map to items
 * @param parsingNotes     free-text notes from the model or the parser
 * @param rawResponse      the model text the result was built from
 */
public record ExtractionResult(
        List<ExtractedItem> items,
        List<String> unrecognizedText,
        String parsingNotes,
        String rawResponse
) {
    public ExtractionResult {
        items = items == null ? List.of() : List.copyOf(items);
        unrecognizedText = unrecognizedText == null ? List.of() : List.copyOf(unrecognizedText);
        parsingNotes = parsingNotes == null ? "" : parsingNotes;
    }

    public static ExtractionResult failed(String rawResponse, String note) {
        List<String> unrecognized = rawResponse == null || rawResponse.isBlank() ? List.of() : List.of(rawResponse);
        return new ExtractionResult(List.of(), unrecognized, note, rawResponse);
    }

    public ExtractionResult withItems(List<ExtractedItem> newItems) {
        return new ExtractionResult(newItems, unrecognizedText, parsingNotes, rawResponse);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<ExtractedItem> uncertainItems() {
        return items.stream().filter(ExtractedItem::isUncertain).toList();
    }

    public ExtractionStatistics statistics() {
        int total = items.size();
        if (total == 0) {
            return new ExtractionStatistics(0, 0, 0, 0.0, 0);
        }
        int high = 0;
        int low = 0;
        double sum = 0.0;
        for (ExtractedItem item : items) {
            switch (item.confidenceLevel()) {
                case HIGH, MEDIUM -> high++;
                case LOW, VERY_LOW -> low++;
            }
            sum += item.confidence();
        }
        return new ExtractionStatistics(total, high, low, sum / total, uncertainItems().size());
    }
}
