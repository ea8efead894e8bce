package com.groceryai.infrastructure.ai.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.groceryai.domain.extraction.model.ExtractedItem;
import com.groceryai.domain.extraction.model.ExtractionResult;
import com.groceryai.domain.extraction.model.UncertaintyReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GroceryItemExtractorTest {

    private GroceryItemExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new GroceryItemExtractor(new JsonBlockLocator(new ObjectMapper()));
    }

    private ExtractedItem single(String response) {
        ExtractionResult result = extractor.extract(response);
        assertThat(result.items()).hasSize(1);
        return result.items().get(0);
    }

    @Nested
    @DisplayName("Item fields")
    class Fields {

        @Test
        @DisplayName("Units are normalized and numeric quantities kept")
        void milk_in_liters() {
            ExtractedItem milk = single("""
                    ```json
                    {"items": [{"name": "milk", "quantity": 2, "unit": "liters",
                                "confidence": 0.9, "original_text": "2 liters of milk"}]}
                    ```""");

            assertThat(milk.name()).isEqualTo("milk");
            assertThat(milk.quantity()).isEqualTo(2.0);
            assertThat(milk.unit()).isEqualTo("liter");
            assertThat(milk.confidence()).isEqualTo(0.9);
            assertThat(milk.originalText()).isEqualTo("2 liters of milk");
            assertThat(milk.uncertaintyReasons()).isEmpty();
        }

        @Test
        @DisplayName("Missing fields fall back to defaults")
        void defaults() {
            ExtractedItem eggs = single("{\"items\": [{\"name\": \"eggs\", \"unit\": null, \"original_text\": \"eggs\"}]}");

            assertThat(eggs.quantity()).isEqualTo(ExtractedItem.DEFAULT_QUANTITY);
            assertThat(eggs.unit()).isEqualTo(ExtractedItem.DEFAULT_UNIT);
            assertThat(eggs.confidence()).isEqualTo(GroceryItemExtractor.DEFAULT_CONFIDENCE);
            assertThat(eggs.specifications()).isEmpty();
        }

        @Test
        @DisplayName("Fractional quantity strings are parsed")
        void fractional_quantity() {
            ExtractedItem flour = single("""
                    {"items": [{"name": "flour", "quantity": "1 1/2", "unit": "kg",
                                "confidence": 0.9, "original_text": "one and a half kg flour"}]}""");

            assertThat(flour.quantity()).isEqualTo(1.5);
            assertThat(flour.unit()).isEqualTo("kg");
        }

        @Test
        @DisplayName("Specifications are trimmed and de-duplicated, a single string is accepted")
        void specifications() {
            ExtractionResult result = extractor.extract("""
                    {"items": [
                      {"name": "apples", "specifications": ["organic", " organic ", "", "green"]},
                      {"name": "bread", "specifications": "sourdough"}
                    ]}""");

            assertThat(result.items().get(0).specifications()).containsExactly("organic", "green");
            assertThat(result.items().get(1).specifications()).containsExactly("sourdough");
        }

        @Test
        @DisplayName("Confidence is read from numbers or strings and clamped")
        void confidence_parsing() {
            ExtractionResult result = extractor.extract("""
                    {"items": [
                      {"name": "bananas", "quantity": 6, "confidence": "0.8", "original_text": "6 bananas"},
                      {"name": "cheese", "quantity": 2, "confidence": 1.7, "original_text": "2 cheese"},
                      {"name": "butter", "quantity": 2, "confidence": "sure", "original_text": "2 butter"}
                    ]}""");

            assertThat(result.items()).extracting(ExtractedItem::confidence).containsExactly(0.8, 1.0, 0.75);
        }

        @Test
        @DisplayName("raw_text_segment is used when original_text is absent")
        void raw_text_segment() {
            ExtractedItem tomatoes = single("""
                    {"items": [{"name": "tomatoes", "quantity": 4, "raw_text_segment": "4 tomatoes"}]}""");

            assertThat(tomatoes.originalText()).isEqualTo("4 tomatoes");
        }

        @Test
        @DisplayName("Non-object and nameless items are skipped, names are whitespace-collapsed")
        void skipped_items() {
            ExtractionResult result = extractor.extract("""
                    {"items": ["milk", {"quantity": 2}, {"name": "   "}, {"name": "  whole   wheat\\tbread "}]}""");

            assertThat(result.items()).extracting(ExtractedItem::name).containsExactly("whole wheat bread");
        }

        @Test
        @DisplayName("Top-level array and model notes are accepted")
        void array_and_notes() {
            assertThat(extractor.extract("[{\"name\": \"milk\"}, {\"name\": \"eggs\"}]").items()).hasSize(2);

            ExtractionResult result = extractor.extract("""
                    {"items": [], "unrecognized_text": ["asdfgh"], "parsing_notes": "One line was unreadable"}""");
            assertThat(result.isEmpty()).isTrue();
            assertThat(result.unrecognizedText()).containsExactly("asdfgh");
            assertThat(result.parsingNotes()).isEqualTo("One line was unreadable");
        }
    }

    @Nested
    @DisplayName("Uncertainty heuristics")
    class Uncertainty {

        @Test
        @DisplayName("Defaulted quantity and bulk item in pieces lower a confident score")
        void bulk_without_unit() {
            ExtractedItem rice = single("{\"items\": [{\"name\": \"rice\"}]}");

            assertThat(rice.uncertaintyReasons())
                    .containsExactly(UncertaintyReason.AMBIGUOUS_QUANTITY, UncertaintyReason.UNCLEAR_UNIT);
            assertThat(rice.confidence()).isCloseTo(0.55, within(1e-9));
        }

        @Test
        @DisplayName("Vague names are flagged by whole word only")
        void ambiguous_names() {
            ExtractionResult result = extractor.extract("""
                    {"items": [
                      {"name": "some stuff", "confidence": 0.9, "original_text": "some stuff"},
                      {"name": "itemized receipt paper", "confidence": 0.9, "original_text": "receipt paper"}
                    ]}""");

            assertThat(result.items().get(0).uncertaintyReasons()).containsExactly(UncertaintyReason.AMBIGUOUS_ITEM);
            assertThat(result.items().get(0).confidence()).isCloseTo(0.8, within(1e-9));
            assertThat(result.items().get(1).uncertaintyReasons()).isEmpty();
        }

        @Test
        @DisplayName("Vague words inside longer food names do not flag the item")
        void ambiguous_word_inside_name() {
            ExtractionResult result = extractor.extract("""
                    {"items": [
                      {"name": "stuffed peppers", "quantity": 4, "unit": "piece", "confidence": 0.9, "original_text": "4 stuffed peppers"},
                      {"name": "seafood mix", "quantity": 1, "unit": "bag", "confidence": 0.9, "original_text": "a bag of seafood mix"},
                      {"name": "pepperoni", "quantity": 200, "unit": "g", "confidence": 0.9, "original_text": "200g pepperoni"}
                    ]}""");

            assertThat(result.items()).hasSize(3).allSatisfy(item -> {
                assertThat(item.uncertaintyReasons()).isEmpty();
                assertThat(item.confidence()).isEqualTo(0.9);
            });
        }

        @Test
        @DisplayName("Penalty never drops a confident item below 0.5")
        void penalty_floor() {
            ExtractedItem item = single("{\"items\": [{\"name\": \"rice stuff\", \"confidence\": 0.7}]}");

            assertThat(item.uncertaintyReasons()).hasSize(3);
            assertThat(item.confidence()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Already low confidence is flagged but not lowered further")
        void low_confidence_untouched() {
            ExtractedItem item = single("""
                    {"items": [{"name": "ab", "quantity": 3, "confidence": 0.6, "original_text": "3 ab"}]}""");

            assertThat(item.uncertaintyReasons()).containsExactly(UncertaintyReason.INCOMPLETE_INFORMATION);
            assertThat(item.confidence()).isEqualTo(0.6);
        }
    }

    @Nested
    @DisplayName("Robustness")
    class Robustness {

        @Test
        @DisplayName("Unparseable text yields an empty result with a parse note instead of throwing")
        void malformed() {
            ExtractionResult result = extractor.extract("Sorry, I can only help with grocery lists.");

            assertThat(result.items()).isEmpty();
            assertThat(result.unrecognizedText()).containsExactly("Sorry, I can only help with grocery lists.");
            assertThat(result.parsingNotes()).isEqualTo(GroceryItemExtractor.PARSE_FAILURE_NOTE);
        }

        @Test
        @DisplayName("Null response does not throw")
        void null_response() {
            ExtractionResult result = extractor.extract(null);

            assertThat(result.items()).isEmpty();
            assertThat(result.unrecognizedText()).isEmpty();
        }

        @Test
        @DisplayName("Extraction is deterministic for the same text")
        void idempotent() {
            String response = """
                    {"items": [{"name": "milk", "quantity": "2", "unit": "L"}, {"name": "flour"}]}""";

            assertThat(extractor.extract(response)).isEqualTo(extractor.extract(response));
        }
    }

    @Test
    @DisplayName("applyUncertainty keeps items without findings unchanged")
    void apply_uncertainty_no_findings() {
        ExtractedItem item = new ExtractedItem("cheddar cheese", 200, "g", List.of(), 0.9, "200g cheddar", List.of());

        assertThat(extractor.applyUncertainty(item)).isEqualTo(item);
    }
}
