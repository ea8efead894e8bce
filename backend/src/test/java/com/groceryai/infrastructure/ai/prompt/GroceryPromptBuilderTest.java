package com.groceryai.infrastructure.ai.prompt;

import com.groceryai.domain.invocation.model.RetrievedDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GroceryPromptBuilderTest {

    private GroceryPromptBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new GroceryPromptBuilder();
    }

    @Test
    @DisplayName("System prompt describes the JSON contract")
    void system_prompt() {
        String prompt = builder.buildExtractionSystemPrompt(false);

        assertThat(prompt).contains("\"items\"", "\"unrecognized_text\"", "\"parsing_notes\"", "\"confidence\"");
        assertThat(prompt).doesNotContain("Examples:");
    }

    @Test
    @DisplayName("Few-shot examples are appended when requested")
    void with_examples() {
        String prompt = builder.buildExtractionSystemPrompt(true);

        assertThat(prompt).startsWith(builder.buildExtractionSystemPrompt(false));
        assertThat(prompt).contains("\n\nExamples:\n", "Example 1:", "Example 2:", "Example 3:");
        assertThat(prompt).contains("Input: I need milk, 2 dozen eggs, and some bread");
    }

    @Test
    @DisplayName("User message embeds the grocery text")
    void user_message() {
        String message = builder.buildExtractionUserMessage("3 apples, 1 kg rice");

        assertThat(message).contains("Input text:\n3 apples, 1 kg rice\n");
        assertThat(message).contains("Return ONLY valid JSON");
    }

    @Test
    @DisplayName("No documents leaves the prompt unchanged")
    void no_context() {
        assertThat(builder.withContext("prompt", List.of())).isEqualTo("prompt");
        assertThat(builder.withContext("prompt", null)).isEqualTo("prompt");
    }

    @Test
    @DisplayName("Documents are numbered, sourced and placed before the prompt")
    void context_layout() {
        List<RetrievedDocument> docs = List.of(
                new RetrievedDocument("Whole milk, 1 gallon", Map.of("source", "s3://catalog/dairy.csv"), 0.9),
                new RetrievedDocument("Large eggs, dozen", Map.of(), 0.7));

        String prompt = builder.withContext("Extract items", docs);

        assertThat(prompt).isEqualTo("\n\nRelevant Context from Product Catalog:\n"
                + "\n--- Document 1 ---\nSource: s3://catalog/dairy.csv\nWhole milk, 1 gallon\n"
                + "\n--- Document 2 ---\nLarge eggs, dozen\n"
                + "\n\nExtract items");
    }

    @Test
    @DisplayName("At most five documents, each cut to 500 characters")
    void context_limits() {
        List<RetrievedDocument> docs = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            docs.add(new RetrievedDocument("x".repeat(800), Map.of(), null));
        }

        String prompt = builder.withContext("p", docs);

        assertThat(prompt).contains("--- Document 5 ---").doesNotContain("--- Document 6 ---");
        assertThat(prompt).contains("x".repeat(500) + "\n").doesNotContain("x".repeat(501));
    }
}
