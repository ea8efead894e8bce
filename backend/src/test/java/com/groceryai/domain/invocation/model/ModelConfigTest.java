package com.groceryai.domain.invocation.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelConfigTest {

    private static final String MODEL = "anthropic.claude-3-haiku-20240307-v1:0";

    @Test
    @DisplayName("The grocery-extraction preset favours long, deterministic lists")
    void grocery_extraction_preset() {
        ModelConfig config = ModelConfig.forPreset("grocery-extraction", MODEL);

        assertThat(config).isEqualTo(ModelConfig.forGroceryExtraction(MODEL));
        assertThat(config.maxTokens()).isEqualTo(4096);
        assertThat(config.temperature()).isEqualTo(0.1);
        assertThat(config.topK()).isEqualTo(250);
        assertThat(config.stopSequences()).containsExactly("```", "\n\n\n");
    }

    @Test
    @DisplayName("The product-matching preset is tighter and shorter")
    void product_matching_preset() {
        ModelConfig config = ModelConfig.forPreset("product-matching", MODEL);

        assertThat(config.modelId()).isEqualTo(MODEL);
        assertThat(config.maxTokens()).isEqualTo(2048);
        assertThat(config.temperature()).isEqualTo(0.05);
        assertThat(config.topP()).isEqualTo(0.95);
        assertThat(config.topK()).isEqualTo(200);
        assertThat(config.stopSequences()).containsExactly("```");
    }

    @Test
    @DisplayName("Unknown preset names are rejected")
    void unknown_preset() {
        assertThatThrownBy(() -> ModelConfig.forPreset("creative-writing", MODEL))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("creative-writing");
    }

    @Test
    @DisplayName("Health checks ask for a handful of tokens at temperature zero")
    void health_check_preset() {
        ModelConfig config = ModelConfig.forHealthCheck(MODEL);

        assertThat(config.maxTokens()).isEqualTo(10);
        assertThat(config.temperature()).isZero();
        assertThat(config.stopSequences()).isEmpty();
    }

    @Test
    @DisplayName("Stop sequences are copied and the Anthropic version defaults")
    void defensive_copy() {
        List<String> stops = new ArrayList<>(List.of("```"));
        ModelConfig config = new ModelConfig(MODEL, 100, 0.2, 0.9, 0, stops, null);
        stops.add("END");

        assertThat(config.stopSequences()).containsExactly("```");
        assertThat(config.anthropicVersion()).isEqualTo(ModelConfig.DEFAULT_ANTHROPIC_VERSION);
    }
}
