package com.groceryai.domain.invocation.model;

import java.util.List;

/**
 * Model identity and inference parameters for one invocation.
 *
 * @param modelId          provider model identifier
 * @param maxTokens        completion token cap
 * @param temperature      sampling temperature in [0, 1]
 * @param topP             nucleus sampling in [0, 1]
 * @param topK             top-k sampling, 0 to omit
 * @param stopSequences    stop sequences (possibly empty)
 * @param anthropicVersion body version tag for Anthropic models on Bedrock
 */
public record ModelConfig(
        String modelId,
        int maxTokens,
        double temperature,
        double topP,
        int topK,
        List<String> stopSequences,
        String anthropicVersion
) {
    public static final String DEFAULT_MODEL_ID = "anthropic.claude-3-5-sonnet-20241022-v2:0";
    public static final String DEFAULT_ANTHROPIC_VERSION = "bedrock-2023-05-31";

    public ModelConfig {
        stopSequences = stopSequences == null ? List.of() : List.copyOf(stopSequences);
        anthropicVersion = anthropicVersion == null ? DEFAULT_ANTHROPIC_VERSION : anthropicVersion;
    }

    /**
     * Low temperature for consistent item lists, enough tokens for long lists.
     */
    public static ModelConfig forGroceryExtraction(String modelId) {
        return new ModelConfig(modelId, 4096, 0.1, 0.9, 250, List.of("```", "\n\n\n"), DEFAULT_ANTHROPIC_VERSION);
    }

    public static ModelConfig forProductMatching(String modelId) {
        return new ModelConfig(modelId, 2048, 0.05, 0.95, 200, List.of("```"), DEFAULT_ANTHROPIC_VERSION);
    }

    /**
     * @param preset "grocery-extraction" or "product-matching"
     * @throws IllegalArgumentException for any other preset name
     */
    public static ModelConfig forPreset(String preset, String modelId) {
        return switch (preset) {
            case "grocery-extraction" -> forGroceryExtraction(modelId);
            case "product-matching" -> forProductMatching(modelId);
            default -> throw new IllegalArgumentException("Unknown model preset: " + preset);
        };
    }

    public static ModelConfig forHealthCheck(String modelId) {
        return new ModelConfig(modelId, 10, 0.0, 0.9, 0, List.of(), DEFAULT_ANTHROPIC_VERSION);
    }
}
