package com.groceryai.interfaces.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * @param text grocery text; blank and length rules belong to the input guardrails
 */
public record ExtractionRequest(
        String text,

        Boolean useKnowledgeBase,

        @Min(value = 1, message = "Timeout must be at least 1 second")
        @Max(value = 300, message = "Timeout must not exceed 300 seconds")
        Integer timeoutSeconds
) {}
