package com.groceryai.domain.invocation.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.groceryai.domain.guardrail.model.GuardrailResult;

/**
 * Result of a model invocation including usage for cost tracking.
 *
 * @param content         concatenated text content ("" when the model returned none)
 * @param inputTokens     prompt tokens
 * @param outputTokens    completion tokens
 * @param stopReason      provider stop reason (nullable)
 * @param modelId         the model that answered
 * @param latencyMs       wall-clock time around the whole retry loop
 * @param retryCount      retries performed before the successful attempt
 * @param guardrailResult guardrail findings attached to this exchange (nullable)
 * @param rawResponse     raw provider payload (nullable)
 */
public record InvocationResult(
        String content,
        long inputTokens,
        long outputTokens,
        String stopReason,
        String modelId,
        long latencyMs,
        int retryCount,
        GuardrailResult guardrailResult,
        JsonNode rawResponse
) {
    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    public InvocationResult withGuardrailResult(GuardrailResult result) {
        return new InvocationResult(content, inputTokens, outputTokens, stopReason, modelId,
                latencyMs, retryCount, result, rawResponse);
    }

    public int guardrailViolationCount() {
        return guardrailResult == null ? 0 : guardrailResult.violations().size();
    }
}
