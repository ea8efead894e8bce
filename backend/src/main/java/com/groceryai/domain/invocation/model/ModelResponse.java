package com.groceryai.domain.invocation.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Provider response normalized to content blocks, token usage and stop reason.
 *
 * @param content    content blocks in provider order
 * @param usage      token usage, {@link TokenUsage#NONE} when the provider reported none
 * @param stopReason provider stop reason (nullable)
 * @param raw        the raw provider payload, used for provider-side guardrail verdicts (nullable)
 */
public record ModelResponse(
        List<ContentBlock> content,
        TokenUsage usage,
        String stopReason,
        JsonNode raw
) {
    public ModelResponse {
        content = content == null ? List.of() : List.copyOf(content);
        usage = usage == null ? TokenUsage.NONE : usage;
    }
}
