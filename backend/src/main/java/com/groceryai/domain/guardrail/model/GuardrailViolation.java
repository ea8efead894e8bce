package com.groceryai.domain.guardrail.model;

/**
 * A single guardrail match.
 *
 * @param type           the violation category
 * @param severity       how serious the match is
 * @param message        human-readable description
 * @param matchedContent the triggering snippet, truncated to {@value #MAX_SNIPPET_LENGTH} chars (nullable)
 * @param action         what the guardrail did about it
 */
public record GuardrailViolation(
        ViolationType type,
        ViolationSeverity severity,
        String message,
        String matchedContent,
        GuardrailAction action
) {
    public static final int MAX_SNIPPET_LENGTH = 50;

    public GuardrailViolation {
        if (matchedContent != null && matchedContent.length() > MAX_SNIPPET_LENGTH) {
            matchedContent = matchedContent.substring(0, MAX_SNIPPET_LENGTH);
        }
    }

    public GuardrailViolation(ViolationType type, ViolationSeverity severity, String message, GuardrailAction action) {
        this(type, severity, message, null, action);
    }

    public boolean isBlocking() {
        return action == GuardrailAction.BLOCK;
    }
}
