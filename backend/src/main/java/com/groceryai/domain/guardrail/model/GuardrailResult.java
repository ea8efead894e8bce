package com.groceryai.domain.guardrail.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a guardrail evaluation.
 * <p>
 * {@link #allowed()} is derived from the violations so that it can never disagree with them:
 * a result is allowed exactly when no violation carries {@link GuardrailAction#BLOCK}.
 *
 * @param violations     ordered list of violations (never null)
 * @param originalInput  the text that was evaluated
 * @param sanitizedInput the text after anonymization; equal to the original when nothing was redacted
 */
public record GuardrailResult(
        List<GuardrailViolation> violations,
        String originalInput,
        String sanitizedInput
) {
    public GuardrailResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static GuardrailResult clean(String input) {
        return new GuardrailResult(List.of(), input, input);
    }

    public boolean allowed() {
        return violations.stream().noneMatch(GuardrailViolation::isBlocking);
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }

    public List<GuardrailViolation> blockingViolations() {
        return violations.stream().filter(GuardrailViolation::isBlocking).toList();
    }

    public List<GuardrailViolation> violationsOf(ViolationType type) {
        return violations.stream().filter(v -> v.type() == type).toList();
    }

    public boolean inputModified() {
        return !Objects.equals(originalInput, sanitizedInput);
    }

    /**
     * Combine with another evaluation of the same exchange. Violations are concatenated in order;
     * the text fields of this result are kept.
     */
    public GuardrailResult merge(GuardrailResult other) {
        if (other == null || other.violations.isEmpty()) {
            return this;
        }
        List<GuardrailViolation> merged = new ArrayList<>(violations);
        merged.addAll(other.violations);
        return new GuardrailResult(merged, originalInput, sanitizedInput);
    }
}
