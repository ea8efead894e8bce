package com.groceryai.infrastructure.ai;

import com.groceryai.domain.guardrail.model.GuardrailViolation;

import java.util.List;

/**
 * The provider's safety layer rejected the exchange.
 */
public class GuardrailBlockedException extends ModelInvocationException {

    private final List<GuardrailViolation> violations;

    public GuardrailBlockedException(String message, List<GuardrailViolation> violations) {
        super(message, "GuardrailBlocked", null);
        this.violations = List.copyOf(violations);
    }

    public List<GuardrailViolation> getViolations() {
        return violations;
    }
}
