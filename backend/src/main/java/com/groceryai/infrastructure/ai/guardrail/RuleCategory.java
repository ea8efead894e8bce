package com.groceryai.infrastructure.ai.guardrail;

import com.groceryai.domain.guardrail.model.ViolationSeverity;
import com.groceryai.domain.guardrail.model.ViolationType;

/**
 * Groups of local input rules. The action for each category comes from {@link GuardrailPolicy}.
 */
public enum RuleCategory {
    INJECTION(ViolationType.INJECTION_ATTEMPT, ViolationSeverity.CRITICAL, "Potential prompt injection detected"),
    OFF_TOPIC(ViolationType.TOPIC_POLICY, ViolationSeverity.LOW, "Non-grocery content detected"),
    PII(ViolationType.PII_DETECTED, ViolationSeverity.MEDIUM, "PII detected");

    private final ViolationType violationType;
    private final ViolationSeverity severity;
    private final String message;

    RuleCategory(ViolationType violationType, ViolationSeverity severity, String message) {
        this.violationType = violationType;
        this.severity = severity;
        this.message = message;
    }

    public ViolationType violationType() {
        return violationType;
    }

    public ViolationSeverity severity() {
        return severity;
    }

    public String message() {
        return message;
    }
}
