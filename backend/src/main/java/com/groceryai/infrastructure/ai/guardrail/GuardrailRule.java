package com.groceryai.infrastructure.ai.guardrail;

import java.util.regex.Pattern;

/**
 * A compiled input rule.
 *
 * @param name        short rule name used in messages ("credit_card", "jailbreak", ...)
 * @param category    rule group
 * @param pattern     compiled pattern
 * @param placeholder replacement for anonymized matches (null for non-PII rules)
 */
public record GuardrailRule(String name, RuleCategory category, Pattern pattern, String placeholder) {

    static GuardrailRule of(String name, RuleCategory category, String regex) {
        return new GuardrailRule(name, category, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), null);
    }

    static GuardrailRule pii(String name, String regex, String placeholder) {
        return new GuardrailRule(name, RuleCategory.PII, Pattern.compile(regex), placeholder);
    }
}
