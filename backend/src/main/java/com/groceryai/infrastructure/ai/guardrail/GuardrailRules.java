package com.groceryai.infrastructure.ai.guardrail;

import java.util.List;

/**
 * Rule tables for local input checks, compiled once.
 */
public final class GuardrailRules {

    private GuardrailRules() {
    }

    public static final List<GuardrailRule> INJECTION = List.of(
            GuardrailRule.of("ignore_instructions", RuleCategory.INJECTION,
                    "ignore\\s+(all\\s+)?(previous|prior|above)\\s+(instructions?|prompts?|commands?)"),
            GuardrailRule.of("system_role", RuleCategory.INJECTION, "system\\s*:"),
            GuardrailRule.of("assistant_role", RuleCategory.INJECTION, "assistant\\s*:"),
            GuardrailRule.of("human_role", RuleCategory.INJECTION, "human\\s*:"),
            GuardrailRule.of("pretend", RuleCategory.INJECTION, "pretend\\s+(you\\s+are|to\\s+be)"),
            GuardrailRule.of("act_as", RuleCategory.INJECTION, "act\\s+as\\s+(if\\s+)?you"),
            GuardrailRule.of("disregard", RuleCategory.INJECTION,
                    "disregard\\s+(all\\s+)?(safety|guidelines|rules)"),
            GuardrailRule.of("new_instruction", RuleCategory.INJECTION, "new\\s+instruction"),
            GuardrailRule.of("jailbreak", RuleCategory.INJECTION, "jailbreak"),
            GuardrailRule.of("bypass", RuleCategory.INJECTION, "bypass\\s+(filter|guardrail|safety)")
    );

    public static final List<GuardrailRule> OFF_TOPIC = List.of(
            GuardrailRule.of("finance", RuleCategory.OFF_TOPIC,
                    "\\b(bitcoin|crypto|cryptocurrency|forex|stock\\s+market)\\b"),
            GuardrailRule.of("credentials", RuleCategory.OFF_TOPIC,
                    "\\b(password|login|credential|api\\s+key|secret\\s+key)\\b"),
            GuardrailRule.of("hacking", RuleCategory.OFF_TOPIC, "\\b(hack|exploit|malware|virus|phishing)\\b"),
            GuardrailRule.of("weapons", RuleCategory.OFF_TOPIC, "\\b(weapon|ammunition|explosive|bomb)\\b"),
            GuardrailRule.of("pharmacy", RuleCategory.OFF_TOPIC,
                    "\\b(prescription|medication|pharmacy)\\b(?!.*grocery)")
    );

    // Applied in order: card numbers must be replaced before the shorter digit patterns see them.
    public static final List<GuardrailRule> PII = List.of(
            GuardrailRule.pii("credit_card", "\\b(?:\\d{4}[- ]?){3}\\d{4}\\b", "[CREDIT_CARD]"),
            GuardrailRule.pii("ssn", "\\b\\d{3}[- ]?\\d{2}[- ]?\\d{4}\\b", "[SSN]"),
            GuardrailRule.pii("phone", "(?<!\\w)(?:\\+?1[- ]?)?\\(?\\d{3}\\)?[- ]?\\d{3}[- ]?\\d{4}\\b", "[PHONE]"),
            GuardrailRule.pii("email", "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b", "[EMAIL]")
    );
}
