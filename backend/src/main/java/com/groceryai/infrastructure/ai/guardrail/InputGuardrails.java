package com.groceryai.infrastructure.ai.guardrail;

import com.groceryai.domain.guardrail.model.GuardrailAction;
import com.groceryai.domain.guardrail.model.GuardrailResult;
import com.groceryai.domain.guardrail.model.GuardrailViolation;
import com.groceryai.domain.guardrail.model.ViolationSeverity;
import com.groceryai.domain.guardrail.model.ViolationType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Local checks on caller text before it reaches the model.
 * <p>
 * Order: shape (blank, too short, too long), injection, off-topic, PII.
 * The shape checks and a blocking injection match return immediately.
 */
@Slf4j
public class InputGuardrails {

    public static final int DEFAULT_MIN_LENGTH = 3;
    public static final int DEFAULT_MAX_LENGTH = 10_000;

    private final GuardrailPolicy policy;
    private final int minLength;
    private final int maxLength;

    public InputGuardrails(GuardrailPolicy policy, int minLength, int maxLength) {
        this.policy = policy;
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    public InputGuardrails() {
        this(GuardrailPolicy.defaults(), DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH);
    }

    public GuardrailResult evaluate(String text) {
        // 1. Shape
        if (text == null || text.isBlank()) {
            return blocked(text, ViolationSeverity.HIGH, "Empty or null input provided");
        }
        if (text.trim().length() < minLength) {
            return blocked(text, ViolationSeverity.MEDIUM, "Input below minimum length of " + minLength);
        }
        if (text.length() > maxLength) {
            return blocked(text, ViolationSeverity.MEDIUM, "Input exceeds maximum length of " + maxLength);
        }

        List<GuardrailViolation> violations = new ArrayList<>();

        // 2. Injection
        if (policy.isEnabled(RuleCategory.INJECTION)) {
            violations.addAll(match(GuardrailRules.INJECTION, text));
            if (violations.stream().anyMatch(GuardrailViolation::isBlocking)) {
                violations.stream().filter(GuardrailViolation::isBlocking).forEach(v ->
                        log.error("Prompt injection attempt blocked - matched: '{}'", v.matchedContent()));
                return new GuardrailResult(violations, text, text);
            }
        }

        // 3. Off-topic
        if (policy.isEnabled(RuleCategory.OFF_TOPIC)) {
            violations.addAll(match(GuardrailRules.OFF_TOPIC, text));
        }

        // 4. PII
        String sanitized = text;
        if (policy.isEnabled(RuleCategory.PII)) {
            GuardrailAction action = policy.actionFor(RuleCategory.PII);
            for (GuardrailRule rule : GuardrailRules.PII) {
                Matcher matcher = rule.pattern().matcher(sanitized);
                boolean found = false;
                while (matcher.find()) {
                    found = true;
                    violations.add(new GuardrailViolation(ViolationType.PII_DETECTED, RuleCategory.PII.severity(),
                            RuleCategory.PII.message() + ": " + rule.name(), mask(matcher.group()), action));
                }
                if (found && action == GuardrailAction.ANONYMIZE) {
                    sanitized = matcher.replaceAll(Matcher.quoteReplacement(rule.placeholder()));
                }
            }
        }

        GuardrailResult result = new GuardrailResult(violations, text, sanitized);
        if (result.hasViolations()) {
            log.warn("Input guardrail violations: {} (allowed: {}, modified: {})",
                    violations.size(), result.allowed(), result.inputModified());
        }
        return result;
    }

    private List<GuardrailViolation> match(List<GuardrailRule> rules, String text) {
        List<GuardrailViolation> found = new ArrayList<>();
        for (GuardrailRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(text);
            if (matcher.find()) {
                RuleCategory category = rule.category();
                found.add(new GuardrailViolation(category.violationType(), category.severity(),
                        category.message(), matcher.group(), policy.actionFor(category)));
            }
        }
        return found;
    }

    private static GuardrailResult blocked(String text, ViolationSeverity severity, String message) {
        GuardrailViolation violation = new GuardrailViolation(
                ViolationType.MALFORMED_INPUT, severity, message, GuardrailAction.BLOCK);
        log.warn("Input rejected: {}", message);
        return new GuardrailResult(List.of(violation), text, text);
    }

    /**
     * Keeps the last four characters of a PII match so that logs never carry the full value.
     */
    static String mask(String value) {
        if (value.length() <= 4) {
            return "*".repeat(value.length());
        }
        return "*".repeat(value.length() - 4) + value.substring(value.length() - 4);
    }
}
