package com.groceryai.infrastructure.ai.guardrail;

import com.groceryai.domain.guardrail.model.GuardrailAction;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Which rule categories run and what happens when one matches.
 * Defaults: injection blocks, off-topic is only logged, PII is anonymized.
 */
public final class GuardrailPolicy {

    private final Map<RuleCategory, GuardrailAction> actions;
    private final Set<RuleCategory> enabled;

    private GuardrailPolicy(Map<RuleCategory, GuardrailAction> actions, Set<RuleCategory> enabled) {
        this.actions = actions;
        this.enabled = enabled;
    }

    public static GuardrailPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public GuardrailAction actionFor(RuleCategory category) {
        return actions.get(category);
    }

    public boolean isEnabled(RuleCategory category) {
        return enabled.contains(category);
    }

    public static final class Builder {

        private final Map<RuleCategory, GuardrailAction> actions = new EnumMap<>(RuleCategory.class);
        private final Set<RuleCategory> enabled = EnumSet.allOf(RuleCategory.class);

        private Builder() {
            actions.put(RuleCategory.INJECTION, GuardrailAction.BLOCK);
            actions.put(RuleCategory.OFF_TOPIC, GuardrailAction.LOG);
            actions.put(RuleCategory.PII, GuardrailAction.ANONYMIZE);
        }

        public Builder action(RuleCategory category, GuardrailAction action) {
            if (action == GuardrailAction.ANONYMIZE && category != RuleCategory.PII) {
                throw new IllegalArgumentException("ANONYMIZE is only supported for PII rules");
            }
            actions.put(category, action);
            return this;
        }

        public Builder enabled(RuleCategory category, boolean on) {
            if (on) {
                enabled.add(category);
            } else {
                enabled.remove(category);
            }
            return this;
        }

        public GuardrailPolicy build() {
            return new GuardrailPolicy(Map.copyOf(actions), Set.copyOf(enabled));
        }
    }
}
