package com.groceryai.infrastructure.ai.guardrail;

import com.fasterxml.jackson.databind.JsonNode;
import com.groceryai.domain.guardrail.model.ExpectedFormat;
import com.groceryai.domain.guardrail.model.GuardrailAction;
import com.groceryai.domain.guardrail.model.GuardrailResult;
import com.groceryai.domain.guardrail.model.GuardrailViolation;
import com.groceryai.domain.guardrail.model.ViolationSeverity;
import com.groceryai.domain.guardrail.model.ViolationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Single entry point for guardrail decisions: local input and output checks plus
 * translation of the provider's own guardrail verdict.
 */
@Slf4j
@RequiredArgsConstructor
public class GuardrailsManager {

    static final String ACTION_FIELD = "amazon-bedrock-guardrailAction";
    static final String TRACE_FIELD = "amazon-bedrock-trace";

    private static final Set<String> BLOCKED_ACTIONS = Set.of("BLOCKED", "INTERVENED");
    private static final Set<String> POLICY_FIELDS = Set.of(
            "contentPolicy", "topicPolicy", "wordPolicy", "sensitiveInformationPolicy");

    private final InputGuardrails inputGuardrails;
    private final OutputGuardrails outputGuardrails;

    public GuardrailResult evaluateInput(String text) {
        return inputGuardrails.evaluate(text);
    }

    public GuardrailResult evaluateOutput(String response, ExpectedFormat expectedFormat) {
        return outputGuardrails.evaluate(response, expectedFormat);
    }

    /**
     * Reads the guardrail verdict embedded in a raw provider payload.
     * Returns a clean result when the payload carries no verdict.
     */
    public GuardrailResult interpretProviderVerdict(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return GuardrailResult.clean(null);
        }

        String action = payload.path(ACTION_FIELD).asText("");
        if (BLOCKED_ACTIONS.contains(action)) {
            log.warn("Request blocked by provider guardrail (action: {})", action);
            return new GuardrailResult(List.of(new GuardrailViolation(ViolationType.CONTENT_FILTER,
                    ViolationSeverity.HIGH, "Request blocked by Bedrock Guardrails", GuardrailAction.BLOCK)),
                    null, null);
        }

        JsonNode assessment = payload.path(TRACE_FIELD).path("guardrail").path("inputAssessment");
        if (!assessment.isObject()) {
            return GuardrailResult.clean(null);
        }

        List<GuardrailViolation> violations = new ArrayList<>();
        if (isFlatAssessment(assessment)) {
            readAssessment(assessment, violations);
        } else {
            // keyed by guardrail id
            Iterator<JsonNode> perGuardrail = assessment.elements();
            while (perGuardrail.hasNext()) {
                readAssessment(perGuardrail.next(), violations);
            }
        }

        GuardrailResult result = new GuardrailResult(violations, null, null);
        if (!result.allowed()) {
            log.warn("Provider guardrail blocked the request: {} violation(s)", result.blockingViolations().size());
        }
        return result;
    }

    private static boolean isFlatAssessment(JsonNode assessment) {
        Iterator<String> names = assessment.fieldNames();
        while (names.hasNext()) {
            if (POLICY_FIELDS.contains(names.next())) {
                return true;
            }
        }
        return false;
    }

    private static void readAssessment(JsonNode assessment, List<GuardrailViolation> violations) {
        for (JsonNode filter : assessment.path("contentPolicy").path("filters")) {
            if (isBlocked(filter)) {
                violations.add(new GuardrailViolation(ViolationType.CONTENT_FILTER, ViolationSeverity.HIGH,
                        "Content blocked: " + filter.path("type").asText(), GuardrailAction.BLOCK));
            }
        }
        for (JsonNode topic : assessment.path("topicPolicy").path("topics")) {
            if (isBlocked(topic)) {
                violations.add(new GuardrailViolation(ViolationType.TOPIC_POLICY, ViolationSeverity.MEDIUM,
                        "Topic blocked: " + topic.path("name").asText(), GuardrailAction.BLOCK));
            }
        }
        JsonNode wordPolicy = assessment.path("wordPolicy");
        for (String listName : List.of("customWords", "managedWordLists")) {
            for (JsonNode word : wordPolicy.path(listName)) {
                if (isBlocked(word)) {
                    violations.add(new GuardrailViolation(ViolationType.WORD_POLICY, ViolationSeverity.MEDIUM,
                            "Word blocked: " + word.path("match").asText(), GuardrailAction.BLOCK));
                }
            }
        }
        JsonNode sensitive = assessment.path("sensitiveInformationPolicy");
        for (String listName : List.of("piiEntities", "regexes")) {
            for (JsonNode entity : sensitive.path(listName)) {
                String entityAction = entity.path("action").asText("");
                String label = entity.has("type") ? entity.path("type").asText() : entity.path("name").asText();
                if ("BLOCKED".equals(entityAction)) {
                    violations.add(new GuardrailViolation(ViolationType.PII_DETECTED, ViolationSeverity.HIGH,
                            "Sensitive information blocked: " + label, GuardrailAction.BLOCK));
                } else if ("ANONYMIZED".equals(entityAction)) {
                    violations.add(new GuardrailViolation(ViolationType.PII_DETECTED, ViolationSeverity.MEDIUM,
                            "Sensitive information anonymized: " + label, GuardrailAction.ANONYMIZE));
                }
            }
        }
    }

    private static boolean isBlocked(JsonNode entry) {
        return "BLOCKED".equals(entry.path("action").asText(""));
    }
}
