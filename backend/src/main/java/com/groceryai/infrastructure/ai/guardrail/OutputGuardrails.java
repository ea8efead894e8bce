package com.groceryai.infrastructure.ai.guardrail;

import com.fasterxml.jackson.databind.JsonNode;
import com.groceryai.domain.guardrail.model.ExpectedFormat;
import com.groceryai.domain.guardrail.model.GuardrailAction;
import com.groceryai.domain.guardrail.model.GuardrailResult;
import com.groceryai.domain.guardrail.model.GuardrailViolation;
import com.groceryai.domain.guardrail.model.ViolationSeverity;
import com.groceryai.domain.guardrail.model.ViolationType;
import com.groceryai.infrastructure.ai.extraction.JsonBlockLocator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks on model text before extraction. Only an empty response or missing JSON blocks;
 * structural oddities are logged and left to the extractor.
 */
@Slf4j
public class OutputGuardrails {

    public static final int DEFAULT_MAX_ITEMS = 100;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5;

    private final JsonBlockLocator jsonBlockLocator;
    private final int maxItems;
    private final double confidenceThreshold;

    public OutputGuardrails(JsonBlockLocator jsonBlockLocator, int maxItems, double confidenceThreshold) {
        this.jsonBlockLocator = jsonBlockLocator;
        this.maxItems = maxItems;
        this.confidenceThreshold = confidenceThreshold;
    }

    public GuardrailResult evaluate(String response, ExpectedFormat expectedFormat) {
        List<GuardrailViolation> violations = new ArrayList<>();

        if (response == null || response.isBlank()) {
            violations.add(new GuardrailViolation(ViolationType.MALFORMED_INPUT, ViolationSeverity.HIGH,
                    "Empty response from model", GuardrailAction.BLOCK));
        } else if (expectedFormat == ExpectedFormat.JSON) {
            checkJson(response, violations);
        }

        GuardrailResult result = new GuardrailResult(violations, response, response);
        if (!result.allowed()) {
            log.error("Model output rejected: {}", result.blockingViolations().get(0).message());
        } else if (result.hasViolations()) {
            log.warn("Output guardrail findings: {}", violations.size());
        }
        return result;
    }

    private void checkJson(String response, List<GuardrailViolation> violations) {
        Optional<JsonBlockLocator.Located> located = jsonBlockLocator.locate(response);
        if (located.isEmpty()) {
            violations.add(new GuardrailViolation(ViolationType.MALFORMED_INPUT, ViolationSeverity.HIGH,
                    "No valid JSON found in response", GuardrailAction.BLOCK));
            return;
        }

        JsonNode items = itemsOf(located.get().node());
        if (items == null) {
            return;
        }
        if (items.size() > maxItems) {
            violations.add(logOnly(ViolationSeverity.MEDIUM, "Response contains too many items: " + items.size()));
        }
        for (int i = 0; i < items.size(); i++) {
            JsonNode item = items.get(i);
            if (!item.isObject()) {
                violations.add(logOnly(ViolationSeverity.MEDIUM, "Item " + i + " is not a valid object"));
                continue;
            }
            JsonNode confidence = item.get("confidence");
            if (confidence != null && confidence.isNumber() && confidence.asDouble() < confidenceThreshold) {
                violations.add(logOnly(ViolationSeverity.LOW, "Low confidence item: "
                        + item.path("name").asText("unknown") + " (" + confidence.asDouble() + ")"));
            }
        }
    }

    private static JsonNode itemsOf(JsonNode root) {
        if (root.isArray()) {
            return root;
        }
        JsonNode items = root.get("items");
        return items != null && items.isArray() ? items : null;
    }

    private static GuardrailViolation logOnly(ViolationSeverity severity, String message) {
        return new GuardrailViolation(ViolationType.MALFORMED_INPUT, severity, message, GuardrailAction.LOG);
    }
}
