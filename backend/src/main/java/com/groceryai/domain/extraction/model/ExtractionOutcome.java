package com.groceryai.domain.extraction.model;

import com.groceryai.domain.guardrail.model.GuardrailViolation;
import com.groceryai.domain.invocation.model.InvocationResult;

import java.util.List;

/**
 * Result of one end-to-end extraction. Guardrail blocks and unparseable output are
 * expected outcomes and are returned as values rather than thrown.
 */
public sealed interface ExtractionOutcome
        permits ExtractionOutcome.Extracted, ExtractionOutcome.Blocked, ExtractionOutcome.ParseFailed {

    /**
     * Items were recovered from the model response.
     */
    record Extracted(
            ExtractionResult result,
            BatchConfidenceReport confidenceReport,
            InvocationResult invocation
    ) implements ExtractionOutcome {}

    /**
     * A guardrail rejected the request; the model output (if any) was discarded.
     */
    record Blocked(
            BlockedStage stage,
            List<GuardrailViolation> violations
    ) implements ExtractionOutcome {
        public Blocked {
            violations = List.copyOf(violations);
        }
    }

    /**
     * The model answered but nothing structured could be recovered.
     *
     * @param result      an empty-item result carrying the diagnostic note
     * @param diagnostics output guardrail findings and parser notes
     */
    record ParseFailed(
            ExtractionResult result,
            List<String> diagnostics,
            InvocationResult invocation
    ) implements ExtractionOutcome {
        public ParseFailed {
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
