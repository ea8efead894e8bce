package com.groceryai.application.extraction;

import com.groceryai.domain.extraction.model.BatchConfidenceReport;
import com.groceryai.domain.extraction.model.BlockedStage;
import com.groceryai.domain.extraction.model.ExtractionOutcome;
import com.groceryai.domain.extraction.model.ExtractionResult;
import com.groceryai.domain.guardrail.model.ExpectedFormat;
import com.groceryai.domain.guardrail.model.GuardrailResult;
import com.groceryai.domain.guardrail.model.GuardrailViolation;
import com.groceryai.domain.invocation.model.InvocationResult;
import com.groceryai.infrastructure.ai.GuardrailBlockedException;
import com.groceryai.infrastructure.ai.InvocationClient;
import com.groceryai.infrastructure.ai.extraction.ConfidenceScorer;
import com.groceryai.infrastructure.ai.extraction.GroceryItemExtractor;
import com.groceryai.infrastructure.ai.guardrail.GuardrailsManager;
import com.groceryai.infrastructure.ai.preprocessing.GroceryTextNormalizer;
import com.groceryai.infrastructure.ai.prompt.GroceryPromptBuilder;
import com.groceryai.infrastructure.ai.retry.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * End-to-end grocery extraction:
 * <p>
 * normalize → input guardrails → prompt → model (retries, provider verdict) → output guardrails
 * → extract → recalibrate? → batch report
 * </p>
 * Guardrail blocks and unparseable output come back as {@link ExtractionOutcome} values;
 * provider and transport failures propagate as exceptions.
 */
@Slf4j
@Service
public class GroceryExtractionService {

    private final GroceryTextNormalizer textNormalizer;
    private final GuardrailsManager guardrailsManager;
    private final GroceryPromptBuilder promptBuilder;
    private final InvocationClient invocationClient;
    private final GroceryItemExtractor extractor;
    private final ConfidenceScorer confidenceScorer;
    private final boolean recalibrate;
    private final boolean includeExamples;

    public GroceryExtractionService(GroceryTextNormalizer textNormalizer,
                                    GuardrailsManager guardrailsManager,
                                    GroceryPromptBuilder promptBuilder,
                                    InvocationClient invocationClient,
                                    GroceryItemExtractor extractor,
                                    ConfidenceScorer confidenceScorer,
                                    @Value("${grocery.ai.extraction.recalibrate:true}") boolean recalibrate,
                                    @Value("${grocery.ai.extraction.include-examples:true}") boolean includeExamples) {
        this.textNormalizer = textNormalizer;
        this.guardrailsManager = guardrailsManager;
        this.promptBuilder = promptBuilder;
        this.invocationClient = invocationClient;
        this.extractor = extractor;
        this.confidenceScorer = confidenceScorer;
        this.recalibrate = recalibrate;
        this.includeExamples = includeExamples;
    }

    public ExtractionOutcome extract(String text) {
        return extract(text, false, CancellationToken.none());
    }

    /**
     * @param text             caller grocery text
     * @param useKnowledgeBase prepend product-catalog context when a knowledge base is configured
     * @param cancellation     cancel flag and/or deadline for the model call
     */
    public ExtractionOutcome extract(String text, boolean useKnowledgeBase, CancellationToken cancellation) {
        // 1. Normalize
        String normalized = textNormalizer.normalize(text);

        // 2. Input guardrails
        GuardrailResult input = guardrailsManager.evaluateInput(normalized);
        if (!input.allowed()) {
            log.warn("Extraction blocked by input guardrails: {}",
                    input.blockingViolations().stream().map(GuardrailViolation::message).toList());
            return new ExtractionOutcome.Blocked(BlockedStage.INPUT, input.violations());
        }

        // 3. Prompt (sanitized text only)
        String sanitized = input.sanitizedInput();
        String systemPrompt = promptBuilder.buildExtractionSystemPrompt(includeExamples);
        String userMessage = promptBuilder.buildExtractionUserMessage(sanitized);

        // 4. Model
        InvocationResult invocation;
        try {
            invocation = useKnowledgeBase
                    ? invocationClient.invokeWithKnowledgeBase(sanitized, userMessage, systemPrompt, null, cancellation)
                    : invocationClient.invoke(userMessage, systemPrompt, null, cancellation);
        } catch (GuardrailBlockedException e) {
            log.warn("Extraction blocked by provider guardrail: {} violation(s)", e.getViolations().size());
            return new ExtractionOutcome.Blocked(BlockedStage.PROVIDER, e.getViolations());
        }
        GuardrailResult exchange = invocation.guardrailResult() == null
                ? input
                : input.merge(invocation.guardrailResult());
        invocation = invocation.withGuardrailResult(exchange);

        // 5. Output guardrails
        String content = invocation.content();
        GuardrailResult output = guardrailsManager.evaluateOutput(content, ExpectedFormat.JSON);
        List<String> diagnostics = new ArrayList<>(output.violations().stream().map(GuardrailViolation::message).toList());
        if (!output.allowed()) {
            String note = output.blockingViolations().get(0).message();
            return new ExtractionOutcome.ParseFailed(ExtractionResult.failed(content, note), diagnostics, invocation);
        }

        // 6. Extract
        ExtractionResult result = extractor.extract(content);
        if (result.isEmpty() && GroceryItemExtractor.PARSE_FAILURE_NOTE.equals(result.parsingNotes())) {
            diagnostics.add(result.parsingNotes());
            return new ExtractionOutcome.ParseFailed(result, diagnostics, invocation);
        }

        // 7. Calibrate + report
        if (recalibrate) {
            result = confidenceScorer.recalibrate(result);
        }
        BatchConfidenceReport report = confidenceScorer.calculateBatchConfidence(result.items());

        log.info("Extracted {} item(s) - avg confidence: {}, below threshold: {}, tokens: {}, retries: {}",
                report.totalItems(), report.averageConfidence(), report.itemsBelowThreshold(),
                invocation.totalTokens(), invocation.retryCount());
        return new ExtractionOutcome.Extracted(result, report, invocation);
    }
}
