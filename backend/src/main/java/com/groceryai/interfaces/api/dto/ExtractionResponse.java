package com.groceryai.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.groceryai.domain.extraction.model.BatchConfidenceReport;
import com.groceryai.domain.extraction.model.ConfidenceLevel;
import com.groceryai.domain.extraction.model.ExtractedItem;
import com.groceryai.domain.extraction.model.ExtractionOutcome;
import com.groceryai.domain.extraction.model.ExtractionResult;
import com.groceryai.domain.extraction.model.ExtractionStatistics;
import com.groceryai.domain.extraction.model.UncertaintyReason;
import com.groceryai.domain.invocation.model.InvocationResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionResponse(
        String status,
        List<ItemEntry> items,
        List<String> unrecognizedText,
        String parsingNotes,
        ExtractionStatistics statistics,
        ConfidenceEntry confidence,
        UsageEntry usage,
        String blockedStage,
        List<ViolationEntry> violations,
        List<String> diagnostics
) {
    public record ItemEntry(
            String name,
            double quantity,
            String unit,
            List<String> specifications,
            double confidence,
            String confidenceLevel,
            String originalText,
            List<String> uncertaintyReasons,
            boolean uncertain
    ) {
        static ItemEntry from(ExtractedItem item) {
            return new ItemEntry(item.name(), item.quantity(), item.unit(), item.specifications(),
                    item.confidence(), item.confidenceLevel().label(), item.originalText(),
                    item.uncertaintyReasons().stream().map(UncertaintyReason::code).toList(),
                    item.isUncertain());
        }
    }

    public record ConfidenceEntry(
            double average,
            double min,
            double max,
            Map<String, Integer> distribution,
            int belowThreshold,
            double threshold
    ) {
        static ConfidenceEntry from(BatchConfidenceReport report) {
            Map<String, Integer> distribution = new LinkedHashMap<>();
            for (ConfidenceLevel level : ConfidenceLevel.values()) {
                distribution.put(level.label(), report.distribution().getOrDefault(level, 0));
            }
            return new ConfidenceEntry(report.averageConfidence(), report.minConfidence(), report.maxConfidence(),
                    distribution, report.itemsBelowThreshold(), report.threshold());
        }
    }

    public record UsageEntry(String modelId, long inputTokens, long outputTokens, long latencyMs, int retries) {
        static UsageEntry from(InvocationResult invocation) {
            return new UsageEntry(invocation.modelId(), invocation.inputTokens(), invocation.outputTokens(),
                    invocation.latencyMs(), invocation.retryCount());
        }
    }

    public static ExtractionResponse from(ExtractionOutcome outcome) {
        if (outcome instanceof ExtractionOutcome.Extracted extracted) {
            ExtractionResult result = extracted.result();
            return new ExtractionResponse("extracted",
                    result.items().stream().map(ItemEntry::from).toList(),
                    result.unrecognizedText(), result.parsingNotes(), result.statistics(),
                    ConfidenceEntry.from(extracted.confidenceReport()),
                    UsageEntry.from(extracted.invocation()),
                    null, null, null);
        }
        if (outcome instanceof ExtractionOutcome.Blocked blocked) {
            return new ExtractionResponse("blocked", null, null, null, null, null, null,
                    blocked.stage().name(), ViolationEntry.from(blocked.violations()), null);
        }
        ExtractionOutcome.ParseFailed failed = (ExtractionOutcome.ParseFailed) outcome;
        return new ExtractionResponse("parse_failed", List.of(),
                failed.result().unrecognizedText(), failed.result().parsingNotes(), null, null,
                UsageEntry.from(failed.invocation()), null, null, failed.diagnostics());
    }
}
