package com.groceryai.interfaces.api.dto;

import com.groceryai.domain.guardrail.model.GuardrailViolation;

import java.util.List;

public record ViolationEntry(String type, String severity, String message, String action) {

    public static List<ViolationEntry> from(List<GuardrailViolation> violations) {
        return violations.stream()
                .map(v -> new ViolationEntry(v.type().name(), v.severity().name(), v.message(), v.action().name()))
                .toList();
    }
}
