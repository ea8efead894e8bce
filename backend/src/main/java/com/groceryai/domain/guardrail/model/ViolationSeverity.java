package com.groceryai.domain.guardrail.model;

public enum ViolationSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
