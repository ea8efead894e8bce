package com.groceryai.domain.guardrail.model;

public enum ViolationType {
    CONTENT_FILTER,
    TOPIC_POLICY,
    WORD_POLICY,
    PII_DETECTED,
    MALFORMED_INPUT,
    INJECTION_ATTEMPT
}
