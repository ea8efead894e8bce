package com.groceryai.domain.guardrail.model;

/**
 * Shape the caller expects the model response to have.
 * JSON enables structural output checks, TEXT only checks for emptiness.
 */
public enum ExpectedFormat {
    JSON,
    TEXT
}
