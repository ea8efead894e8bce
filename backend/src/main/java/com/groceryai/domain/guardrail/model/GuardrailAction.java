package com.groceryai.domain.guardrail.model;

/**
 * Action taken when a guardrail rule matches.
 */
public enum GuardrailAction {
    ALLOW,
    BLOCK,
    ANONYMIZE,
    LOG
}
