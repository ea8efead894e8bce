package com.groceryai.domain.extraction.model;

/**
 * Where in the pipeline a request was blocked.
 */
public enum BlockedStage {
    /** Local input guardrails rejected the caller text. */
    INPUT,
    /** The provider's own safety layer rejected the exchange. */
    PROVIDER
}
