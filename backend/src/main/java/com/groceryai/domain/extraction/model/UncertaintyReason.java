package com.groceryai.domain.extraction.model;

/**
 * Categorical explanation for reduced confidence in an extracted item.
 */
public enum UncertaintyReason {
    AMBIGUOUS_QUANTITY("ambiguous_quantity"),
    AMBIGUOUS_ITEM("ambiguous_item"),
    UNCLEAR_UNIT("unclear_unit"),
    MULTIPLE_INTERPRETATIONS("multiple_interpretations"),
    INCOMPLETE_INFORMATION("incomplete_information"),
    NON_STANDARD_FORMAT("non_standard_format"),
    POSSIBLE_MISSPELLING("possible_misspelling"),
    CONTEXT_MISSING("context_missing");

    private final String code;

    UncertaintyReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
