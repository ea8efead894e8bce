package com.groceryai.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String code, String message, List<ViolationEntry> violations) {

    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }
}
