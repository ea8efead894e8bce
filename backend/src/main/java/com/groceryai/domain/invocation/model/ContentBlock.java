package com.groceryai.domain.invocation.model;

public record ContentBlock(String type, String text) {

    public static ContentBlock text(String text) {
        return new ContentBlock("text", text);
    }

    public boolean isText() {
        return "text".equals(type);
    }
}
