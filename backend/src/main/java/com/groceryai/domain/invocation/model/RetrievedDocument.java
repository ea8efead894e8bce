package com.groceryai.domain.invocation.model;

import java.util.Map;

/**
 * A document returned by the knowledge-base retriever.
 *
 * @param content  document text
 * @param metadata string metadata, e.g. "source"
 * @param score    relevance score (nullable)
 */
public record RetrievedDocument(String content, Map<String, String> metadata, Double score) {

    public RetrievedDocument {
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String source() {
        return metadata.getOrDefault("source", "unknown");
    }
}
