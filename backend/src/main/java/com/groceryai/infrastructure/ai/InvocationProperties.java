package com.groceryai.infrastructure.ai;

/**
 * Runtime switches for {@link InvocationClient}.
 *
 * @param region               provider region reported by health checks
 * @param knowledgeBaseResults documents to retrieve per query (capped at 5)
 * @param logRequests          INFO line per outgoing request
 * @param logResponses         INFO line per response
 */
public record InvocationProperties(
        String region,
        int knowledgeBaseResults,
        boolean logRequests,
        boolean logResponses
) {
    public static final int MAX_KNOWLEDGE_BASE_RESULTS = 5;

    public InvocationProperties {
        knowledgeBaseResults = Math.max(1, Math.min(knowledgeBaseResults, MAX_KNOWLEDGE_BASE_RESULTS));
    }
}
