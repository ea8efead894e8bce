package com.groceryai.domain.invocation.service;

import com.groceryai.domain.invocation.model.RetrievedDocument;

import java.util.List;

/**
 * Fetches reference documents relevant to a query, most relevant first.
 */
public interface KnowledgeRetriever {

    List<RetrievedDocument> retrieve(String query, int maxResults);
}
