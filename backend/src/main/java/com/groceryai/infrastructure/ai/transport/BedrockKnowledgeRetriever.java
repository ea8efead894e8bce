package com.groceryai.infrastructure.ai.transport;

import com.groceryai.domain.invocation.model.RetrievedDocument;
import com.groceryai.domain.invocation.service.KnowledgeRetriever;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.document.Document;
import software.amazon.awssdk.services.bedrockagentruntime.BedrockAgentRuntimeClient;
import software.amazon.awssdk.services.bedrockagentruntime.model.KnowledgeBaseQuery;
import software.amazon.awssdk.services.bedrockagentruntime.model.KnowledgeBaseRetrievalConfiguration;
import software.amazon.awssdk.services.bedrockagentruntime.model.KnowledgeBaseRetrievalResult;
import software.amazon.awssdk.services.bedrockagentruntime.model.KnowledgeBaseVectorSearchConfiguration;
import software.amazon.awssdk.services.bedrockagentruntime.model.RetrieveRequest;
import software.amazon.awssdk.services.bedrockagentruntime.model.RetrieveResponse;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Product catalog lookup through a Bedrock knowledge base {@code Retrieve} call.
 */
@Slf4j
@RequiredArgsConstructor
public class BedrockKnowledgeRetriever implements KnowledgeRetriever {

    private final BedrockAgentRuntimeClient agentRuntimeClient;
    private final String knowledgeBaseId;

    @Override
    public List<RetrievedDocument> retrieve(String query, int maxResults) {
        RetrieveRequest request = RetrieveRequest.builder()
                .knowledgeBaseId(knowledgeBaseId)
                .retrievalQuery(KnowledgeBaseQuery.builder().text(query).build())
                .retrievalConfiguration(KnowledgeBaseRetrievalConfiguration.builder()
                        .vectorSearchConfiguration(KnowledgeBaseVectorSearchConfiguration.builder()
                                .numberOfResults(maxResults)
                                .build())
                        .build())
                .build();

        RetrieveResponse response = agentRuntimeClient.retrieve(request);
        List<RetrievedDocument> documents = response.retrievalResults().stream()
                .map(BedrockKnowledgeRetriever::toDocument)
                .toList();
        log.info("Knowledge base {} returned {} document(s)", knowledgeBaseId, documents.size());
        return documents;
    }

    private static RetrievedDocument toDocument(KnowledgeBaseRetrievalResult result) {
        Map<String, String> metadata = new HashMap<>();
        if (result.metadata() != null) {
            for (Map.Entry<String, Document> entry : result.metadata().entrySet()) {
                Document value = entry.getValue();
                if (value != null && value.isString()) {
                    metadata.put(entry.getKey(), value.asString());
                }
            }
        }
        if (result.location() != null && result.location().s3Location() != null) {
            metadata.put("source", result.location().s3Location().uri());
        }
        String text = result.content() != null ? result.content().text() : "";
        return new RetrievedDocument(text, metadata, result.score());
    }
}
