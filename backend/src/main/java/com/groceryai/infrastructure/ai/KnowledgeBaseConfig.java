package com.groceryai.infrastructure.ai;

import com.groceryai.domain.invocation.service.KnowledgeRetriever;
import com.groceryai.infrastructure.ai.transport.BedrockKnowledgeRetriever;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockagentruntime.BedrockAgentRuntimeClient;

/**
 * Active only when a knowledge base id is configured.
 */
@Configuration
@ConditionalOnExpression("!'${grocery.ai.knowledge-base.id:}'.isEmpty()")
public class KnowledgeBaseConfig {

    @Value("${grocery.ai.region:us-east-1}")
    private String region;

    @Value("${grocery.ai.knowledge-base.id}")
    private String knowledgeBaseId;

    @Bean
    public BedrockAgentRuntimeClient bedrockAgentRuntimeClient() {
        return BedrockAgentRuntimeClient.builder()
                .region(Region.of(region))
                .build();
    }

    @Bean
    public KnowledgeRetriever knowledgeRetriever(BedrockAgentRuntimeClient bedrockAgentRuntimeClient) {
        return new BedrockKnowledgeRetriever(bedrockAgentRuntimeClient, knowledgeBaseId);
    }
}
