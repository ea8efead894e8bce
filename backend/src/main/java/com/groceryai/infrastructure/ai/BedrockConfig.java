package com.groceryai.infrastructure.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.groceryai.domain.invocation.service.ModelTransport;
import com.groceryai.infrastructure.ai.transport.BedrockModelTransport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;

import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "grocery.ai.provider", havingValue = "bedrock", matchIfMissing = true)
public class BedrockConfig {

    @Value("${grocery.ai.region:us-east-1}")
    private String region;

    @Value("${grocery.ai.timeout.connect-ms:10000}")
    private long connectTimeoutMs;

    @Value("${grocery.ai.timeout.request-ms:60000}")
    private long requestTimeoutMs;

    @Value("${grocery.ai.guardrail.id:}")
    private String guardrailId;

    @Value("${grocery.ai.guardrail.version:DRAFT}")
    private String guardrailVersion;

    @Bean
    public BedrockRuntimeClient bedrockRuntimeClient() {
        return BedrockRuntimeClient.builder()
                .region(Region.of(region))
                .httpClientBuilder(ApacheHttpClient.builder()
                        .connectionTimeout(Duration.ofMillis(connectTimeoutMs))
                        .socketTimeout(Duration.ofMillis(requestTimeoutMs)))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        // retries are handled by RetryStrategy
                        .retryPolicy(RetryPolicy.none())
                        .apiCallAttemptTimeout(Duration.ofMillis(requestTimeoutMs))
                        .build())
                .build();
    }

    @Bean
    public ModelTransport bedrockModelTransport(BedrockRuntimeClient bedrockRuntimeClient, ObjectMapper objectMapper) {
        return new BedrockModelTransport(bedrockRuntimeClient, objectMapper, guardrailId, guardrailVersion);
    }
}
