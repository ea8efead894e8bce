package com.groceryai.infrastructure.ai;

import com.groceryai.domain.invocation.service.ModelTransport;
import com.groceryai.infrastructure.ai.transport.OpenAiModelTransport;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "grocery.ai.provider", havingValue = "openai")
public class OpenAiConfig {

    @Value("${openai.api-key}")
    private String apiKey;

    @Value("${grocery.ai.timeout.request-ms:60000}")
    private long requestTimeoutMs;

    @Bean
    public OpenAIClient openAIClient() {
        // retries are handled by RetryStrategy
        return OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .maxRetries(0)
                .build();
    }

    @Bean
    public ModelTransport openAiModelTransport(OpenAIClient openAIClient) {
        return new OpenAiModelTransport(openAIClient);
    }
}
