package com.groceryai.infrastructure.ai;

import com.groceryai.domain.guardrail.model.GuardrailAction;
import com.groceryai.domain.invocation.model.ModelConfig;
import com.groceryai.domain.invocation.service.KnowledgeRetriever;
import com.groceryai.domain.invocation.service.ModelTransport;
import com.groceryai.infrastructure.ai.extraction.ConfidenceScorer;
import com.groceryai.infrastructure.ai.extraction.GroceryItemExtractor;
import com.groceryai.infrastructure.ai.extraction.JsonBlockLocator;
import com.groceryai.infrastructure.ai.guardrail.GuardrailPolicy;
import com.groceryai.infrastructure.ai.guardrail.GuardrailsManager;
import com.groceryai.infrastructure.ai.guardrail.InputGuardrails;
import com.groceryai.infrastructure.ai.guardrail.OutputGuardrails;
import com.groceryai.infrastructure.ai.guardrail.RuleCategory;
import com.groceryai.infrastructure.ai.prompt.GroceryPromptBuilder;
import com.groceryai.infrastructure.ai.retry.RetryStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Provider-independent beans: retry policy, guardrails, extraction and the invocation client.
 */
@Slf4j
@Configuration
public class GroceryAiConfig {

    @Value("${grocery.ai.region:us-east-1}")
    private String region;

    // ===== Model =====

    @Value("${grocery.ai.model.id:" + ModelConfig.DEFAULT_MODEL_ID + "}")
    private String modelId;

    @Value("${grocery.ai.model.preset:grocery-extraction}")
    private String preset;

    // Unset values fall back to the preset
    @Value("${grocery.ai.model.max-tokens:#{null}}")
    private Integer maxTokens;

    @Value("${grocery.ai.model.temperature:#{null}}")
    private Double temperature;

    @Value("${grocery.ai.model.top-p:#{null}}")
    private Double topP;

    @Value("${grocery.ai.model.top-k:#{null}}")
    private Integer topK;

    @Value("${grocery.ai.model.use-stop-sequences:true}")
    private boolean useStopSequences;

    // ===== Retry =====

    @Value("${grocery.ai.retry.max-retries:3}")
    private int maxRetries;

    @Value("${grocery.ai.retry.base-delay-ms:1000}")
    private long baseDelayMs;

    @Value("${grocery.ai.retry.max-delay-ms:30000}")
    private long maxDelayMs;

    @Value("${grocery.ai.retry.jitter:true}")
    private boolean jitter;

    // ===== Logging / retrieval =====

    @Value("${grocery.ai.logging.requests:true}")
    private boolean logRequests;

    @Value("${grocery.ai.logging.responses:true}")
    private boolean logResponses;

    @Value("${grocery.ai.knowledge-base.results:5}")
    private int knowledgeBaseResults;

    // ===== Guardrails =====

    @Value("${grocery.ai.guardrails.injection.enabled:true}")
    private boolean injectionEnabled;

    @Value("${grocery.ai.guardrails.injection.action:BLOCK}")
    private GuardrailAction injectionAction;

    @Value("${grocery.ai.guardrails.off-topic.enabled:true}")
    private boolean offTopicEnabled;

    @Value("${grocery.ai.guardrails.off-topic.action:LOG}")
    private GuardrailAction offTopicAction;

    @Value("${grocery.ai.guardrails.pii.enabled:true}")
    private boolean piiEnabled;

    @Value("${grocery.ai.guardrails.pii.action:ANONYMIZE}")
    private GuardrailAction piiAction;

    @Value("${grocery.ai.guardrails.input.min-length:3}")
    private int minInputLength;

    @Value("${grocery.ai.guardrails.input.max-length:10000}")
    private int maxInputLength;

    @Value("${grocery.ai.guardrails.output.max-items:100}")
    private int maxOutputItems;

    @Value("${grocery.ai.guardrails.output.confidence-threshold:0.5}")
    private double outputConfidenceThreshold;

    // ===== Extraction =====

    @Value("${grocery.ai.extraction.uncertainty-threshold:0.7}")
    private double uncertaintyThreshold;

    @Bean
    public ModelConfig defaultModelConfig() {
        return resolveModelConfig(ModelConfig.forPreset(preset, modelId),
                maxTokens, temperature, topP, topK, useStopSequences);
    }

    static ModelConfig resolveModelConfig(ModelConfig base,
                                          Integer maxTokens,
                                          Double temperature,
                                          Double topP,
                                          Integer topK,
                                          boolean useStopSequences) {
        return new ModelConfig(
                base.modelId(),
                maxTokens != null ? maxTokens : base.maxTokens(),
                temperature != null ? temperature : base.temperature(),
                topP != null ? topP : base.topP(),
                topK != null ? topK : base.topK(),
                useStopSequences ? base.stopSequences() : List.of(),
                base.anthropicVersion());
    }

    @Bean
    public RetryStrategy retryStrategy() {
        return new RetryStrategy(maxRetries, Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs), jitter);
    }

    @Bean
    public GuardrailPolicy guardrailPolicy() {
        return GuardrailPolicy.builder()
                .action(RuleCategory.INJECTION, injectionAction)
                .action(RuleCategory.OFF_TOPIC, offTopicAction)
                .action(RuleCategory.PII, piiAction)
                .enabled(RuleCategory.INJECTION, injectionEnabled)
                .enabled(RuleCategory.OFF_TOPIC, offTopicEnabled)
                .enabled(RuleCategory.PII, piiEnabled)
                .build();
    }

    @Bean
    public GuardrailsManager guardrailsManager(GuardrailPolicy guardrailPolicy, JsonBlockLocator jsonBlockLocator) {
        return new GuardrailsManager(
                new InputGuardrails(guardrailPolicy, minInputLength, maxInputLength),
                new OutputGuardrails(jsonBlockLocator, maxOutputItems, outputConfidenceThreshold));
    }

    @Bean
    public GroceryItemExtractor groceryItemExtractor(JsonBlockLocator jsonBlockLocator) {
        return new GroceryItemExtractor(jsonBlockLocator, uncertaintyThreshold);
    }

    @Bean
    public ConfidenceScorer confidenceScorer() {
        return new ConfidenceScorer(uncertaintyThreshold);
    }

    @Bean
    public InvocationClient invocationClient(ModelTransport modelTransport,
                                             RetryStrategy retryStrategy,
                                             GuardrailsManager guardrailsManager,
                                             GroceryPromptBuilder promptBuilder,
                                             ObjectProvider<KnowledgeRetriever> knowledgeRetriever,
                                             ModelConfig defaultModelConfig) {
        log.info("Model {} via {} - maxRetries: {}, baseDelay: {}ms, maxDelay: {}ms, jitter: {}",
                defaultModelConfig.modelId(), modelTransport.providerName(), maxRetries, baseDelayMs, maxDelayMs, jitter);
        return new InvocationClient(modelTransport, retryStrategy, guardrailsManager, promptBuilder,
                knowledgeRetriever.getIfAvailable(), defaultModelConfig,
                new InvocationProperties(region, knowledgeBaseResults, logRequests, logResponses));
    }
}
