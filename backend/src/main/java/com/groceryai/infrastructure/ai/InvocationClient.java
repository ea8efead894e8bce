package com.groceryai.infrastructure.ai;

import com.groceryai.domain.guardrail.model.GuardrailResult;
import com.groceryai.domain.invocation.model.ChatMessage;
import com.groceryai.domain.invocation.model.ContentBlock;
import com.groceryai.domain.invocation.model.HealthStatus;
import com.groceryai.domain.invocation.model.InvocationRequest;
import com.groceryai.domain.invocation.model.InvocationResult;
import com.groceryai.domain.invocation.model.ModelConfig;
import com.groceryai.domain.invocation.model.ModelResponse;
import com.groceryai.domain.invocation.model.RetrievedDocument;
import com.groceryai.domain.invocation.service.KnowledgeRetriever;
import com.groceryai.domain.invocation.service.ModelTransport;
import com.groceryai.domain.invocation.service.ModelTransportException;
import com.groceryai.infrastructure.ai.guardrail.GuardrailsManager;
import com.groceryai.infrastructure.ai.prompt.GroceryPromptBuilder;
import com.groceryai.infrastructure.ai.retry.CancellationToken;
import com.groceryai.infrastructure.ai.retry.RetryContext;
import com.groceryai.infrastructure.ai.retry.RetryStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Model call wrapper: builds the request, runs the transport under the retry policy,
 * classifies failures and applies the provider's guardrail verdict.
 */
@Slf4j
public class InvocationClient {

    private static final String HEALTH_CHECK_PROMPT = "Hello";

    private final ModelTransport transport;
    private final RetryStrategy retryStrategy;
    private final GuardrailsManager guardrailsManager;
    private final GroceryPromptBuilder promptBuilder;
    private final KnowledgeRetriever knowledgeRetriever;
    private final ModelConfig defaultConfig;
    private final InvocationProperties properties;

    /**
     * @param knowledgeRetriever retriever for catalog context, or null when none is configured
     */
    public InvocationClient(ModelTransport transport,
                            RetryStrategy retryStrategy,
                            GuardrailsManager guardrailsManager,
                            GroceryPromptBuilder promptBuilder,
                            KnowledgeRetriever knowledgeRetriever,
                            ModelConfig defaultConfig,
                            InvocationProperties properties) {
        this.transport = transport;
        this.retryStrategy = retryStrategy;
        this.guardrailsManager = guardrailsManager;
        this.promptBuilder = promptBuilder;
        this.knowledgeRetriever = knowledgeRetriever;
        this.defaultConfig = defaultConfig;
        this.properties = properties;
        validate(defaultConfig);
    }

    public InvocationResult invoke(String prompt) {
        return invoke(prompt, null, null, CancellationToken.none());
    }

    public InvocationResult invoke(String prompt, String systemPrompt) {
        return invoke(prompt, systemPrompt, null, CancellationToken.none());
    }

    /**
     * @param prompt       user message
     * @param systemPrompt optional system prompt (nullable)
     * @param modelConfig  overrides the default config when not null
     * @param cancellation cancel flag and/or deadline for the whole retry loop
     * @throws InvalidRequestException       blank prompt or invalid inference parameters
     * @throws GuardrailBlockedException     the provider's guardrail blocked the exchange
     * @throws RateLimitException            throttled after all retries
     * @throws ModelUnavailableException     provider unavailable after all retries
     * @throws InvocationCancelledException  cancelled or deadline reached
     * @throws ModelInvocationException      any other provider failure
     */
    public InvocationResult invoke(String prompt, String systemPrompt, ModelConfig modelConfig,
                                   CancellationToken cancellation) {
        if (prompt == null || prompt.isBlank()) {
            throw new InvalidRequestException("Prompt must not be blank");
        }
        ModelConfig config = modelConfig != null ? modelConfig : defaultConfig;
        validate(config);

        InvocationRequest request = new InvocationRequest(config, systemPrompt, List.of(ChatMessage.user(prompt)));
        if (properties.logRequests()) {
            log.info("Invoking model {} via {} - prompt: {} chars, system prompt: {}, maxTokens: {}, temperature: {}",
                    config.modelId(), transport.providerName(), prompt.length(), request.hasSystemPrompt(),
                    config.maxTokens(), config.temperature());
        }

        RetryContext context = new RetryContext(cancellation);
        long start = System.nanoTime();
        ModelResponse response = call(request, context);
        long latencyMs = (System.nanoTime() - start) / 1_000_000;

        GuardrailResult verdict = guardrailsManager.interpretProviderVerdict(response.raw());
        if (!verdict.allowed()) {
            throw new GuardrailBlockedException("Request blocked by provider guardrail", verdict.violations());
        }

        InvocationResult result = new InvocationResult(
                joinText(response.content()),
                response.usage().inputTokens(),
                response.usage().outputTokens(),
                response.stopReason(),
                config.modelId(),
                latencyMs,
                context.getRetryCount(),
                verdict.hasViolations() ? verdict : null,
                response.raw());

        if (properties.logResponses()) {
            log.info("Model response - tokens in: {}, out: {}, total: {}, latency: {}ms, retries: {}, stop: {}",
                    result.inputTokens(), result.outputTokens(), result.totalTokens(), latencyMs,
                    result.retryCount(), result.stopReason());
        }
        return result;
    }

    public InvocationResult invokeWithKnowledgeBase(String prompt, String systemPrompt) {
        return invokeWithKnowledgeBase(prompt, prompt, systemPrompt, null, CancellationToken.none());
    }

    /**
     * Invokes with product-catalog context prepended to the prompt. Falls back to a plain
     * invocation when no retriever is configured or retrieval fails.
     *
     * @param query retrieval query, usually the caller's text rather than the full prompt
     */
    public InvocationResult invokeWithKnowledgeBase(String query, String prompt, String systemPrompt,
                                                    ModelConfig modelConfig, CancellationToken cancellation) {
        if (knowledgeRetriever == null) {
            log.info("No knowledge base configured, invoking without retrieval");
            return invoke(prompt, systemPrompt, modelConfig, cancellation);
        }

        List<RetrievedDocument> documents;
        try {
            documents = knowledgeRetriever.retrieve(query, properties.knowledgeBaseResults());
        } catch (RuntimeException e) {
            log.warn("Knowledge base retrieval failed, invoking without context: {}", e.getMessage());
            documents = List.of();
        }
        return invoke(promptBuilder.withContext(prompt, documents), systemPrompt, modelConfig, cancellation);
    }

    /**
     * Tiny invocation with the health-check config. Never throws.
     */
    public HealthStatus healthCheck() {
        ModelConfig healthConfig = ModelConfig.forHealthCheck(defaultConfig.modelId());
        try {
            InvocationResult result = invoke(HEALTH_CHECK_PROMPT, null, healthConfig, CancellationToken.none());
            return HealthStatus.healthy(healthConfig.modelId(), result.latencyMs(), properties.region());
        } catch (RuntimeException e) {
            log.warn("Model health check failed: {}", e.getMessage());
            return HealthStatus.unhealthy(healthConfig.modelId(), properties.region(), e.getMessage());
        }
    }

    private ModelResponse call(InvocationRequest request, RetryContext context) {
        try {
            return retryStrategy.executeWithRetry(() -> transport.invoke(request), context);
        } catch (ModelTransportException e) {
            throw classify(e);
        } catch (ModelInvocationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Unexpected error invoking model {}", request.config().modelId(), e);
            throw new ModelInvocationException("Unexpected error invoking model", "Unknown", e);
        }
    }

    private static ModelInvocationException classify(ModelTransportException e) {
        String code = e.getErrorCode();
        int status = e.getHttpStatus();
        if ("ThrottlingException".equals(code) || status == 429) {
            log.warn("Model throttled: {}", e.getMessage());
            return new RateLimitException("Rate limit exceeded: " + e.getMessage(), code, e.getRetryAfter(), e);
        }
        if ("ServiceUnavailableException".equals(code) || status == 503) {
            log.error("Model unavailable: {}", e.getMessage());
            return new ModelUnavailableException("Model unavailable: " + e.getMessage(), code, e);
        }
        log.error("Model invocation failed [{}]: {}", code, e.getMessage());
        return new ModelInvocationException("Model invocation failed: " + e.getMessage(), code, e);
    }

    private static String joinText(List<ContentBlock> blocks) {
        return blocks.stream()
                .filter(ContentBlock::isText)
                .map(ContentBlock::text)
                .collect(Collectors.joining("\n"));
    }

    static void validate(ModelConfig config) {
        if (config.modelId() == null || config.modelId().isBlank()) {
            throw new InvalidRequestException("Model id must not be blank");
        }
        if (config.maxTokens() <= 0) {
            throw new InvalidRequestException("maxTokens must be positive: " + config.maxTokens());
        }
        if (config.temperature() < 0 || config.temperature() > 1) {
            throw new InvalidRequestException("temperature must be within [0, 1]: " + config.temperature());
        }
        if (config.topP() < 0 || config.topP() > 1) {
            throw new InvalidRequestException("topP must be within [0, 1]: " + config.topP());
        }
        if (config.topK() < 0) {
            throw new InvalidRequestException("topK must not be negative: " + config.topK());
        }
    }
}
