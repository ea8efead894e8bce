package com.groceryai.infrastructure.ai.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.groceryai.domain.invocation.model.ChatMessage;
import com.groceryai.domain.invocation.model.ContentBlock;
import com.groceryai.domain.invocation.model.InvocationRequest;
import com.groceryai.domain.invocation.model.ModelConfig;
import com.groceryai.domain.invocation.model.ModelResponse;
import com.groceryai.domain.invocation.model.TokenUsage;
import com.groceryai.domain.invocation.service.ModelTransport;
import com.groceryai.domain.invocation.service.ModelTransportException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;
import software.amazon.awssdk.services.bedrockruntime.model.Trace;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic messages over Bedrock {@code InvokeModel}. One attempt per call; SDK retries are
 * disabled on the client so that the caller's retry policy is the only one.
 */
@Slf4j
public class BedrockModelTransport implements ModelTransport {

    static final String TIMEOUT_CODE = "RequestTimeout";

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final String guardrailId;
    private final String guardrailVersion;

    public BedrockModelTransport(BedrockRuntimeClient bedrockClient, ObjectMapper objectMapper,
                                 String guardrailId, String guardrailVersion) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.guardrailId = guardrailId == null || guardrailId.isBlank() ? null : guardrailId;
        this.guardrailVersion = guardrailVersion == null || guardrailVersion.isBlank() ? "DRAFT" : guardrailVersion;
    }

    @Override
    public ModelResponse invoke(InvocationRequest request) {
        ModelConfig config = request.config();
        InvokeModelRequest.Builder builder = InvokeModelRequest.builder()
                .modelId(config.modelId())
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromUtf8String(buildBody(request)));
        if (guardrailId != null) {
            builder.guardrailIdentifier(guardrailId)
                    .guardrailVersion(guardrailVersion)
                    .trace(Trace.ENABLED);
        }

        InvokeModelResponse response;
        try {
            response = bedrockClient.invokeModel(builder.build());
        } catch (AwsServiceException e) {
            String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
            throw new ModelTransportException("Bedrock call failed: " + e.getMessage(),
                    code, e.statusCode(), retryAfterOf(e), e);
        } catch (ApiCallAttemptTimeoutException | ApiCallTimeoutException e) {
            throw new ModelTransportException("Bedrock call timed out", TIMEOUT_CODE, 0, null, e);
        } catch (SdkClientException e) {
            String code = e.getCause() instanceof SocketTimeoutException ? TIMEOUT_CODE : "ClientError";
            throw new ModelTransportException("Bedrock client error: " + e.getMessage(), code, 0, null, e);
        }

        return parseResponse(response.body().asUtf8String());
    }

    @Override
    public String providerName() {
        return "bedrock";
    }

    String buildBody(InvocationRequest request) {
        ModelConfig config = request.config();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("anthropic_version", config.anthropicVersion());
        body.put("max_tokens", config.maxTokens());
        body.put("temperature", config.temperature());
        body.put("top_p", config.topP());
        if (config.topK() > 0) {
            body.put("top_k", config.topK());
        }
        if (!config.stopSequences().isEmpty()) {
            ArrayNode stops = body.putArray("stop_sequences");
            config.stopSequences().forEach(stops::add);
        }
        if (request.hasSystemPrompt()) {
            body.put("system", request.systemPrompt());
        }
        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : request.messages()) {
            messages.addObject()
                    .put("role", message.role())
                    .put("content", message.content());
        }
        return body.toString();
    }

    ModelResponse parseResponse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ModelTransportException("Unreadable Bedrock response body", "InvalidResponse", 200, null, e);
        }

        List<ContentBlock> blocks = new ArrayList<>();
        for (JsonNode block : root.path("content")) {
            blocks.add(new ContentBlock(block.path("type").asText("text"), block.path("text").asText("")));
        }
        JsonNode usage = root.path("usage");
        TokenUsage tokenUsage = new TokenUsage(usage.path("input_tokens").asLong(0), usage.path("output_tokens").asLong(0));
        String stopReason = root.hasNonNull("stop_reason") ? root.get("stop_reason").asText() : null;

        return new ModelResponse(blocks, tokenUsage, stopReason, root);
    }

    private static Duration retryAfterOf(AwsServiceException e) {
        if (e.awsErrorDetails() == null || e.awsErrorDetails().sdkHttpResponse() == null) {
            return null;
        }
        return e.awsErrorDetails().sdkHttpResponse()
                .firstMatchingHeader("Retry-After")
                .map(RetryAfter::parse)
                .orElse(null);
    }
}
