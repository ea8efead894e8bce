package com.groceryai.infrastructure.ai.transport;

import com.groceryai.domain.invocation.model.ChatMessage;
import com.groceryai.domain.invocation.model.ContentBlock;
import com.groceryai.domain.invocation.model.InvocationRequest;
import com.groceryai.domain.invocation.model.ModelConfig;
import com.groceryai.domain.invocation.model.ModelResponse;
import com.groceryai.domain.invocation.model.TokenUsage;
import com.groceryai.domain.invocation.service.ModelTransport;
import com.groceryai.domain.invocation.service.ModelTransportException;
import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;

/**
 * OpenAI chat completions adapter. Top-k and the Anthropic version tag have no
 * counterpart here and are ignored.
 */
@Slf4j
@RequiredArgsConstructor
public class OpenAiModelTransport implements ModelTransport {

    private final OpenAIClient openAIClient;

    @Override
    public ModelResponse invoke(InvocationRequest request) {
        ModelConfig config = request.config();
        ChatCompletionCreateParams.Builder builder = ChatCompletionCreateParams.builder()
                .model(config.modelId())
                .temperature(config.temperature())
                .topP(config.topP())
                .maxCompletionTokens((long) config.maxTokens());
        if (!config.stopSequences().isEmpty()) {
            builder.stopOfStrings(config.stopSequences());
        }
        if (request.hasSystemPrompt()) {
            builder.addSystemMessage(request.systemPrompt());
        }
        for (ChatMessage message : request.messages()) {
            builder.addUserMessage(message.content());
        }

        ChatCompletion completion;
        try {
            completion = openAIClient.chat().completions().create(builder.build());
        } catch (OpenAIServiceException e) {
            throw new ModelTransportException("OpenAI call failed: " + e.getMessage(),
                    errorCodeFor(e.statusCode()), e.statusCode(), retryAfterOf(e), e);
        } catch (OpenAIIoException e) {
            String code = e.getCause() instanceof InterruptedIOException ? BedrockModelTransport.TIMEOUT_CODE : "ClientError";
            throw new ModelTransportException("OpenAI I/O error: " + e.getMessage(), code, 0, null, e);
        }

        TokenUsage usage = completion.usage()
                .map(u -> new TokenUsage(u.promptTokens(), u.completionTokens()))
                .orElse(TokenUsage.NONE);

        return completion.choices().stream()
                .findFirst()
                .map(choice -> new ModelResponse(
                        choice.message().content().map(text -> List.of(ContentBlock.text(text))).orElse(List.of()),
                        usage,
                        String.valueOf(choice.finishReason()),
                        null))
                .orElseGet(() -> new ModelResponse(List.of(), usage, null, null));
    }

    @Override
    public String providerName() {
        return "openai";
    }

    /**
     * Maps OpenAI HTTP statuses onto the provider codes the retry policy understands.
     */
    static String errorCodeFor(int status) {
        return switch (status) {
            case 429 -> "ThrottlingException";
            case 503 -> "ServiceUnavailableException";
            case 500, 502 -> "InternalServerException";
            case 504 -> "ModelTimeoutException";
            case 400, 422 -> "ValidationException";
            case 401, 403 -> "AccessDeniedException";
            case 404 -> "ResourceNotFoundException";
            default -> "HTTP_" + status;
        };
    }

    private static Duration retryAfterOf(OpenAIServiceException e) {
        List<String> values = e.headers().values("retry-after");
        return values.isEmpty() ? null : RetryAfter.parse(values.get(0));
    }
}
