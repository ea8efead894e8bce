package com.groceryai.infrastructure.ai.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groceryai.domain.invocation.model.ChatMessage;
import com.groceryai.domain.invocation.model.InvocationRequest;
import com.groceryai.domain.invocation.model.ModelConfig;
import com.groceryai.domain.invocation.model.ModelResponse;
import com.groceryai.domain.invocation.service.ModelTransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.http.SdkHttpFullResponse;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;
import software.amazon.awssdk.services.bedrockruntime.model.Trace;
import software.amazon.awssdk.services.bedrockruntime.model.ValidationException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BedrockModelTransportTest {

    private static final String MODEL_ID = "anthropic.claude-3-5-sonnet-20241022-v2:0";

    @Mock
    private BedrockRuntimeClient bedrockClient;

    private final ObjectMapper mapper = new ObjectMapper();
    private BedrockModelTransport transport;

    @BeforeEach
    void setUp() {
        transport = new BedrockModelTransport(bedrockClient, mapper, null, null);
    }

    private static InvocationRequest request(ModelConfig config, String system) {
        return new InvocationRequest(config, system, List.of(ChatMessage.user("2 liters of milk")));
    }

    private static InvokeModelResponse body(String json) {
        return InvokeModelResponse.builder()
                .body(SdkBytes.fromUtf8String(json))
                .contentType("application/json")
                .build();
    }

    @Test
    @DisplayName("Request body follows the Anthropic messages format")
    void build_body() throws Exception {
        JsonNode body = mapper.readTree(transport.buildBody(
                request(ModelConfig.forGroceryExtraction(MODEL_ID), "You extract grocery items.")));

        assertThat(body.path("anthropic_version").asText()).isEqualTo("bedrock-2023-05-31");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(4096);
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.1);
        assertThat(body.path("top_p").asDouble()).isEqualTo(0.9);
        assertThat(body.path("top_k").asInt()).isEqualTo(250);
        assertThat(body.path("stop_sequences")).hasSize(2);
        assertThat(body.path("system").asText()).isEqualTo("You extract grocery items.");
        assertThat(body.at("/messages/0/role").asText()).isEqualTo("user");
        assertThat(body.at("/messages/0/content").asText()).isEqualTo("2 liters of milk");
    }

    @Test
    @DisplayName("Optional fields are omitted when unset")
    void build_body_minimal() throws Exception {
        JsonNode body = mapper.readTree(transport.buildBody(request(ModelConfig.forHealthCheck(MODEL_ID), null)));

        assertThat(body.has("top_k")).isFalse();
        assertThat(body.has("stop_sequences")).isFalse();
        assertThat(body.has("system")).isFalse();
    }

    @Test
    @DisplayName("Response content, usage and stop reason are read, raw payload kept")
    void parse_response() {
        ModelResponse response = transport.parseResponse("""
                {"content": [{"type": "text", "text": "{\\"items\\": []}"}],
                 "usage": {"input_tokens": 321, "output_tokens": 12},
                 "stop_reason": "end_turn",
                 "amazon-bedrock-guardrailAction": "NONE"}""");

        assertThat(response.content()).singleElement().satisfies(block -> {
            assertThat(block.isText()).isTrue();
            assertThat(block.text()).isEqualTo("{\"items\": []}");
        });
        assertThat(response.usage().inputTokens()).isEqualTo(321);
        assertThat(response.usage().outputTokens()).isEqualTo(12);
        assertThat(response.stopReason()).isEqualTo("end_turn");
        assertThat(response.raw().path("amazon-bedrock-guardrailAction").asText()).isEqualTo("NONE");
    }

    @Test
    @DisplayName("Unreadable body is reported as an invalid response")
    void parse_invalid() {
        assertThatThrownBy(() -> transport.parseResponse("not json"))
                .isInstanceOf(ModelTransportException.class)
                .satisfies(e -> assertThat(((ModelTransportException) e).getErrorCode()).isEqualTo("InvalidResponse"));
    }

    @Test
    @DisplayName("Configured guardrail is attached with tracing enabled")
    void guardrail_attached() {
        BedrockModelTransport guarded = new BedrockModelTransport(bedrockClient, mapper, "gr-123", "2");
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenReturn(body("{\"content\": [], \"usage\": {}}"));

        guarded.invoke(request(ModelConfig.forGroceryExtraction(MODEL_ID), null));

        ArgumentCaptor<InvokeModelRequest> captor = ArgumentCaptor.forClass(InvokeModelRequest.class);
        verify(bedrockClient).invokeModel(captor.capture());
        assertThat(captor.getValue().modelId()).isEqualTo(MODEL_ID);
        assertThat(captor.getValue().guardrailIdentifier()).isEqualTo("gr-123");
        assertThat(captor.getValue().guardrailVersion()).isEqualTo("2");
        assertThat(captor.getValue().trace()).isEqualTo(Trace.ENABLED);
    }

    @Test
    @DisplayName("No guardrail fields without a guardrail id")
    void no_guardrail() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenReturn(body("{\"content\": [{\"type\": \"text\", \"text\": \"hi\"}]}"));

        ModelResponse response = transport.invoke(request(ModelConfig.forHealthCheck(MODEL_ID), null));

        ArgumentCaptor<InvokeModelRequest> captor = ArgumentCaptor.forClass(InvokeModelRequest.class);
        verify(bedrockClient).invokeModel(captor.capture());
        assertThat(captor.getValue().guardrailIdentifier()).isNull();
        assertThat(response.content()).hasSize(1);
    }

    @Test
    @DisplayName("Service errors keep their code, status and Retry-After")
    void service_error() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenThrow(ThrottlingException.builder()
                .message("Too many requests")
                .statusCode(429)
                .awsErrorDetails(AwsErrorDetails.builder()
                        .errorCode("ThrottlingException")
                        .sdkHttpResponse(SdkHttpFullResponse.builder()
                                .statusCode(429)
                                .putHeader("Retry-After", "3")
                                .build())
                        .build())
                .build());

        assertThatThrownBy(() -> transport.invoke(request(ModelConfig.forHealthCheck(MODEL_ID), null)))
                .isInstanceOf(ModelTransportException.class)
                .satisfies(e -> {
                    ModelTransportException mte = (ModelTransportException) e;
                    assertThat(mte.getErrorCode()).isEqualTo("ThrottlingException");
                    assertThat(mte.getHttpStatus()).isEqualTo(429);
                    assertThat(mte.getRetryAfter()).isEqualTo(Duration.ofSeconds(3));
                });
    }

    @Test
    @DisplayName("Service errors without details still carry the status")
    void service_error_without_details() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenThrow(ValidationException.builder().message("bad").statusCode(400).build());

        assertThatThrownBy(() -> transport.invoke(request(ModelConfig.forHealthCheck(MODEL_ID), null)))
                .isInstanceOf(ModelTransportException.class)
                .satisfies(e -> {
                    ModelTransportException mte = (ModelTransportException) e;
                    assertThat(mte.getHttpStatus()).isEqualTo(400);
                    assertThat(mte.getRetryAfter()).isNull();
                });
    }

    @Test
    @DisplayName("Client-side timeouts map to RequestTimeout, other client errors to ClientError")
    void client_errors() {
        ModelConfig config = ModelConfig.forHealthCheck(MODEL_ID);
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenThrow(ApiCallAttemptTimeoutException.builder().message("attempt timed out").build())
                .thenThrow(SdkClientException.builder().message("read").cause(new SocketTimeoutException("Read timed out")).build())
                .thenThrow(SdkClientException.builder().message("Unable to load credentials").build());

        assertThatThrownBy(() -> transport.invoke(request(config, null)))
                .satisfies(e -> assertThat(((ModelTransportException) e).getErrorCode()).isEqualTo("RequestTimeout"));
        assertThatThrownBy(() -> transport.invoke(request(config, null)))
                .satisfies(e -> assertThat(((ModelTransportException) e).getErrorCode()).isEqualTo("RequestTimeout"));
        assertThatThrownBy(() -> transport.invoke(request(config, null)))
                .satisfies(e -> assertThat(((ModelTransportException) e).getErrorCode()).isEqualTo("ClientError"));
    }
}
