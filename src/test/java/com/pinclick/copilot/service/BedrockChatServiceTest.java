package com.pinclick.copilot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BedrockChatServiceTest {

    @Mock
    private BedrockRuntimeClient bedrockClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private BedrockChatService chatService;

    @BeforeEach
    void setUp() {
        chatService = new BedrockChatService(bedrockClient, objectMapper, RateLimiter.create(1000.0), "test-model", 400);
    }

    @Test
    void returnsTheFirstTextBlockWithoutFences() throws Exception {
        String body = "{\"content\":[{\"type\":\"text\",\"text\":\"```json\\n{\\\"intent\\\":\\\"greeting\\\"}\\n```\"}]}";
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenReturn(InvokeModelResponse.builder().body(SdkBytes.fromUtf8String(body)).build());

        String text = chatService.invokeChatForText("hello", 150);

        assertThat(text).isEqualTo("{\"intent\":\"greeting\"}");
        ArgumentCaptor<InvokeModelRequest> request = ArgumentCaptor.forClass(InvokeModelRequest.class);
        verify(bedrockClient).invokeModel(request.capture());
        assertThat(request.getValue().modelId()).isEqualTo("test-model");
        assertThat(objectMapper.readTree(request.getValue().body().asUtf8String()).path("max_tokens").asInt())
                .isEqualTo(150);
    }

    @Test
    void throttlingBecomesThrottledException() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenThrow(BedrockRuntimeException.builder()
                .statusCode(400)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("ThrottlingException").errorMessage("slow down").build())
                .build());

        assertThatThrownBy(() -> chatService.invokeChatForText("hello", null)).isInstanceOf(ThrottledException.class);
    }

    @Test
    void otherApiErrorsAreNotThrottling() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenThrow(BedrockRuntimeException.builder()
                .statusCode(400)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("ValidationException").errorMessage("bad").build())
                .build());

        assertThatThrownBy(() -> chatService.invokeChatForText("hello", null))
                .isInstanceOf(IllegalStateException.class)
                .isNotInstanceOf(ThrottledException.class);
    }

    @Test
    void exhaustedLocalLimiterThrottlesWithoutCallingBedrock() {
        RateLimiter exhausted = mock(RateLimiter.class);
        when(exhausted.tryAcquire()).thenReturn(false);
        BedrockChatService limited = new BedrockChatService(bedrockClient, objectMapper, exhausted, "test-model", 400);

        assertThatThrownBy(() -> limited.invokeChatForText("hello", null)).isInstanceOf(ThrottledException.class);
        verifyNoInteractions(bedrockClient);
    }

    @Test
    void stripJsonFencesLeavesPlainTextAlone() {
        assertThat(BedrockChatService.stripJsonFences("{\"a\":1}")).isEqualTo("{\"a\":1}");
        assertThat(BedrockChatService.stripJsonFences("```\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
        assertThat(BedrockChatService.stripJsonFences(null)).isNull();
    }
}
