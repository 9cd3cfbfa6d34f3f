package com.pinclick.copilot.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

/**
 * Single-shot chat completions against Amazon Bedrock. Throttling and local quota exhaustion
 * surface as {@link ThrottledException}; nothing is retried.
 */
@Service
public class BedrockChatService {

    private static final Logger logger = LoggerFactory.getLogger(BedrockChatService.class);

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter chatRateLimiter;
    private final String modelId;
    private final int defaultMaxTokens;

    public BedrockChatService(BedrockRuntimeClient bedrockClient,
                              ObjectMapper objectMapper,
                              @Qualifier("chatRateLimiter") RateLimiter chatRateLimiter,
                              @Value("${aws.bedrock.modelId:anthropic.claude-3-haiku-20240307-v1:0}") String modelId,
                              @Value("${app.bedrock.maxTokens:400}") int defaultMaxTokens) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.chatRateLimiter = chatRateLimiter;
        this.modelId = modelId;
        this.defaultMaxTokens = Math.max(64, defaultMaxTokens);
        logger.info("BedrockChatService initialized with model ID: {}", modelId);
    }

    /**
     * Sends one user message and returns the first text block, with JSON fences removed.
     */
    @SuppressWarnings("UnstableApiUsage")
    public String invokeChatForText(String content, Integer overrideMaxTokens) {
        if (!chatRateLimiter.tryAcquire()) {
            throw new ThrottledException("Local chat rate limit exhausted");
        }
        int maxTokens = overrideMaxTokens != null ? Math.max(64, overrideMaxTokens) : defaultMaxTokens;
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("anthropic_version", "bedrock-2023-05-31");
            payload.put("max_tokens", maxTokens);
            payload.put("temperature", 0);
            ArrayNode messages = payload.putArray("messages");
            ObjectNode userMessage = messages.addObject();
            userMessage.put("role", "user");
            userMessage.put("content", content);

            InvokeModelRequest request = InvokeModelRequest.builder()
                    .modelId(modelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                    .build();

            InvokeModelResponse response = invoke(request);
            JsonNode contentBlock = objectMapper.readTree(response.body().asUtf8String()).path("content");
            if (contentBlock.isArray() && contentBlock.size() > 0) {
                return stripJsonFences(contentBlock.get(0).path("text").asText(""));
            }
            throw new IllegalStateException("Bedrock response missing content block");
        } catch (ThrottledException te) {
            throw te; // do not swallow throttling
        } catch (BedrockRuntimeException e) {
            logger.error("Bedrock API error during chat invoke for model {}: {}", modelId,
                    e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage(), e);
            throw new IllegalStateException("Bedrock API error during chat invoke", e);
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected error during chat invoke: " + e.getMessage(), e);
        }
    }

    private InvokeModelResponse invoke(InvokeModelRequest request) {
        try {
            return bedrockClient.invokeModel(request);
        } catch (BedrockRuntimeException e) {
            if (isThrottling(e)) {
                logger.warn("Bedrock throttled the chat call: {}",
                        e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage());
                throw new ThrottledException("Bedrock throttling", e);
            }
            throw e;
        }
    }

    static boolean isThrottling(BedrockRuntimeException e) {
        String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        return e.statusCode() == 429
                || "ThrottlingException".equalsIgnoreCase(code)
                || "TooManyRequestsException".equalsIgnoreCase(code)
                || "ServiceQuotaExceededException".equalsIgnoreCase(code)
                || "ProvisionedThroughputExceededException".equalsIgnoreCase(code);
    }

    static String stripJsonFences(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            int newline = trimmed.indexOf('\n');
            if (newline > 0 && trimmed.substring(0, newline).matches("[a-zA-Z0-9_-]+")) {
                trimmed = trimmed.substring(newline + 1).trim();
            }
        }
        return trimmed;
    }
}
