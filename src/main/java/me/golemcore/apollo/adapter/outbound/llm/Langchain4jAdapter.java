package me.golemcore.apollo.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.domain.model.LlmChunk;
import me.golemcore.apollo.domain.model.LlmRequest;
import me.golemcore.apollo.domain.model.LlmResponse;
import me.golemcore.apollo.domain.model.LlmUsage;
import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.domain.model.ToolDefinition;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import me.golemcore.apollo.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports OpenAI (and any OpenAI-compatible endpoint through
 * {@code apollo.llm.base-url}) and Anthropic, with function calling and
 * token streaming. Rate limited calls are retried with exponential backoff as
 * long as no output has reached the caller yet.
 *
 * <p>
 * Configuration via {@code apollo.llm.*}.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ApolloProperties properties;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;
    private StreamingChatModel streamingModel;

    @Autowired
    public Langchain4jAdapter(ApolloProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    Langchain4jAdapter(ApolloProperties properties, ObjectMapper objectMapper, ChatModel chatModel,
            StreamingChatModel streamingModel) {
        this(properties, objectMapper);
        this.chatModel = chatModel;
        this.streamingModel = streamingModel;
    }

    private ApolloProperties.LlmProperties config() {
        return properties.getLlm();
    }

    private String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    // Blank means the provider's default endpoint
    private static boolean hasBaseUrl(ApolloProperties.LlmProperties llm) {
        return llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank();
    }

    private void requireApiKey() {
        if (!isAvailable()) {
            throw new IllegalStateException("No API key configured for provider: " + config().getProvider()
                    + ". Set apollo.llm.api-key");
        }
    }

    private synchronized ChatModel chatModel() {
        if (chatModel == null) {
            requireApiKey();
            chatModel = createModel();
            log.info("[LLM] Initialized {} chat model: {}", config().getProvider(), getCurrentModel());
        }
        return chatModel;
    }

    private synchronized StreamingChatModel streamingModel() {
        if (streamingModel == null) {
            requireApiKey();
            streamingModel = createStreamingModel();
            log.info("[LLM] Initialized {} streaming model: {}", config().getProvider(), getCurrentModel());
        }
        return streamingModel;
    }

    ChatModel createModel() {
        ApolloProperties.LlmProperties llm = config();
        String modelName = stripProviderPrefix(llm.getModel());

        if (PROVIDER_ANTHROPIC.equals(llm.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(llm.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(llm.getMaxOutputTokens())
                    .temperature(llm.getTemperature())
                    .timeout(llm.getTimeout());
            if (hasBaseUrl(llm)) {
                builder.baseUrl(llm.getBaseUrl());
            }
            return builder.build();
        }

        // All non-Anthropic providers use OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(llm.getMaxOutputTokens())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout());
        if (hasBaseUrl(llm)) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    StreamingChatModel createStreamingModel() {
        ApolloProperties.LlmProperties llm = config();
        String modelName = stripProviderPrefix(llm.getModel());

        if (PROVIDER_ANTHROPIC.equals(llm.getProvider())) {
            var builder = AnthropicStreamingChatModel.builder()
                    .apiKey(llm.getApiKey())
                    .modelName(modelName)
                    .maxTokens(llm.getMaxOutputTokens())
                    .temperature(llm.getTemperature())
                    .timeout(llm.getTimeout());
            if (hasBaseUrl(llm)) {
                builder.baseUrl(llm.getBaseUrl());
            }
            return builder.build();
        }

        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(modelName)
                .maxTokens(llm.getMaxOutputTokens())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout());
        if (hasBaseUrl(llm)) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = chatModel();
            ChatRequest chatRequest = toChatRequest(request);
            int maxRetries = config().getMaxRetries();

            for (int attempt = 0; attempt <= maxRetries; attempt++) {
                try {
                    return convertResponse(model.chat(chatRequest));
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < maxRetries) {
                        long backoffMs = backoffMillis(attempt, e);
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms",
                                attempt + 1, maxRetries, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed", e);
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        ApolloProperties.LlmProperties llm = config();
        return Flux.defer(() -> streamOnce(request))
                .retryWhen(Retry.backoff(llm.getMaxRetries(), llm.getInitialBackoff())
                        .filter(e -> !(e instanceof StreamInterruptedException) && isRateLimitError(e))
                        .doBeforeRetry(signal -> log.warn("[LLM] Rate limit hit on stream (attempt {}/{}), retrying",
                                signal.totalRetries() + 1, llm.getMaxRetries()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private Flux<LlmChunk> streamOnce(LlmRequest request) {
        StreamingChatModel model = streamingModel();
        ChatRequest chatRequest = toChatRequest(request);
        return Flux.create(sink -> {
            AtomicBoolean emitted = new AtomicBoolean(false);
            model.chat(chatRequest, new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                    if (partialResponse != null && !partialResponse.isEmpty()) {
                        emitted.set(true);
                        sink.next(LlmChunk.delta(partialResponse));
                    }
                }

                @Override
                public void onCompleteResponse(ChatResponse completeResponse) {
                    sink.next(LlmChunk.complete(convertResponse(completeResponse)));
                    sink.complete();
                }

                @Override
                public void onError(Throwable error) {
                    log.warn("[LLM] Stream failed after {} output: {}", emitted.get() ? "partial" : "no",
                            error.getMessage());
                    sink.error(emitted.get() ? new StreamInterruptedException(error) : error);
                }
            });
        });
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public String getCurrentModel() {
        return config().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = config().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private ChatRequest toChatRequest(LlmRequest request) {
        List<ChatMessage> messages = convertMessages(request);
        List<ToolSpecification> tools = convertTools(request);
        ChatRequest.Builder builder = ChatRequest.builder().messages(messages);
        if (!tools.isEmpty()) {
            log.trace("[LLM] Calling model with {} tools", tools.size());
            builder.toolSpecifications(tools);
        }
        return builder.build();
    }

    private long backoffMillis(int attempt, Throwable e) {
        long exponentialBackoffMs = (long) (config().getInitialBackoff().toMillis()
                * Math.pow(config().getBackoffMultiplier(), attempt));
        long resetSeconds = extractResetSeconds(e);
        return resetSeconds > 0 ? Math.max(resetSeconds * 1000, exponentialBackoffMs) : exponentialBackoffMs;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Extract reset_seconds from a rate limit error body. Returns -1 if not found.
     */
    private long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(msg.getContent()));
            case Message.ROLE_ASSISTANT -> messages.add(toAiMessage(msg));
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    msg.getContent()));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
            default -> log.warn("[LLM] Skipping message with unknown role: {}", msg.getRole());
            }
        }

        return messages;
    }

    private AiMessage toAiMessage(Message msg) {
        if (!msg.hasToolCalls()) {
            return AiMessage.from(msg.getContent() != null ? msg.getContent() : "");
        }
        List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                .map(tc -> ToolExecutionRequest.builder()
                        .id(tc.getId())
                        .name(tc.getName())
                        .arguments(convertArgsToJson(tc.getArguments()))
                        .build())
                .toList();
        if (msg.getContent() != null && !msg.getContent().isBlank()) {
            return AiMessage.from(msg.getContent(), toolRequests);
        }
        return AiMessage.from(toolRequests);
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (!request.hasTools()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> rawProperties) {
            Map<String, Object> properties = (Map<String, Object>) rawProperties;
            List<String> required = (List<String>) schema.get("required");

            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<String, Object> entry : properties.entrySet()) {
                schemaBuilder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (required != null && !required.isEmpty()) {
                schemaBuilder.required(required);
            }
            builder.parameters(schemaBuilder.build());
        }

        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        // Enum values take priority
        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (hasText(description)) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type) {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty((String) entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            // Strings, dates and unknown types
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (hasText(description)) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(orZero(response.tokenUsage().inputTokenCount()))
                    .outputTokens(orZero(response.tokenUsage().outputTokenCount()))
                    .totalTokens(orZero(response.tokenUsage().totalTokenCount()))
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(getCurrentModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            // Malformed arguments reach the executor as an empty map and fail validation there
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    /**
     * A stream that failed after part of the answer was already delivered.
     * Never retried, the caller has seen the partial output.
     */
    static final class StreamInterruptedException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        StreamInterruptedException(Throwable cause) {
            super("LLM stream interrupted: " + cause.getMessage(), cause);
        }
    }
}
