package me.golemcore.apollo.domain.service;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.domain.component.ToolComponent;
import me.golemcore.apollo.domain.exception.ToolArgumentException;
import me.golemcore.apollo.domain.model.DomainEntity;
import me.golemcore.apollo.domain.model.EntityType;
import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.domain.model.ToolFailureKind;
import me.golemcore.apollo.domain.model.ToolInvocation;
import me.golemcore.apollo.domain.model.ToolParameter;
import me.golemcore.apollo.domain.model.ToolResult;
import me.golemcore.apollo.domain.model.TurnContext;
import me.golemcore.apollo.domain.system.turn.ToolExecutionOutcome;
import me.golemcore.apollo.domain.system.turn.ToolExecutorPort;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import me.golemcore.apollo.port.outbound.EntityStorePort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Executes model-proposed tool calls on behalf of the authenticated user.
 *
 * <p>
 * Every call passes the same gates before a tool runs:
 * <ol>
 * <li>the tool name must resolve in the {@link ToolRegistry}</li>
 * <li>arguments are allow-listed and validated against the declared
 * parameters; identity fields are never accepted from the model</li>
 * <li>every argument that references an existing entity is re-read and its
 * owner compared with the turn's user; a mismatch is reported as not found</li>
 * </ol>
 * Exceptions from tools or stores are logged and converted into generic
 * execution errors; nothing escapes this boundary.
 */
@Component
@Slf4j
public class ToolCallExecutionService implements ToolExecutorPort {

    /**
     * Argument names that could alias the caller identity. Tools may not declare
     * them and they are never forwarded.
     */
    public static final Set<String> IDENTITY_KEYS = Set.of("user_id", "userId", "owner_id", "ownerId", "owner",
            "user");

    private static final String GENERIC_EXECUTION_ERROR = "The operation could not be completed due to an internal error";
    static final String TIMEOUT_ERROR = "The operation timed out and may still complete. "
            + "Check the current state before trying it again";

    private final ToolRegistry toolRegistry;
    private final ToolArgumentValidator argumentValidator;
    private final EntityStorePort entityStore;
    private final ApolloProperties properties;
    private final ObjectMapper objectMapper;
    private final AtomicLong lateCompletions = new AtomicLong();

    public ToolCallExecutionService(ToolRegistry toolRegistry, ToolArgumentValidator argumentValidator,
            EntityStorePort entityStore, ApolloProperties properties, ObjectMapper objectMapper) {
        this.toolRegistry = toolRegistry;
        this.argumentValidator = argumentValidator;
        this.entityStore = entityStore;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolExecutionOutcome execute(TurnContext context, Message.ToolCall toolCall) {
        String toolName = ToolRegistry.sanitizeName(toolCall.getName());
        Optional<ToolComponent> tool = toolRegistry.find(toolName);
        if (tool.isEmpty()) {
            String available = String.join(", ", toolRegistry.getToolNames());
            log.warn("[Tools] Model requested unknown tool '{}'", toolCall.getName());
            return outcome(toolCall, ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                    "Unknown tool: " + toolName + ". Available tools: " + available), Map.of());
        }

        Map<String, Object> arguments;
        try {
            arguments = argumentValidator.validate(toolName, tool.get().getParameters(), toolCall.getArguments());
        } catch (ToolArgumentException e) {
            log.info("[Tools] Rejected arguments for '{}': {}", toolName, e.getMessage());
            return outcome(toolCall, ToolResult.invalid(e.getMessage()), Map.of());
        }

        ToolResult result;
        try {
            Optional<ToolResult> ownershipFailure = verifyOwnership(context.userId(), tool.get().getParameters(),
                    arguments);
            result = ownershipFailure.isPresent()
                    ? ownershipFailure.get()
                    : runTool(tool.get(), new ToolInvocation(context.userId(), context.conversationId(), arguments));
        } catch (RuntimeException e) { // NOSONAR - store failures must not reach the model
            log.error("[Tools] Ownership check failed for '{}'", toolName, e);
            result = ToolResult.failure(ToolFailureKind.EXECUTION_ERROR, GENERIC_EXECUTION_ERROR);
        }

        log.info("[Tools] audit user={} conversation={} tool={} status={}{}", context.userId(),
                context.conversationId(), toolName, result.isSuccess() ? "success" : "error",
                result.isSuccess() ? "" : " kind=" + result.getFailureKind());
        return outcome(toolCall, result, arguments);
    }

    private ToolResult runTool(ToolComponent tool, ToolInvocation invocation) {
        long timeoutMs = properties.getTurn().getToolTimeout().toMillis();
        CompletableFuture<ToolResult> future = null;
        try {
            future = tool.execute(invocation);
            ToolResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                log.error("[Tools] Tool '{}' returned no result", tool.getToolName());
                return ToolResult.failure(ToolFailureKind.EXECUTION_ERROR, GENERIC_EXECUTION_ERROR);
            }
            return result;
        } catch (TimeoutException e) {
            // The tool cannot be interrupted; its outcome is audited when it lands
            future.whenComplete((late, error) -> auditLateCompletion(tool.getToolName(), invocation, late, error));
            log.error("[Tools] Tool '{}' timed out after {}ms", tool.getToolName(), timeoutMs);
            return ToolResult.failure(ToolFailureKind.EXECUTION_ERROR, TIMEOUT_ERROR);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_ERROR, GENERIC_EXECUTION_ERROR);
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", tool.getToolName(), e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_ERROR, GENERIC_EXECUTION_ERROR);
        }
    }

    private void auditLateCompletion(String toolName, ToolInvocation invocation, ToolResult result,
            Throwable error) {
        lateCompletions.incrementAndGet();
        String status = error == null && result != null && result.isSuccess() ? "success" : "error";
        log.warn("[Tools] audit LATE user={} conversation={} tool={} status={} (finished after the caller "
                + "was told it timed out)", invocation.userId(), invocation.conversationId(), toolName, status);
    }

    /**
     * Number of timed-out tool calls that finished afterwards.
     */
    long lateCompletions() {
        return lateCompletions.get();
    }

    /**
     * Re-reads every referenced entity and checks it belongs to the caller.
     * Missing, foreign and wrongly typed entities all yield the same not-found
     * result.
     */
    @SuppressWarnings("unchecked")
    private Optional<ToolResult> verifyOwnership(String userId, List<ToolParameter> parameters,
            Map<String, Object> arguments) {
        for (ToolParameter parameter : parameters) {
            Object value = arguments.get(parameter.getName());
            if (value == null) {
                continue;
            }
            if (parameter.getType() == ToolParameter.ParameterType.OBJECT && value instanceof Map<?, ?> nested) {
                Optional<ToolResult> nestedFailure = verifyOwnership(userId, parameter.getProperties(),
                        (Map<String, Object>) nested);
                if (nestedFailure.isPresent()) {
                    return nestedFailure;
                }
                continue;
            }
            EntityType ownedType = parameter.getOwnedEntity();
            if (ownedType != null && !isOwned(userId, ownedType, value.toString())) {
                log.info("[Tools] Ownership check failed for {} {}", ownedType, value);
                return Optional.of(ToolResult.notFound(ownedType.getLabel()));
            }
        }
        return Optional.empty();
    }

    private boolean isOwned(String userId, EntityType type, String entityId) {
        Optional<DomainEntity> entity = entityStore.getEntity(entityId);
        return entity.isPresent() && entity.get().getType() == type && entity.get().isOwnedBy(userId);
    }

    private ToolExecutionOutcome outcome(Message.ToolCall toolCall, ToolResult result,
            Map<String, Object> arguments) {
        String content = truncateToolResult(buildToolMessageContent(toolCall.getName(), result), toolCall.getName());
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, content, arguments);
    }

    /**
     * Serializes a result as {@code {tool, status, result}} or
     * {@code {tool, status, error_type, error}}.
     */
    private String buildToolMessageContent(String toolName, ToolResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", toolName);
        if (result.isSuccess()) {
            payload.put("status", "success");
            payload.put("message", result.getOutput());
            if (result.getData() != null) {
                payload.put("result", result.getData());
            }
        } else {
            payload.put("status", "error");
            payload.put("error_type", result.getFailureKind() != null
                    ? result.getFailureKind().name().toLowerCase(Locale.ROOT)
                    : "execution_error");
            payload.put("error", result.getError());
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Failed to serialize result of '{}': {}", toolName, e.getMessage());
            return result.isSuccess() ? String.valueOf(result.getOutput()) : "Error: " + result.getError();
        }
    }

    /**
     * Truncate tool result content that exceeds the configured max length.
     */
    String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return null;
        }
        int maxChars = properties.getTools().getMaxResultChars();
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }
        String suffix = "\n[OUTPUT TRUNCATED: " + content.length() + " chars total]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars", toolName, content.length(),
                cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }
}
