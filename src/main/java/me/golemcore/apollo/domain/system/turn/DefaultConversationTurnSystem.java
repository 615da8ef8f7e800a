package me.golemcore.apollo.domain.system.turn;

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

import me.golemcore.apollo.domain.exception.TurnFailureException;
import me.golemcore.apollo.domain.model.ContextSnapshot;
import me.golemcore.apollo.domain.model.LlmChunk;
import me.golemcore.apollo.domain.model.LlmRequest;
import me.golemcore.apollo.domain.model.LlmResponse;
import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.domain.model.ToolDefinition;
import me.golemcore.apollo.domain.model.ToolFailureKind;
import me.golemcore.apollo.domain.model.ToolInvocationRecord;
import me.golemcore.apollo.domain.model.TurnContext;
import me.golemcore.apollo.domain.model.TurnFailureKind;
import me.golemcore.apollo.domain.model.TurnState;
import me.golemcore.apollo.domain.service.ContextAssemblyService;
import me.golemcore.apollo.domain.service.SystemPromptBuilder;
import me.golemcore.apollo.domain.service.TokenEstimationService;
import me.golemcore.apollo.domain.service.ToolRegistry;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import me.golemcore.apollo.port.outbound.ConversationPort;
import me.golemcore.apollo.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Turn orchestrator.
 *
 * <p>
 * State machine: {@code RECEIVED -> CONTEXT_BUILT -> MODEL_CALLED ->
 * [TOOLS_REQUESTED -> TOOLS_EXECUTED -> MODEL_RESUMED] -> FINALIZED ->
 * PERSISTED}, with {@code FAILED} reachable from every state. The user message
 * is persisted before anything else happens, so it survives every later
 * failure. A turn has at most one tool round: tools are offered on the first
 * model call only.
 */
public class DefaultConversationTurnSystem implements ConversationTurnSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultConversationTurnSystem.class);

    static final String FALLBACK_REPLY = "I wasn't able to put together a response. Please try rephrasing your request.";
    private static final String RESULT_SHORTENED_MARKER = "\n[RESULT SHORTENED TO FIT CONTEXT]";
    private static final String GENERIC_TOOL_ERROR = "The operation could not be completed due to an internal error";

    private final LlmPort llmPort;
    private final ConversationPort conversationPort;
    private final ContextAssemblyService contextAssembly;
    private final TokenEstimationService tokenEstimator;
    private final SystemPromptBuilder promptBuilder;
    private final ToolRegistry toolRegistry;
    private final ToolExecutorPort toolExecutor;
    private final ExecutorService toolPool;
    private final ApolloProperties properties;
    private final Clock clock;

    public DefaultConversationTurnSystem(LlmPort llmPort, ConversationPort conversationPort,
            ContextAssemblyService contextAssembly, TokenEstimationService tokenEstimator,
            SystemPromptBuilder promptBuilder, ToolRegistry toolRegistry, ToolExecutorPort toolExecutor,
            ExecutorService toolPool, ApolloProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.conversationPort = conversationPort;
        this.contextAssembly = contextAssembly;
        this.tokenEstimator = tokenEstimator;
        this.promptBuilder = promptBuilder;
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.toolPool = toolPool;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public TurnOutcome processTurn(TurnContext context, String userMessage, TurnEventEmitter emitter) {
        TurnProgress turn = new TurnProgress(context);
        try {
            return run(turn, userMessage, emitter);
        } catch (TurnFailureException e) {
            log.warn("[Turn] Conversation {} failed in state {} ({}): {}", context.conversationId(), turn.state,
                    e.getKind(), e.getMessage(), e.getCause());
            return fail(turn, e.getKind(), emitter);
        } catch (RuntimeException e) { // NOSONAR - every turn must end with a terminal event
            log.error("[Turn] Conversation {} failed unexpectedly in state {}", context.conversationId(),
                    turn.state, e);
            return fail(turn, TurnFailureKind.MODEL_ERROR, emitter);
        }
    }

    private TurnOutcome run(TurnProgress turn, String userMessage, TurnEventEmitter emitter) {
        TurnContext context = turn.context;
        String model = context.model();

        // 1) RECEIVED -> CONTEXT_BUILT: persist first, then read history and context
        turn.userMessageId = persistUserMessage(context, userMessage);
        Message inbound = Message.builder().role(Message.ROLE_USER).content(userMessage).build();
        List<Message> history = loadHistory(context, turn.userMessageId);

        String instructions = promptBuilder.baseInstructions();
        List<ToolDefinition> tools = toolRegistry.getDefinitions();
        int available = context.tokenBudget() - tokenEstimator.count(model, instructions)
                - tokenEstimator.count(model, SystemPromptBuilder.SECTION_SEPARATOR)
                - tokenEstimator.countMessage(model, inbound)
                - tokenEstimator.countTools(model, tools);
        int snapshotCap = properties.getContext().getMaxSnapshotTokens();
        int historyBudget = Math.max(0, available - Math.min(snapshotCap, Math.max(0, available) / 2));
        List<Message> window = tokenEstimator.fitNewest(model, history, historyBudget);
        int historyTokens = tokenEstimator.countMessages(model, window);
        int contextBudget = Math.max(0, Math.min(snapshotCap, available - historyTokens));

        ContextSnapshot snapshot = contextAssembly.assemble(context.userId(), model, contextBudget);
        String systemPrompt = promptBuilder.build(instructions, snapshot);
        transition(turn, TurnState.CONTEXT_BUILT);
        log.debug("[Turn] Budget {} tokens: {} history messages ({} tokens), context {} of {} tokens",
                context.tokenBudget(), window.size(), historyTokens, snapshot.getEstimatedTokens(), contextBudget);

        // 2) First model call, tools offered
        List<Message> messages = new ArrayList<>(window);
        messages.add(inbound);
        LlmResponse response = callModel(turn, buildRequest(context, systemPrompt, messages, tools), emitter);
        transition(turn, TurnState.MODEL_CALLED);

        // 3) Optional tool round, then resume without tools
        if (response.hasToolCalls()) {
            transition(turn, TurnState.TOOLS_REQUESTED);
            List<Message.ToolCall> toolCalls = withIds(response.getToolCalls());
            emitter.progress("Working on it: " + toolCalls.stream()
                    .map(Message.ToolCall::getName)
                    .collect(Collectors.joining(", ")));

            List<ToolExecutionOutcome> outcomes = executeTools(turn, toolCalls);
            transition(turn, TurnState.TOOLS_EXECUTED);

            Message toolCallMessage = Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(response.getContent())
                    .toolCalls(toolCalls)
                    .build();
            List<Message> toolMessages = new ArrayList<>(outcomes.size());
            for (ToolExecutionOutcome outcome : outcomes) {
                toolMessages.add(Message.builder()
                        .role(Message.ROLE_TOOL)
                        .toolCallId(outcome.toolCallId())
                        .toolName(outcome.toolName())
                        .content(outcome.messageContent())
                        .build());
            }
            List<Message> resumed = fitResumedMessages(context, systemPrompt, window, inbound, toolCallMessage,
                    toolMessages);
            callModel(turn, buildRequest(context, systemPrompt, resumed, List.of()), emitter);
            transition(turn, TurnState.MODEL_RESUMED);
        }

        // 4) FINALIZED -> PERSISTED
        if (turn.text.toString().isBlank()) {
            log.warn("[Turn] Model returned no text for conversation {}", context.conversationId());
            turn.text.append(FALLBACK_REPLY);
            emitter.chunk(FALLBACK_REPLY);
        }
        String content = turn.text.toString();
        transition(turn, TurnState.FINALIZED);

        String assistantMessageId = persistAssistantMessage(context, content, turn.outcomes);
        transition(turn, TurnState.PERSISTED);
        emitter.done();
        log.info("[Turn] Completed turn for conversation {} ({} tool calls)", context.conversationId(),
                turn.outcomes.size());
        return TurnOutcome.persisted(turn.userMessageId, assistantMessageId, content, turn.outcomes);
    }

    private TurnOutcome fail(TurnProgress turn, TurnFailureKind kind, TurnEventEmitter emitter) {
        transition(turn, TurnState.FAILED);
        emitter.error(kind.getUserMessage());
        return TurnOutcome.failed(kind, turn.userMessageId, turn.outcomes);
    }

    private void transition(TurnProgress turn, TurnState next) {
        log.debug("[Turn] {} -> {} (conversation {})", turn.state, next, turn.context.conversationId());
        turn.state = next;
    }

    private String persistUserMessage(TurnContext context, String userMessage) {
        try {
            return conversationPort.appendMessage(context.conversationId(), Message.builder()
                    .role(Message.ROLE_USER)
                    .content(userMessage)
                    .build());
        } catch (RuntimeException e) {
            throw new TurnFailureException(TurnFailureKind.STORE_ERROR, "Failed to persist user message", e);
        }
    }

    private String persistAssistantMessage(TurnContext context, String content, List<ToolExecutionOutcome> outcomes) {
        List<ToolInvocationRecord> records = outcomes.isEmpty()
                ? null
                : outcomes.stream().map(ToolExecutionOutcome::toRecord).toList();
        try {
            return conversationPort.appendMessage(context.conversationId(), Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(content)
                    .toolInvocations(records)
                    .build());
        } catch (RuntimeException e) {
            throw new TurnFailureException(TurnFailureKind.STORE_ERROR, "Failed to persist assistant message", e);
        }
    }

    /**
     * Reads the trailing history from the store, excluding the message just
     * persisted. The client's copy is used only when the store read fails.
     */
    private List<Message> loadHistory(TurnContext context, String userMessageId) {
        int limit = properties.getTurn().getHistoryLimit();
        List<Message> source;
        try {
            source = conversationPort.getRecentMessages(context.conversationId(), limit + 1).stream()
                    .filter(message -> !userMessageId.equals(message.getId()))
                    .toList();
        } catch (RuntimeException e) { // NOSONAR - fall back to client history
            log.warn("[Turn] History read failed for conversation {}, using client history: {}",
                    context.conversationId(), e.getMessage());
            source = context.clientHistory();
        }

        List<Message> replayable = source.stream()
                .filter(message -> message.isUserMessage() || message.isAssistantMessage())
                .filter(message -> message.getContent() != null && !message.getContent().isBlank())
                .map(message -> Message.builder().role(message.getRole()).content(message.getContent()).build())
                .toList();
        return replayable.subList(Math.max(0, replayable.size() - limit), replayable.size());
    }

    /**
     * Lays out the resumed call within the token budget. The tool round has
     * priority: history is dropped oldest first, and results are shortened
     * evenly only once no history is left.
     */
    private List<Message> fitResumedMessages(TurnContext context, String systemPrompt, List<Message> window,
            Message inbound, Message toolCallMessage, List<Message> toolMessages) {
        String model = context.model();
        int fixedTokens = tokenEstimator.count(model, systemPrompt) + tokenEstimator.countMessage(model, inbound)
                + tokenEstimator.countMessage(model, toolCallMessage);
        int resultTokens = tokenEstimator.countMessages(model, toolMessages);
        int spare = context.tokenBudget() - fixedTokens - resultTokens;

        List<Message> results = toolMessages;
        if (spare < 0) {
            int share = Math.max(0, context.tokenBudget() - fixedTokens) / toolMessages.size()
                    - TokenEstimationService.MESSAGE_OVERHEAD_TOKENS;
            log.debug("[Turn] Tool results need {} tokens, shortening each to {}", resultTokens, share);
            results = toolMessages.stream()
                    .map(message -> Message.builder()
                            .role(message.getRole())
                            .toolCallId(message.getToolCallId())
                            .toolName(message.getToolName())
                            .content(tokenEstimator.truncateToTokens(model, message.getContent(),
                                    Math.max(0, share), RESULT_SHORTENED_MARKER))
                            .build())
                    .toList();
        }

        List<Message> messages = new ArrayList<>(tokenEstimator.fitNewest(model, window, Math.max(0, spare)));
        messages.add(inbound);
        messages.add(toolCallMessage);
        messages.addAll(results);
        return messages;
    }

    private LlmRequest buildRequest(TurnContext context, String systemPrompt, List<Message> messages,
            List<ToolDefinition> tools) {
        return LlmRequest.builder()
                .model(context.model())
                .systemPrompt(systemPrompt)
                .messages(new ArrayList<>(messages))
                .tools(new ArrayList<>(tools))
                .temperature(properties.getLlm().getTemperature())
                .maxTokens(properties.getLlm().getMaxOutputTokens())
                .conversationId(context.conversationId())
                .build();
    }

    /**
     * Calls the model within the turn deadline. Streamed text is forwarded to
     * the emitter and collected as the assistant content.
     */
    private LlmResponse callModel(TurnProgress turn, LlmRequest request, TurnEventEmitter emitter) {
        long remainingMs = remainingMillis(turn.context);
        if (remainingMs <= 0) {
            throw new TurnFailureException(TurnFailureKind.TIMEOUT, "Deadline exceeded before model call");
        }

        LlmResponse response;
        try {
            if (properties.getLlm().isStreaming() && llmPort.supportsStreaming()) {
                response = llmPort.chatStream(request)
                        .doOnNext(chunk -> {
                            if (chunk.hasText()) {
                                turn.text.append(chunk.getText());
                                emitter.chunk(chunk.getText());
                            }
                        })
                        .filter(chunk -> chunk.isDone() && chunk.getResponse() != null)
                        .map(LlmChunk::getResponse)
                        .timeout(Duration.ofMillis(remainingMs))
                        .blockLast();
            } else {
                response = llmPort.chat(request).get(remainingMs, TimeUnit.MILLISECONDS);
                if (response != null && response.getContent() != null && !response.getContent().isEmpty()) {
                    turn.text.append(response.getContent());
                    emitter.chunk(response.getContent());
                }
            }
        } catch (TimeoutException e) {
            throw new TurnFailureException(TurnFailureKind.TIMEOUT, "Model call exceeded the turn deadline", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnFailureException(TurnFailureKind.TIMEOUT, "Interrupted while waiting for the model", e);
        } catch (ExecutionException e) {
            throw new TurnFailureException(TurnFailureKind.MODEL_ERROR, "Model call failed", e.getCause());
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new TurnFailureException(TurnFailureKind.TIMEOUT, "Model stream exceeded the turn deadline", e);
            }
            throw new TurnFailureException(TurnFailureKind.MODEL_ERROR, "Model call failed", e);
        }

        if (response == null) {
            throw new TurnFailureException(TurnFailureKind.MODEL_ERROR, "Model returned no response");
        }
        return response;
    }

    /**
     * Runs the requested tools concurrently and returns their outcomes in
     * request order, whatever order they complete in. Unregistered tools never
     * reach the executor.
     */
    private List<ToolExecutionOutcome> executeTools(TurnProgress turn, List<Message.ToolCall> toolCalls) {
        List<CompletableFuture<ToolExecutionOutcome>> futures = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall toolCall : toolCalls) {
            if (toolRegistry.resolve(toolCall.getName()).isEmpty()) {
                log.warn("[Turn] Model requested unregistered tool '{}'", toolCall.getName());
                futures.add(CompletableFuture.completedFuture(ToolExecutionOutcome.failure(toolCall,
                        ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: " + toolCall.getName())));
            } else {
                futures.add(CompletableFuture.supplyAsync(() -> toolExecutor.execute(turn.context, toolCall),
                        toolPool));
            }
        }

        List<ToolExecutionOutcome> outcomes = new ArrayList<>(toolCalls.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get(Math.max(0, remainingMillis(turn.context)), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                auditAbandonedTools(turn.context, toolCalls, futures);
                throw new TurnFailureException(TurnFailureKind.TIMEOUT, "Tool execution exceeded the turn deadline",
                        e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                auditAbandonedTools(turn.context, toolCalls, futures);
                throw new TurnFailureException(TurnFailureKind.TIMEOUT, "Interrupted while running tools", e);
            } catch (ExecutionException e) {
                log.error("[Turn] Tool '{}' failed outside the executor boundary", toolCalls.get(i).getName(),
                        e.getCause());
                outcomes.add(ToolExecutionOutcome.failure(toolCalls.get(i), ToolFailureKind.EXECUTION_ERROR,
                        GENERIC_TOOL_ERROR));
            }
        }
        turn.outcomes = List.copyOf(outcomes);
        return turn.outcomes;
    }

    /**
     * Tool calls keep running after the turn gives up on them, so whatever
     * they commit later is written to the audit log.
     */
    private void auditAbandonedTools(TurnContext context, List<Message.ToolCall> toolCalls,
            List<CompletableFuture<ToolExecutionOutcome>> futures) {
        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<ToolExecutionOutcome> future = futures.get(i);
            if (future.isDone()) {
                continue;
            }
            Message.ToolCall toolCall = toolCalls.get(i);
            future.whenComplete((outcome, error) -> log.warn(
                    "[Turn] audit LATE conversation={} tool={} call={} status={} (turn had already failed)",
                    context.conversationId(), toolCall.getName(), toolCall.getId(),
                    outcome != null && outcome.isSuccess() ? "success" : "error"));
        }
    }

    private static List<Message.ToolCall> withIds(List<Message.ToolCall> toolCalls) {
        List<Message.ToolCall> result = new ArrayList<>(toolCalls.size());
        for (int i = 0; i < toolCalls.size(); i++) {
            Message.ToolCall toolCall = toolCalls.get(i);
            if (toolCall.getId() == null || toolCall.getId().isBlank()) {
                toolCall = Message.ToolCall.builder()
                        .id("call_" + i)
                        .name(toolCall.getName())
                        .arguments(toolCall.getArguments())
                        .build();
            }
            result.add(toolCall);
        }
        return result;
    }

    private long remainingMillis(TurnContext context) {
        return Duration.between(clock.instant(), context.deadline()).toMillis();
    }

    private static final class TurnProgress {
        private final TurnContext context;
        private final StringBuilder text = new StringBuilder();
        private TurnState state = TurnState.RECEIVED;
        private String userMessageId;
        private List<ToolExecutionOutcome> outcomes = List.of();

        private TurnProgress(TurnContext context) {
            this.context = context;
        }
    }
}
