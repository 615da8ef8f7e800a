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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.domain.model.TurnContext;
import me.golemcore.apollo.domain.model.TurnFailureKind;
import me.golemcore.apollo.domain.model.TurnRequest;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import me.golemcore.apollo.port.outbound.ConversationPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Accepts turns and runs them one at a time per conversation.
 *
 * <p>
 * Turns of different conversations run concurrently on the turn executor. A
 * turn submitted while another turn of the same conversation is running waits
 * in that conversation's queue, so its history read always sees the previous
 * turn's persisted messages. The turn deadline starts when the turn starts
 * running, not when it is queued.
 */
@Service
@Slf4j
public class TurnCoordinator {

    private final ConversationPort conversationPort;
    private final ConversationTurnSystem turnSystem;
    private final ExecutorService turnExecutor;
    private final ApolloProperties properties;
    private final Clock clock;

    private final Map<String, ConversationRunner> runners = new ConcurrentHashMap<>();

    public TurnCoordinator(ConversationPort conversationPort, ConversationTurnSystem turnSystem,
            @Qualifier("turnExecutor") ExecutorService turnExecutor, ApolloProperties properties, Clock clock) {
        this.conversationPort = conversationPort;
        this.turnSystem = turnSystem;
        this.turnExecutor = turnExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Resolves the conversation and queues the turn.
     *
     * @throws IllegalArgumentException
     *             if the message is blank after trimming
     * @throws me.golemcore.apollo.domain.exception.ConversationNotFoundException
     *             if a conversation id was given that the user does not own
     */
    public TurnHandle submit(TurnRequest request) {
        String message = request.getMessage() != null ? request.getMessage().strip() : "";
        if (message.isEmpty()) {
            throw new IllegalArgumentException("Message must not be blank");
        }

        String conversationId = conversationPort.getOrCreateConversation(request.getUserId(),
                request.getConversationId());
        TurnEventEmitter emitter = new TurnEventEmitter();
        Runnable task = () -> runTurn(request, conversationId, message, emitter);

        while (!runners.computeIfAbsent(conversationId, ConversationRunner::new).enqueue(task)) {
            Thread.onSpinWait(); // runner is retiring, a fresh one replaces it
        }
        log.debug("[Turn] Accepted turn for conversation {}", conversationId);
        return new TurnHandle(conversationId, emitter.events());
    }

    int activeConversations() {
        return runners.size();
    }

    private void runTurn(TurnRequest request, String conversationId, String message, TurnEventEmitter emitter) {
        ApolloProperties.ContextProperties context = properties.getContext();
        TurnContext turnContext = new TurnContext(
                request.getUserId(),
                conversationId,
                properties.getLlm().getModel(),
                context.getModelContextWindow() - context.getReservedOutputTokens(),
                clock.instant().plus(properties.getTurn().getDeadline()),
                request.getClientHistory());
        try {
            turnSystem.processTurn(turnContext, message, emitter);
        } catch (Exception e) { // NOSONAR - must not kill executor thread
            log.error("[Turn] Turn failed for conversation {}: {}", conversationId, e.getMessage(), e);
            emitter.error(TurnFailureKind.MODEL_ERROR.getUserMessage());
        }
    }

    private final class ConversationRunner {

        private final String conversationId;
        private final Object lock = new Object();
        private final Deque<Runnable> queued = new ArrayDeque<>();
        private boolean running;
        private boolean retired;

        private ConversationRunner(String conversationId) {
            this.conversationId = conversationId;
        }

        /**
         * @return false if this runner already retired and must be replaced
         */
        boolean enqueue(Runnable task) {
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                if (running) {
                    queued.addLast(task);
                    log.debug("[Turn] Conversation {} busy, queued turn ({} waiting)", conversationId,
                            queued.size());
                    return true;
                }
                running = true;
            }
            start(task);
            return true;
        }

        private void start(Runnable task) {
            turnExecutor.submit(() -> {
                try {
                    task.run();
                } finally {
                    onRunComplete();
                }
            });
        }

        private void onRunComplete() {
            Runnable next;
            synchronized (lock) {
                next = queued.pollFirst();
                if (next == null) {
                    running = false;
                    retired = true;
                }
            }
            if (next != null) {
                start(next);
                return;
            }
            runners.remove(conversationId, this);
        }
    }
}
