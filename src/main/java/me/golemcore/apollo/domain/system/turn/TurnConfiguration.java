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

import me.golemcore.apollo.domain.service.ContextAssemblyService;
import me.golemcore.apollo.domain.service.SystemPromptBuilder;
import me.golemcore.apollo.domain.service.TokenEstimationService;
import me.golemcore.apollo.domain.service.ToolRegistry;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import me.golemcore.apollo.port.outbound.ConversationPort;
import me.golemcore.apollo.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class TurnConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService turnExecutor() {
        return Executors.newCachedThreadPool(namedThreads("apollo-turn-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutionPool(ApolloProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getTurn().getToolParallelism()),
                namedThreads("apollo-tool-"));
    }

    @Bean
    public ConversationTurnSystem conversationTurnSystem(LlmPort llmPort, ConversationPort conversationPort,
            ContextAssemblyService contextAssembly, TokenEstimationService tokenEstimator,
            SystemPromptBuilder promptBuilder, ToolRegistry toolRegistry, ToolExecutorPort toolExecutor,
            @Qualifier("toolExecutionPool") ExecutorService toolPool, ApolloProperties properties, Clock clock) {
        return new DefaultConversationTurnSystem(llmPort, conversationPort, contextAssembly, tokenEstimator,
                promptBuilder, toolRegistry, toolExecutor, toolPool, properties, clock);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
