package me.golemcore.apollo.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the agent, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code apollo.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model provider and retry settings</li>
 * <li>{@link TurnProperties} - per-turn limits</li>
 * <li>{@link ContextProperties} - token budgets for prompt assembly</li>
 * <li>{@link ToolsProperties} - tool execution limits</li>
 * <li>{@link StorageProperties} - persistence location</li>
 * <li>{@link SecurityProperties} - bearer token verification</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "apollo")
@Data
public class ApolloProperties {

    private LlmProperties llm = new LlmProperties();
    private TurnProperties turn = new TurnProperties();
    private ContextProperties context = new ContextProperties();
    private ToolsProperties tools = new ToolsProperties();
    private StorageProperties storage = new StorageProperties();
    private SecurityProperties security = new SecurityProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** openai or anthropic. Any OpenAI-compatible endpoint works via baseUrl. */
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.7;
        private int maxOutputTokens = 500;
        private Duration timeout = Duration.ofSeconds(60);
        private boolean streaming = true;

        /** Retries for rate limited model calls. Tool calls are never retried. */
        private int maxRetries = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;
    }

    // ==================== TURN ====================

    @Data
    public static class TurnProperties {
        /** Wall-clock budget for the model and tool work of one turn. */
        private Duration deadline = Duration.ofSeconds(90);

        /** Trailing messages sent to the model as history. */
        private int historyLimit = 10;

        private Duration toolTimeout = Duration.ofSeconds(30);

        /** Upper bound on tool calls of one turn running at the same time. */
        private int toolParallelism = 4;
    }

    // ==================== CONTEXT ====================

    @Data
    public static class ContextProperties {
        private int modelContextWindow = 8192;
        private int reservedOutputTokens = 1024;
        private int maxSnapshotTokens = 1500;
        private int maxEntities = 50;
        private int tokenizerCacheSize = 10;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private int maxResultChars = 4000;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.apollo";
    }

    // ==================== SECURITY ====================

    @Data
    public static class SecurityProperties {
        /** HMAC secret for bearer tokens. Blank generates an ephemeral one. */
        private String jwtSecret;
    }
}
