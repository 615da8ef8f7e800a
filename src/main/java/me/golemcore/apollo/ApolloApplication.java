package me.golemcore.apollo;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the APOLLO agent core.
 *
 * <p>
 * Runs conversational turns for the Life Coordinator: assembles a token-bounded
 * snapshot of the user's goals, milestones and tasks, calls the model, executes
 * the tools it requests on the user's behalf and streams the answer back.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → ChatController, ConversationsController
 * Domain Layer       → TurnCoordinator, DefaultConversationTurnSystem, Services, Tools
 * Infrastructure     → LLM/Tokenizer/Storage Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code apollo.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ApolloApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApolloApplication.class, args);
    }

}
