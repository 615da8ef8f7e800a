package me.golemcore.apollo.domain.model;

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

import java.time.Instant;
import java.util.List;

/**
 * Everything a turn needs to know about its caller and limits, passed explicitly
 * through every component instead of living in shared session state.
 *
 * @param userId
 *            authenticated user, never taken from model output
 * @param conversationId
 *            resolved conversation the turn belongs to
 * @param model
 *            model identifier used for the calls and for token estimation
 * @param tokenBudget
 *            input tokens available to the model (context window minus output
 *            reserve)
 * @param deadline
 *            point in time after which the turn fails with a timeout
 * @param clientHistory
 *            trailing history sent by the client, used only when the store
 *            cannot be read
 */
public record TurnContext(String userId, String conversationId, String model, int tokenBudget, Instant deadline,
        List<Message> clientHistory) {

    public TurnContext {
        clientHistory = clientHistory != null ? List.copyOf(clientHistory) : List.of();
    }
}
