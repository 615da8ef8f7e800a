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

import me.golemcore.apollo.domain.model.TurnFailureKind;
import me.golemcore.apollo.domain.model.TurnState;

import java.util.List;

/**
 * Result of one processed turn.
 *
 * @param state
 *            {@link TurnState#PERSISTED} or {@link TurnState#FAILED}
 * @param failureKind
 *            set only for failed turns
 * @param userMessageId
 *            id of the persisted user message, null if persisting it failed
 * @param assistantMessageId
 *            id of the persisted assistant message, null for failed turns
 * @param content
 *            final assistant text
 * @param toolOutcomes
 *            tool results in request order
 */
public record TurnOutcome(TurnState state, TurnFailureKind failureKind, String userMessageId,
        String assistantMessageId, String content, List<ToolExecutionOutcome> toolOutcomes) {

    public TurnOutcome {
        toolOutcomes = toolOutcomes != null ? List.copyOf(toolOutcomes) : List.of();
    }

    public static TurnOutcome persisted(String userMessageId, String assistantMessageId, String content,
            List<ToolExecutionOutcome> toolOutcomes) {
        return new TurnOutcome(TurnState.PERSISTED, null, userMessageId, assistantMessageId, content, toolOutcomes);
    }

    public static TurnOutcome failed(TurnFailureKind kind, String userMessageId,
            List<ToolExecutionOutcome> toolOutcomes) {
        return new TurnOutcome(TurnState.FAILED, kind, userMessageId, null, null, toolOutcomes);
    }

    public boolean isSuccess() {
        return state == TurnState.PERSISTED;
    }
}
