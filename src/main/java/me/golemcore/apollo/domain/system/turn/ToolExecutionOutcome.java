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

import me.golemcore.apollo.domain.model.Message;
import me.golemcore.apollo.domain.model.ToolFailureKind;
import me.golemcore.apollo.domain.model.ToolInvocationRecord;
import me.golemcore.apollo.domain.model.ToolResult;

import java.util.Map;

/**
 * Result of one tool call within a turn.
 *
 * @param toolCallId
 *            id the model assigned to the call
 * @param toolName
 *            requested tool name
 * @param toolResult
 *            structured result, never null
 * @param messageContent
 *            serialized result handed back to the model
 * @param arguments
 *            allow-listed arguments the tool ran with; empty when validation
 *            failed
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult, String messageContent,
        Map<String, Object> arguments) {

    public static ToolExecutionOutcome failure(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), ToolResult.failure(kind, reason),
                "Error: " + reason, Map.of());
    }

    public boolean isSuccess() {
        return toolResult.isSuccess();
    }

    public ToolInvocationRecord toRecord() {
        return ToolInvocationRecord.builder()
                .toolCallId(toolCallId)
                .toolName(toolName)
                .arguments(arguments)
                .status(toolResult.isSuccess() ? "success" : "error")
                .failureKind(toolResult.getFailureKind())
                .summary(toolResult.isSuccess() ? toolResult.getOutput() : toolResult.getError())
                .build();
    }
}
