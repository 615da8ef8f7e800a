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

import lombok.RequiredArgsConstructor;
import me.golemcore.apollo.domain.model.ContextSnapshot;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Builds the system instructions of a model call: the coordinator identity,
 * today's date and the user's context snapshot.
 */
@Component
@RequiredArgsConstructor
public class SystemPromptBuilder {

    public static final String SECTION_SEPARATOR = "\n\n";

    private static final String INSTRUCTIONS = """
            You are the Life Coordinator for APOLLO (Autonomous Productivity & Optimization Life Logic \
            Orchestrator), a personal assistant for systematic productivity and strategic life planning.

            Goal hierarchy you coordinate:
            - Goals: yearly objectives with measurable targets and deadlines
            - Milestones: quarterly checkpoints that advance a goal
            - Tasks: daily or weekly actions, optionally linked to a milestone

            How you work:
            - Connect today's tasks to their milestones and goals.
            - Reference the user's actual tasks, milestones and goals from the context below.
            - Be concise: two short paragraphs by default, more only when asked.
            - Ask a clarifying question when a request is vague.
            - Politely redirect requests unrelated to planning and productivity.

            Tools:
            - Any change to tasks, goals or milestones must go through a tool call.
            - Never claim that something was created, updated or deleted unless the tool result confirms it.
            - If a tool reports an error or that an item was not found, say so plainly.
            - Refer to existing items by the ids shown in the context.""";

    private final Clock clock;

    /**
     * Instructions without the context snapshot, used to size the remaining
     * budget before the snapshot is assembled.
     */
    public String baseInstructions() {
        LocalDate today = LocalDate.now(clock);
        return INSTRUCTIONS + "\n\nToday is " + today + " ("
                + today.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH) + ").";
    }

    public String build(String baseInstructions, ContextSnapshot snapshot) {
        if (snapshot == null || snapshot.getText() == null || snapshot.getText().isEmpty()) {
            return baseInstructions;
        }
        return baseInstructions + SECTION_SEPARATOR + snapshot.getText();
    }
}
