package me.golemcore.apollo.tools;

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
import me.golemcore.apollo.domain.model.DomainEntity;
import me.golemcore.apollo.domain.model.EntityType;
import me.golemcore.apollo.domain.model.ToolInvocation;
import me.golemcore.apollo.domain.model.ToolParameter;
import me.golemcore.apollo.domain.model.ToolResult;
import me.golemcore.apollo.port.outbound.EntityStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Creates a task for the calling user, optionally linked to one of their
 * milestones.
 */
@Component
@Slf4j
public class CreateTaskTool extends AbstractEntityTool {

    private static final List<ToolParameter> PARAMETERS = List.of(
            title(true),
            description(),
            status(EntityType.TASK, "Initial status, defaults to pending"),
            ToolParameter.string(PARAM_PRIORITY, "Priority, defaults to medium")
                    .enumValues(List.of(DomainEntity.PRIORITY_HIGH, DomainEntity.PRIORITY_MEDIUM,
                            DomainEntity.PRIORITY_LOW))
                    .build(),
            ToolParameter.string(PARAM_PROJECT, "Optional project name").maxLength(100).build(),
            ToolParameter.entityId(PARAM_MILESTONE_ID, EntityType.MILESTONE, "Milestone this task contributes to")
                    .build());

    public CreateTaskTool(EntityStorePort entityStore, Clock clock) {
        super(entityStore, clock);
    }

    @Override
    public String getToolName() {
        return "create_task";
    }

    @Override
    public String getDescription() {
        return "Create a new task for the user. Use when the user asks to add, remember or plan a concrete action item.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return PARAMETERS;
    }

    @Override
    protected ToolResult run(ToolInvocation invocation) {
        String status = invocation.has(PARAM_STATUS) ? invocation.getString(PARAM_STATUS) : "pending";
        DomainEntity task = entityStore.insertEntity(DomainEntity.builder()
                .type(EntityType.TASK)
                .userId(invocation.userId())
                .title(invocation.getString(PARAM_TITLE))
                .description(invocation.getString(PARAM_DESCRIPTION))
                .status(status)
                .priority(invocation.has(PARAM_PRIORITY) ? invocation.getString(PARAM_PRIORITY)
                        : DomainEntity.PRIORITY_MEDIUM)
                .project(invocation.getString(PARAM_PROJECT))
                .milestoneId(invocation.getString(PARAM_MILESTONE_ID))
                .completedAt("completed".equals(status) ? clock.instant() : null)
                .build());
        log.info("[Tools] Created task {}", task.getId());
        return ToolResult.success("Created task '" + task.getTitle() + "' (id: " + task.getId() + ")", view(task));
    }
}
