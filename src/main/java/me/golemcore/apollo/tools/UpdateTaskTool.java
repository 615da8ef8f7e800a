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
import java.util.Map;

/**
 * Updates whitelisted fields of one of the user's tasks.
 */
@Component
@Slf4j
public class UpdateTaskTool extends AbstractEntityTool {

    private static final List<ToolParameter> PARAMETERS = List.of(
            ToolParameter.entityId(PARAM_TASK_ID, EntityType.TASK, "ID of the task to update").required(true).build(),
            ToolParameter.object(PARAM_UPDATES, "Fields to change; omitted fields stay as they are")
                    .required(true)
                    .property(title(false))
                    .property(description())
                    .property(status(EntityType.TASK, "New status"))
                    .property(ToolParameter.string(PARAM_PRIORITY, "New priority")
                            .enumValues(List.of(DomainEntity.PRIORITY_HIGH, DomainEntity.PRIORITY_MEDIUM,
                                    DomainEntity.PRIORITY_LOW))
                            .build())
                    .property(ToolParameter.string(PARAM_PROJECT, "Project name").maxLength(100).build())
                    .property(ToolParameter.entityId(PARAM_MILESTONE_ID, EntityType.MILESTONE,
                            "Milestone to link the task to").build())
                    .build());

    public UpdateTaskTool(EntityStorePort entityStore, Clock clock) {
        super(entityStore, clock);
    }

    @Override
    public String getToolName() {
        return "update_task";
    }

    @Override
    public String getDescription() {
        return "Update an existing task: rename it, change its status or priority, or link it to a milestone.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return PARAMETERS;
    }

    @Override
    protected ToolResult run(ToolInvocation invocation) {
        String taskId = invocation.getString(PARAM_TASK_ID);
        Map<String, Object> updates = invocation.getObject(PARAM_UPDATES);
        DomainEntity task = entityStore.updateEntity(taskId, updates);
        log.info("[Tools] Updated task {} fields {}", taskId, updates.keySet());
        return ToolResult.success("Updated task '" + task.getTitle() + "' (" + String.join(", ", updates.keySet())
                + ")", view(task));
    }
}
