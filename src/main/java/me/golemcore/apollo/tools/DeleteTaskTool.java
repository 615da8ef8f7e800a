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
import java.util.Optional;

@Component
@Slf4j
public class DeleteTaskTool extends AbstractEntityTool {

    private static final List<ToolParameter> PARAMETERS = List.of(
            ToolParameter.entityId(PARAM_TASK_ID, EntityType.TASK, "ID of the task to delete").required(true).build());

    public DeleteTaskTool(EntityStorePort entityStore, Clock clock) {
        super(entityStore, clock);
    }

    @Override
    public String getToolName() {
        return "delete_task";
    }

    @Override
    public String getDescription() {
        return "Permanently delete one of the user's tasks. Only use when the user explicitly asks to remove it.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return PARAMETERS;
    }

    @Override
    protected ToolResult run(ToolInvocation invocation) {
        String taskId = invocation.getString(PARAM_TASK_ID);
        Optional<DomainEntity> task = entityStore.getEntity(taskId);
        if (task.isEmpty() || !entityStore.deleteEntity(taskId)) {
            return ToolResult.notFound(EntityType.TASK.getLabel());
        }
        log.info("[Tools] Deleted task {}", taskId);
        return ToolResult.success("Deleted task '" + task.get().getTitle() + "'");
    }
}
