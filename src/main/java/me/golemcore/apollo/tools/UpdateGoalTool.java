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

@Component
@Slf4j
public class UpdateGoalTool extends AbstractEntityTool {

    private static final List<ToolParameter> PARAMETERS = List.of(
            ToolParameter.entityId(PARAM_GOAL_ID, EntityType.GOAL, "ID of the goal to update").required(true).build(),
            ToolParameter.object(PARAM_UPDATES, "Fields to change; omitted fields stay as they are")
                    .required(true)
                    .property(title(false))
                    .property(description())
                    .property(targetDate(false))
                    .property(status(EntityType.GOAL, "New status"))
                    .build());

    public UpdateGoalTool(EntityStorePort entityStore, Clock clock) {
        super(entityStore, clock);
    }

    @Override
    public String getToolName() {
        return "update_goal";
    }

    @Override
    public String getDescription() {
        return "Update a goal's title, description, target date or status.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return PARAMETERS;
    }

    @Override
    protected ToolResult run(ToolInvocation invocation) {
        String goalId = invocation.getString(PARAM_GOAL_ID);
        Map<String, Object> updates = invocation.getObject(PARAM_UPDATES);
        DomainEntity goal = entityStore.updateEntity(goalId, updates);
        log.info("[Tools] Updated goal {} fields {}", goalId, updates.keySet());
        return ToolResult.success("Updated goal '" + goal.getTitle() + "'", view(goal));
    }
}
