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

import me.golemcore.apollo.domain.model.DomainEntity;
import me.golemcore.apollo.domain.model.EntityType;
import me.golemcore.apollo.domain.model.ToolInvocation;
import me.golemcore.apollo.domain.model.ToolParameter;
import me.golemcore.apollo.domain.model.ToolResult;
import me.golemcore.apollo.port.outbound.EntityStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
public class ListMilestonesTool extends AbstractEntityTool {

    private static final List<ToolParameter> PARAMETERS = List.of(
            ToolParameter.entityId(PARAM_GOAL_ID, EntityType.GOAL, "Only list milestones of this goal").build());

    public ListMilestonesTool(EntityStorePort entityStore, Clock clock) {
        super(entityStore, clock);
    }

    @Override
    public String getToolName() {
        return "list_milestones";
    }

    @Override
    public String getDescription() {
        return "List the user's milestones ordered by target date, optionally for a single goal.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return PARAMETERS;
    }

    @Override
    protected ToolResult run(ToolInvocation invocation) {
        String goalId = invocation.getString(PARAM_GOAL_ID);
        List<DomainEntity> milestones = entityStore.listEntities(invocation.userId(), EntityType.MILESTONE).stream()
                .filter(milestone -> goalId == null || goalId.equals(milestone.getGoalId()))
                .sorted(BY_TARGET_DATE)
                .toList();
        if (milestones.isEmpty()) {
            return ToolResult.success("No milestones found.", List.of());
        }
        return ToolResult.success("Found " + milestones.size() + " milestone(s).", views(milestones));
    }
}
