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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reports a goal's progress as the average progress of its milestones.
 */
@Component
public class GoalProgressTool extends AbstractEntityTool {

    private static final List<ToolParameter> PARAMETERS = List.of(
            ToolParameter.entityId(PARAM_GOAL_ID, EntityType.GOAL, "ID of the goal").required(true).build());

    public GoalProgressTool(EntityStorePort entityStore, Clock clock) {
        super(entityStore, clock);
    }

    @Override
    public String getToolName() {
        return "get_goal_progress";
    }

    @Override
    public String getDescription() {
        return "Summarize how far the user is with a goal, based on the progress of its milestones.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return PARAMETERS;
    }

    @Override
    protected ToolResult run(ToolInvocation invocation) {
        String goalId = invocation.getString(PARAM_GOAL_ID);
        DomainEntity goal = entityStore.getEntity(goalId).orElse(null);
        if (goal == null) {
            return ToolResult.notFound(EntityType.GOAL.getLabel());
        }
        List<DomainEntity> milestones = entityStore.listEntities(invocation.userId(), EntityType.MILESTONE).stream()
                .filter(milestone -> goalId.equals(milestone.getGoalId()))
                .toList();
        long completed = milestones.stream().filter(milestone -> "completed".equals(milestone.getStatus())).count();
        double average = milestones.stream()
                .map(DomainEntity::getProgress)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .average()
                .orElse(0);
        int progress = (int) Math.round(average);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("goal", view(goal));
        data.put("progress", progress);
        data.put("milestones_total", milestones.size());
        data.put("milestones_completed", completed);
        String summary = milestones.isEmpty()
                ? "Goal '" + goal.getTitle() + "' has no milestones yet."
                : "Goal '" + goal.getTitle() + "' is " + progress + "% complete (" + completed + "/"
                        + milestones.size() + " milestones completed).";
        return ToolResult.success(summary, data);
    }
}
