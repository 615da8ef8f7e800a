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
import java.time.LocalDate;
import java.util.List;

@Component
@Slf4j
public class CreateMilestoneTool extends AbstractEntityTool {

    private static final List<ToolParameter> PARAMETERS = List.of(
            ToolParameter.entityId(PARAM_GOAL_ID, EntityType.GOAL, "Goal this milestone belongs to").required(true)
                    .build(),
            title(true),
            targetDate(false),
            description(),
            status(EntityType.MILESTONE, "Initial status, defaults to not_started"),
            progress(false));

    public CreateMilestoneTool(EntityStorePort entityStore, Clock clock) {
        super(entityStore, clock);
    }

    @Override
    public String getToolName() {
        return "create_milestone";
    }

    @Override
    public String getDescription() {
        return "Create a milestone under one of the user's goals, marking a measurable checkpoint towards it.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return PARAMETERS;
    }

    @Override
    protected ToolResult run(ToolInvocation invocation) {
        String targetDate = invocation.getString(PARAM_TARGET_DATE);
        Integer progress = invocation.getInteger(PARAM_PROGRESS);
        DomainEntity milestone = entityStore.insertEntity(DomainEntity.builder()
                .type(EntityType.MILESTONE)
                .userId(invocation.userId())
                .goalId(invocation.getString(PARAM_GOAL_ID))
                .title(invocation.getString(PARAM_TITLE))
                .description(invocation.getString(PARAM_DESCRIPTION))
                .targetDate(targetDate != null ? LocalDate.parse(targetDate) : null)
                .status(invocation.has(PARAM_STATUS) ? invocation.getString(PARAM_STATUS) : "not_started")
                .progress(progress != null ? progress : 0)
                .build());
        log.info("[Tools] Created milestone {} for goal {}", milestone.getId(), milestone.getGoalId());
        return ToolResult.success("Created milestone '" + milestone.getTitle() + "' (id: " + milestone.getId() + ")",
                view(milestone));
    }
}
