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
public class CreateGoalTool extends AbstractEntityTool {

    private static final List<ToolParameter> PARAMETERS = List.of(
            title(true),
            targetDate(true),
            description(),
            status(EntityType.GOAL, "Initial status, defaults to active"));

    public CreateGoalTool(EntityStorePort entityStore, Clock clock) {
        super(entityStore, clock);
    }

    @Override
    public String getToolName() {
        return "create_goal";
    }

    @Override
    public String getDescription() {
        return "Create a long-term goal with a target date. Goals are broken down into milestones and tasks.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return PARAMETERS;
    }

    @Override
    protected ToolResult run(ToolInvocation invocation) {
        DomainEntity goal = entityStore.insertEntity(DomainEntity.builder()
                .type(EntityType.GOAL)
                .userId(invocation.userId())
                .title(invocation.getString(PARAM_TITLE))
                .description(invocation.getString(PARAM_DESCRIPTION))
                .targetDate(LocalDate.parse(invocation.getString(PARAM_TARGET_DATE)))
                .status(invocation.has(PARAM_STATUS) ? invocation.getString(PARAM_STATUS) : "active")
                .build());
        log.info("[Tools] Created goal {}", goal.getId());
        return ToolResult.success("Created goal '" + goal.getTitle() + "' (id: " + goal.getId() + ")", view(goal));
    }
}
