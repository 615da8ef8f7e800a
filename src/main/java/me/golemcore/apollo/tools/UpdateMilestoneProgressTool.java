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
 * Sets a milestone's progress and derives its status from it: 0 is
 * not_started, 100 is completed, anything in between is in_progress.
 */
@Component
@Slf4j
public class UpdateMilestoneProgressTool extends AbstractEntityTool {

    private static final List<ToolParameter> PARAMETERS = List.of(
            ToolParameter.entityId(PARAM_MILESTONE_ID, EntityType.MILESTONE, "ID of the milestone").required(true)
                    .build(),
            progress(true));

    public UpdateMilestoneProgressTool(EntityStorePort entityStore, Clock clock) {
        super(entityStore, clock);
    }

    @Override
    public String getToolName() {
        return "update_milestone_progress";
    }

    @Override
    public String getDescription() {
        return "Record progress on a milestone as a percentage. The milestone status is updated automatically.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return PARAMETERS;
    }

    @Override
    protected ToolResult run(ToolInvocation invocation) {
        String milestoneId = invocation.getString(PARAM_MILESTONE_ID);
        int progress = invocation.getInteger(PARAM_PROGRESS);
        DomainEntity milestone = entityStore.updateEntity(milestoneId,
                Map.of(PARAM_PROGRESS, progress, PARAM_STATUS, statusFor(progress)));
        log.info("[Tools] Milestone {} progress -> {}%", milestoneId, progress);
        return ToolResult.success("Milestone '" + milestone.getTitle() + "' is now " + progress + "% complete ("
                + milestone.getStatus() + ")", view(milestone));
    }

    static String statusFor(int progress) {
        if (progress <= 0) {
            return "not_started";
        }
        return progress >= 100 ? "completed" : "in_progress";
    }
}
