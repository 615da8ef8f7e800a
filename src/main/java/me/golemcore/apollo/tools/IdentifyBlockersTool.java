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
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds work that looks stuck: tasks in progress for more than a week without
 * an update, and milestones marked as blocked.
 */
@Component
public class IdentifyBlockersTool extends AbstractEntityTool {

    static final Duration STALE_AFTER = Duration.ofDays(7);

    public IdentifyBlockersTool(EntityStorePort entityStore, Clock clock) {
        super(entityStore, clock);
    }

    @Override
    public String getToolName() {
        return "identify_blockers";
    }

    @Override
    public String getDescription() {
        return "Find tasks that have been in progress for over a week and milestones marked as blocked.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of();
    }

    @Override
    protected ToolResult run(ToolInvocation invocation) {
        Instant staleBefore = clock.instant().minus(STALE_AFTER);
        List<DomainEntity> staleTasks = entityStore.listEntities(invocation.userId(), EntityType.TASK).stream()
                .filter(task -> "in_progress".equals(task.getStatus()))
                .filter(task -> lastTouched(task).isBefore(staleBefore))
                .toList();
        List<DomainEntity> blockedMilestones = entityStore.listEntities(invocation.userId(), EntityType.MILESTONE)
                .stream()
                .filter(milestone -> "blocked".equals(milestone.getStatus()))
                .toList();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("stale_tasks", views(staleTasks));
        data.put("blocked_milestones", views(blockedMilestones));
        if (staleTasks.isEmpty() && blockedMilestones.isEmpty()) {
            return ToolResult.success("No blockers found.", data);
        }
        return ToolResult.success("Found " + staleTasks.size() + " stalled task(s) and " + blockedMilestones.size()
                + " blocked milestone(s).", data);
    }

    private static Instant lastTouched(DomainEntity task) {
        if (task.getUpdatedAt() != null) {
            return task.getUpdatedAt();
        }
        return task.getCreatedAt() != null ? task.getCreatedAt() : Instant.EPOCH;
    }
}
