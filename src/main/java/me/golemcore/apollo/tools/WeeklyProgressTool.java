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
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reports what the user got done in the current Monday-to-Sunday week: tasks
 * completed, grouped by project, and milestones touched.
 */
@Component
public class WeeklyProgressTool extends AbstractEntityTool {

    static final String NO_PROJECT = "Uncategorized";

    public WeeklyProgressTool(EntityStorePort entityStore, Clock clock) {
        super(entityStore, clock);
    }

    @Override
    public String getToolName() {
        return "get_weekly_progress";
    }

    @Override
    public String getDescription() {
        return "Summarize this week's progress (Monday to Sunday): completed tasks by project and updated "
                + "milestones.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of();
    }

    @Override
    protected ToolResult run(ToolInvocation invocation) {
        LocalDate weekStart = LocalDate.now(clock).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate weekEnd = weekStart.plusDays(6);
        Instant since = weekStart.atStartOfDay(clock.getZone()).toInstant();

        List<DomainEntity> completedTasks = entityStore.listEntities(invocation.userId(), EntityType.TASK).stream()
                .filter(task -> "completed".equals(task.getStatus()))
                .filter(task -> isSince(completedOrUpdated(task), since))
                .toList();
        Map<String, Integer> byProject = new TreeMap<>();
        for (DomainEntity task : completedTasks) {
            String project = task.getProject() != null && !task.getProject().isBlank() ? task.getProject() : NO_PROJECT;
            byProject.merge(project, 1, Integer::sum);
        }
        long milestonesUpdated = entityStore.listEntities(invocation.userId(), EntityType.MILESTONE).stream()
                .filter(milestone -> isSince(milestone.getUpdatedAt(), since))
                .count();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("week_start", weekStart.toString());
        data.put("week_end", weekEnd.toString());
        data.put("tasks_completed", completedTasks.size());
        data.put("tasks_by_project", byProject);
        data.put("milestones_updated", milestonesUpdated);
        return ToolResult.success("Week of " + weekStart + ": " + completedTasks.size() + " task(s) completed, "
                + milestonesUpdated + " milestone(s) updated.", data);
    }

    private static Instant completedOrUpdated(DomainEntity task) {
        return task.getCompletedAt() != null ? task.getCompletedAt() : task.getUpdatedAt();
    }

    private static boolean isSince(Instant instant, Instant since) {
        return instant != null && !instant.isBefore(since);
    }
}
