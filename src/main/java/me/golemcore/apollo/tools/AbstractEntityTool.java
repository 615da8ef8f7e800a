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

import me.golemcore.apollo.domain.component.ToolComponent;
import me.golemcore.apollo.domain.model.DomainEntity;
import me.golemcore.apollo.domain.model.EntityType;
import me.golemcore.apollo.domain.model.ToolInvocation;
import me.golemcore.apollo.domain.model.ToolParameter;
import me.golemcore.apollo.domain.model.ToolResult;
import me.golemcore.apollo.port.outbound.EntityStorePort;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Shared plumbing for tools that read or change the user's tasks, goals and
 * milestones. Subclasses receive arguments that were already validated and
 * ownership-checked by the executor; store exceptions are left to propagate so
 * the executor can report them as execution errors.
 */
public abstract class AbstractEntityTool implements ToolComponent {

    protected static final String PARAM_TITLE = "title";
    protected static final String PARAM_DESCRIPTION = "description";
    protected static final String PARAM_STATUS = "status";
    protected static final String PARAM_PRIORITY = "priority";
    protected static final String PARAM_PROJECT = "project";
    protected static final String PARAM_TARGET_DATE = "target_date";
    protected static final String PARAM_PROGRESS = "progress";
    protected static final String PARAM_TASK_ID = "task_id";
    protected static final String PARAM_GOAL_ID = "goal_id";
    protected static final String PARAM_MILESTONE_ID = "milestone_id";
    protected static final String PARAM_UPDATES = "updates";

    protected static final int TITLE_MIN_LENGTH = 3;
    protected static final int TITLE_MAX_LENGTH = 200;
    protected static final int DESCRIPTION_MAX_LENGTH = 2000;

    protected static final Comparator<DomainEntity> BY_TARGET_DATE = Comparator.comparing(
            DomainEntity::getTargetDate, Comparator.nullsLast(Comparator.naturalOrder()));

    protected final EntityStorePort entityStore;
    protected final Clock clock;

    protected AbstractEntityTool(EntityStorePort entityStore, Clock clock) {
        this.entityStore = entityStore;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
        return CompletableFuture.supplyAsync(() -> run(invocation));
    }

    protected abstract ToolResult run(ToolInvocation invocation);

    protected static ToolParameter title(boolean required) {
        return ToolParameter.string(PARAM_TITLE, "Short title (3-200 characters)")
                .required(required)
                .minLength(TITLE_MIN_LENGTH)
                .maxLength(TITLE_MAX_LENGTH)
                .build();
    }

    protected static ToolParameter description() {
        return ToolParameter.string(PARAM_DESCRIPTION, "Optional longer description")
                .maxLength(DESCRIPTION_MAX_LENGTH)
                .build();
    }

    protected static ToolParameter status(EntityType type, String description) {
        return ToolParameter.string(PARAM_STATUS, description)
                .enumValues(type.getStatuses().stream().sorted().toList())
                .build();
    }

    protected static ToolParameter targetDate(boolean required) {
        return ToolParameter.date(PARAM_TARGET_DATE, "Target date in YYYY-MM-DD format")
                .required(required)
                .build();
    }

    protected static ToolParameter progress(boolean required) {
        return ToolParameter.integer(PARAM_PROGRESS, "Completion percentage from 0 to 100")
                .required(required)
                .minimum(0)
                .maximum(100)
                .build();
    }

    /**
     * Compact, model-facing view of an entity.
     */
    protected static Map<String, Object> view(DomainEntity entity) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", entity.getId());
        view.put("type", entity.getType().name().toLowerCase(Locale.ROOT));
        view.put(PARAM_TITLE, entity.getTitle());
        view.put(PARAM_STATUS, entity.getStatus());
        putIfPresent(view, PARAM_DESCRIPTION, entity.getDescription());
        putIfPresent(view, PARAM_PRIORITY, entity.getPriority());
        putIfPresent(view, PARAM_PROJECT, entity.getProject());
        putIfPresent(view, PARAM_MILESTONE_ID, entity.getMilestoneId());
        putIfPresent(view, PARAM_GOAL_ID, entity.getGoalId());
        putIfPresent(view, PARAM_TARGET_DATE, entity.getTargetDate() != null ? entity.getTargetDate().toString() : null);
        putIfPresent(view, PARAM_PROGRESS, entity.getProgress());
        return view;
    }

    protected static List<Map<String, Object>> views(List<DomainEntity> entities) {
        return entities.stream().map(AbstractEntityTool::view).toList();
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
