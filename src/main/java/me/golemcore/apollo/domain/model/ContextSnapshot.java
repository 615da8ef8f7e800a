package me.golemcore.apollo.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Token-bounded view of a user's planning state, rebuilt for every turn.
 * {@link #text} is always present: when no entity could be included it holds an
 * explicit marker so the model knows context was attempted.
 */
@Data
@Builder
public class ContextSnapshot {

    public static final String NO_ENTITIES_MARKER = "No context available: the user has no active tasks, goals or milestones.";
    public static final String BUDGET_EXHAUSTED_MARKER = "No context available: the context budget was too small.";
    public static final String TRUNCATION_MARKER = " [truncated]";

    private List<DomainEntity> entities;
    private String text;
    private int estimatedTokens;
    private boolean approximate;
    private boolean truncated;

    /**
     * Number of candidate entities that were left out to stay within budget.
     */
    private int omitted;

    public boolean isEmpty() {
        return entities == null || entities.isEmpty();
    }
}
