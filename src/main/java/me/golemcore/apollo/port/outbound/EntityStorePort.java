package me.golemcore.apollo.port.outbound;

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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port for the user's tasks, goals and milestones. Implementations perform no
 * ownership checks of their own; callers compare {@link DomainEntity#getUserId()}
 * with the authenticated user.
 */
public interface EntityStorePort {

    /**
     * Lists up to {@code limit} entities of the user, active ones first and newer
     * before older within each group.
     */
    List<DomainEntity> listActiveEntities(String userId, int limit);

    /**
     * Lists all entities of one type owned by the user.
     */
    List<DomainEntity> listEntities(String userId, EntityType type);

    Optional<DomainEntity> getEntity(String entityId);

    DomainEntity insertEntity(DomainEntity entity);

    /**
     * Applies the given fields (snake_case keys) to an entity and returns the
     * updated copy.
     */
    DomainEntity updateEntity(String entityId, Map<String, Object> fields);

    boolean deleteEntity(String entityId);
}
