package me.golemcore.apollo.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.domain.model.DomainEntity;
import me.golemcore.apollo.domain.model.EntityType;
import me.golemcore.apollo.port.outbound.EntityStorePort;
import me.golemcore.apollo.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File-backed store for tasks, goals and milestones. Every entity is one JSON
 * document under {@code entities/}; all documents are loaded into memory at
 * startup and written through on change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityStoreService implements EntityStorePort {

    static final String ENTITIES_DIR = "entities";
    private static final String JSON_EXTENSION = ".json";

    private static final Comparator<DomainEntity> ACTIVE_THEN_NEWEST = Comparator
            .comparing((DomainEntity entity) -> entity.isActive() ? 0 : 1)
            .thenComparing(EntityStoreService::recency, Comparator.reverseOrder());

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, DomainEntity> entities = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadAll() {
        try {
            List<String> files = storagePort.listObjects(ENTITIES_DIR, "").join();
            for (String file : files) {
                if (file.endsWith(JSON_EXTENSION)) {
                    load(file).ifPresent(entity -> entities.put(entity.getId(), entity));
                }
            }
            log.info("[Store] Loaded {} entities", entities.size());
        } catch (RuntimeException e) { // NOSONAR - start with an empty store
            log.warn("[Store] Failed to scan entities directory: {}", e.getMessage());
        }
    }

    @Override
    public List<DomainEntity> listActiveEntities(String userId, int limit) {
        return entities.values().stream()
                .filter(entity -> entity.isOwnedBy(userId))
                .sorted(ACTIVE_THEN_NEWEST)
                .limit(Math.max(0, limit))
                .map(this::copy)
                .toList();
    }

    @Override
    public List<DomainEntity> listEntities(String userId, EntityType type) {
        return entities.values().stream()
                .filter(entity -> entity.isOwnedBy(userId) && entity.getType() == type)
                .sorted(Comparator.comparing(EntityStoreService::recency).reversed())
                .map(this::copy)
                .toList();
    }

    @Override
    public Optional<DomainEntity> getEntity(String entityId) {
        if (entityId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entities.get(entityId)).map(this::copy);
    }

    @Override
    public DomainEntity insertEntity(DomainEntity entity) {
        Instant now = clock.instant();
        DomainEntity stored = entity.toBuilder()
                .id(entity.getId() != null ? entity.getId() : UUID.randomUUID().toString())
                .createdAt(now)
                .updatedAt(now)
                .build();
        persist(stored);
        entities.put(stored.getId(), stored);
        log.debug("[Store] Inserted {} {}", stored.getType(), stored.getId());
        return copy(stored);
    }

    @Override
    public DomainEntity updateEntity(String entityId, Map<String, Object> fields) {
        synchronized (entities) {
            DomainEntity current = entities.get(entityId);
            if (current == null) {
                throw new IllegalStateException("Entity not found: " + entityId);
            }
            DomainEntity updated = copy(current);
            fields.forEach((field, value) -> applyField(updated, field, value));
            updated.setUpdatedAt(clock.instant());
            persist(updated);
            entities.put(entityId, updated);
            return copy(updated);
        }
    }

    @Override
    public boolean deleteEntity(String entityId) {
        synchronized (entities) {
            if (!entities.containsKey(entityId)) {
                return false;
            }
            storagePort.deleteObject(ENTITIES_DIR, entityId + JSON_EXTENSION).join();
            entities.remove(entityId);
            log.debug("[Store] Deleted entity {}", entityId);
            return true;
        }
    }

    private void applyField(DomainEntity entity, String field, Object value) {
        String text = value != null ? value.toString() : null;
        switch (field) {
        case "title" -> entity.setTitle(text);
        case "description" -> entity.setDescription(text);
        case "status" -> {
            entity.setStatus(text);
            if ("completed".equals(text)) {
                if (entity.getCompletedAt() == null) {
                    entity.setCompletedAt(clock.instant());
                }
            } else {
                entity.setCompletedAt(null);
            }
        }
        case "priority" -> entity.setPriority(text);
        case "project" -> entity.setProject(text);
        case "milestone_id" -> entity.setMilestoneId(text);
        case "target_date" -> entity.setTargetDate(text != null ? LocalDate.parse(text) : null);
        case "progress" -> entity.setProgress(value instanceof Number number ? number.intValue() : null);
        default -> log.warn("[Store] Ignoring unsupported field '{}' for entity {}", field, entity.getId());
        }
    }

    private void persist(DomainEntity entity) {
        String json;
        try {
            json = objectMapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize entity " + entity.getId(), e);
        }
        storagePort.putTextAtomic(ENTITIES_DIR, entity.getId() + JSON_EXTENSION, json, false).join();
    }

    private Optional<DomainEntity> load(String fileName) {
        try {
            String json = storagePort.getText(ENTITIES_DIR, fileName).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, DomainEntity.class));
        } catch (JsonProcessingException e) {
            log.warn("[Store] Failed to load entity file {}: {}", fileName, e.getMessage());
            return Optional.empty();
        }
    }

    private DomainEntity copy(DomainEntity entity) {
        return entity.toBuilder().build();
    }

    private static Instant recency(DomainEntity entity) {
        if (entity.getUpdatedAt() != null) {
            return entity.getUpdatedAt();
        }
        return entity.getCreatedAt() != null ? entity.getCreatedAt() : Instant.EPOCH;
    }
}
