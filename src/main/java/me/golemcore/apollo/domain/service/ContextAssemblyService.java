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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.domain.model.ContextSnapshot;
import me.golemcore.apollo.domain.model.DomainEntity;
import me.golemcore.apollo.domain.model.TokenEstimate;
import me.golemcore.apollo.infrastructure.config.ApolloProperties;
import me.golemcore.apollo.port.outbound.EntityStorePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the token-budgeted snapshot of a user's tasks, goals and milestones
 * that is appended to the system prompt.
 *
 * <p>
 * Entities are ranked active-first, then newest-first, and added greedily. The
 * rendered text is re-estimated after every addition and assembly stops before
 * the budget would be exceeded, so the returned snapshot never costs more than
 * the budget. When the top-ranked entity alone is too large it is cut at the
 * text level and marked as truncated instead of being dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextAssemblyService {

    static final String HEADER = "=== USER CONTEXT ===\n";
    private static final int MAX_DESCRIPTION_CHARS = 160;

    private static final Comparator<DomainEntity> RELEVANCE = Comparator
            .comparing((DomainEntity entity) -> entity.isActive() ? 0 : 1)
            .thenComparing(ContextAssemblyService::recency, Comparator.reverseOrder());

    private final EntityStorePort entityStore;
    private final TokenEstimationService tokenEstimator;
    private final ApolloProperties properties;

    public ContextSnapshot assemble(String userId, String model, int budgetTokens) {
        int budget = Math.max(0, budgetTokens);
        List<DomainEntity> candidates = fetchCandidates(userId);

        if (candidates.isEmpty()) {
            return markerSnapshot(model, ContextSnapshot.NO_ENTITIES_MARKER, budget, 0);
        }

        List<DomainEntity> included = new ArrayList<>();
        StringBuilder body = new StringBuilder();
        boolean truncated = false;

        for (DomainEntity entity : candidates) {
            String line = render(entity);
            if (fits(model, HEADER + body + line, budget)) {
                body.append(line);
                included.add(entity);
                continue;
            }
            if (included.isEmpty()) {
                String cut = truncateToFit(model, line, budget);
                if (cut != null) {
                    body.append(cut);
                    included.add(entity);
                    truncated = true;
                }
            }
            break;
        }

        int omitted = candidates.size() - included.size();
        if (included.isEmpty()) {
            log.debug("[Context] Budget of {} tokens too small for any of {} entities", budget, candidates.size());
            return markerSnapshot(model, ContextSnapshot.BUDGET_EXHAUSTED_MARKER, budget, omitted);
        }

        String text = HEADER + body;
        if (omitted > 0) {
            String withFooter = text + "(" + omitted + " more not shown)\n";
            if (fits(model, withFooter, budget)) {
                text = withFooter;
            }
        }

        TokenEstimate estimate = tokenEstimator.estimate(model, text);
        log.debug("[Context] Snapshot for user {}: {} entities, {} omitted, {} tokens (budget {})",
                userId, included.size(), omitted, estimate.tokens(), budget);
        return ContextSnapshot.builder()
                .entities(List.copyOf(included))
                .text(text)
                .estimatedTokens(estimate.tokens())
                .approximate(estimate.approximate())
                .truncated(truncated)
                .omitted(omitted)
                .build();
    }

    private List<DomainEntity> fetchCandidates(String userId) {
        try {
            List<DomainEntity> entities = new ArrayList<>(
                    entityStore.listActiveEntities(userId, properties.getContext().getMaxEntities()));
            entities.sort(RELEVANCE);
            return entities;
        } catch (RuntimeException e) { // NOSONAR - context is best effort
            log.warn("[Context] Failed to load entities for user {}: {}", userId, e.getMessage());
            return List.of();
        }
    }

    private ContextSnapshot markerSnapshot(String model, String marker, int budget, int omitted) {
        TokenEstimate estimate = tokenEstimator.estimate(model, marker);
        boolean markerFits = estimate.tokens() <= budget;
        return ContextSnapshot.builder()
                .entities(List.of())
                .text(markerFits ? marker : "")
                .estimatedTokens(markerFits ? estimate.tokens() : 0)
                .approximate(estimate.approximate())
                .omitted(omitted)
                .build();
    }

    /**
     * Finds the longest prefix of {@code line} that fits together with the
     * header and truncation marker, or null if not even the marker fits.
     */
    private String truncateToFit(String model, String line, int budget) {
        String base = line.stripTrailing();
        if (!fits(model, HEADER + ContextSnapshot.TRUNCATION_MARKER + "\n", budget)) {
            return null;
        }
        int low = 0;
        int high = base.length();
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (fits(model, HEADER + truncatedLine(base, mid), budget)) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        // Tokenizers are not strictly monotonic over prefixes
        while (low > 0 && !fits(model, HEADER + truncatedLine(base, low), budget)) {
            low--;
        }
        return truncatedLine(base, low);
    }

    private static String truncatedLine(String base, int length) {
        return base.substring(0, length) + ContextSnapshot.TRUNCATION_MARKER + "\n";
    }

    private boolean fits(String model, String text, int budget) {
        return tokenEstimator.count(model, text) <= budget;
    }

    static String render(DomainEntity entity) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(entity.getType().name()).append("] ")
                .append("id=").append(entity.getId())
                .append(" | ").append(entity.getTitle())
                .append(" | status=").append(entity.getStatus());
        if (entity.getPriority() != null) {
            sb.append(" | priority=").append(entity.getPriority());
        }
        if (entity.getProgress() != null) {
            sb.append(" | progress=").append(entity.getProgress()).append('%');
        }
        if (entity.getTargetDate() != null) {
            sb.append(" | target=").append(entity.getTargetDate());
        }
        if (entity.getGoalId() != null) {
            sb.append(" | goal=").append(entity.getGoalId());
        }
        if (entity.getMilestoneId() != null) {
            sb.append(" | milestone=").append(entity.getMilestoneId());
        }
        if (entity.getProject() != null) {
            sb.append(" | project=").append(entity.getProject());
        }
        String description = entity.getDescription();
        if (description != null && !description.isBlank()) {
            String compact = description.strip().replaceAll("\\s+", " ");
            if (compact.length() > MAX_DESCRIPTION_CHARS) {
                compact = compact.substring(0, MAX_DESCRIPTION_CHARS) + "...";
            }
            sb.append(" | ").append(compact);
        }
        return sb.append('\n').toString();
    }

    private static Instant recency(DomainEntity entity) {
        if (entity.getUpdatedAt() != null) {
            return entity.getUpdatedAt();
        }
        return entity.getCreatedAt() != null ? entity.getCreatedAt() : Instant.EPOCH;
    }
}
