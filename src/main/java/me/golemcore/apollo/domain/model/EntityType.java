package me.golemcore.apollo.domain.model;

import java.util.Set;

/**
 * Kinds of planning entities a user owns, with their status vocabularies.
 */
public enum EntityType {
    TASK("Task", Set.of("pending", "in_progress", "completed"), Set.of("pending", "in_progress")),
    GOAL("Goal", Set.of("active", "completed", "archived"), Set.of("active")),
    MILESTONE("Milestone", Set.of("not_started", "in_progress", "completed", "blocked"),
            Set.of("not_started", "in_progress", "blocked"));

    private final String label;
    private final Set<String> statuses;
    private final Set<String> activeStatuses;

    EntityType(String label, Set<String> statuses, Set<String> activeStatuses) {
        this.label = label;
        this.statuses = statuses;
        this.activeStatuses = activeStatuses;
    }

    public String getLabel() {
        return label;
    }

    public Set<String> getStatuses() {
        return statuses;
    }

    public boolean isActiveStatus(String status) {
        return activeStatuses.contains(status);
    }
}
