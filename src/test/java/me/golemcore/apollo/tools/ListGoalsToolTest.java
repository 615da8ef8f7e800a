package me.golemcore.apollo.tools;

import me.golemcore.apollo.domain.model.DomainEntity;
import me.golemcore.apollo.domain.model.EntityType;
import me.golemcore.apollo.domain.model.ToolInvocation;
import me.golemcore.apollo.domain.model.ToolResult;
import me.golemcore.apollo.port.outbound.EntityStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ListGoalsToolTest {

    private static final String USER_ID = "user-1";

    private EntityStorePort entityStore;
    private ListGoalsTool tool;

    @BeforeEach
    void setUp() {
        entityStore = mock(EntityStorePort.class);
        when(entityStore.listEntities(USER_ID, EntityType.GOAL)).thenReturn(List.of(
                goal("late", "active", LocalDate.of(2026, 12, 1)),
                goal("undated", "active", null),
                goal("soon", "active", LocalDate.of(2026, 3, 1)),
                goal("done", "completed", LocalDate.of(2026, 1, 1))));
        tool = new ListGoalsTool(entityStore, Clock.systemUTC());
    }

    @Test
    void execute_sortsByTargetDateWithUndatedLast() throws Exception {
        ToolResult result = tool.execute(new ToolInvocation(USER_ID, "conv-1", Map.of("status", "active"))).get();

        assertEquals("Found 3 goal(s).", result.getOutput());
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> goals = (List<Map<String, Object>>) result.getData();
        assertEquals(List.of("soon", "late", "undated"), goals.stream().map(goal -> goal.get("id")).toList());
    }

    @Test
    void execute_listsAllStatusesWithoutFilter() throws Exception {
        ToolResult result = tool.execute(new ToolInvocation(USER_ID, "conv-1", Map.of())).get();

        assertEquals("Found 4 goal(s).", result.getOutput());
    }

    private static DomainEntity goal(String id, String status, LocalDate targetDate) {
        return DomainEntity.builder()
                .id(id)
                .type(EntityType.GOAL)
                .userId(USER_ID)
                .title(id)
                .status(status)
                .targetDate(targetDate)
                .build();
    }
}
