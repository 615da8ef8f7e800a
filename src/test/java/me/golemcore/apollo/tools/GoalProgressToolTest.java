package me.golemcore.apollo.tools;

import me.golemcore.apollo.domain.model.DomainEntity;
import me.golemcore.apollo.domain.model.EntityType;
import me.golemcore.apollo.domain.model.ToolInvocation;
import me.golemcore.apollo.domain.model.ToolResult;
import me.golemcore.apollo.port.outbound.EntityStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GoalProgressToolTest {

    private static final String USER_ID = "user-1";

    private EntityStorePort entityStore;
    private GoalProgressTool tool;

    @BeforeEach
    void setUp() {
        entityStore = mock(EntityStorePort.class);
        when(entityStore.getEntity("goal-1")).thenReturn(Optional.of(DomainEntity.builder()
                .id("goal-1").type(EntityType.GOAL).userId(USER_ID).title("Marathon").status("active").build()));
        tool = new GoalProgressTool(entityStore, Clock.systemUTC());
    }

    @Test
    void execute_averagesMilestoneProgress() throws Exception {
        when(entityStore.listEntities(USER_ID, EntityType.MILESTONE)).thenReturn(List.of(
                milestone("m1", "goal-1", "completed", 100),
                milestone("m2", "goal-1", "in_progress", 50),
                milestone("m3", "goal-1", "not_started", 0),
                milestone("m4", "goal-2", "completed", 100)));

        ToolResult result = tool.execute(new ToolInvocation(USER_ID, "conv-1", Map.of("goal_id", "goal-1"))).get();

        assertTrue(result.isSuccess());
        assertEquals("Goal 'Marathon' is 50% complete (1/3 milestones completed).", result.getOutput());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(50, data.get("progress"));
        assertEquals(3, data.get("milestones_total"));
        assertEquals(1L, data.get("milestones_completed"));
    }

    @Test
    void execute_reportsGoalWithoutMilestones() throws Exception {
        when(entityStore.listEntities(USER_ID, EntityType.MILESTONE)).thenReturn(List.of());

        ToolResult result = tool.execute(new ToolInvocation(USER_ID, "conv-1", Map.of("goal_id", "goal-1"))).get();

        assertEquals("Goal 'Marathon' has no milestones yet.", result.getOutput());
    }

    private static DomainEntity milestone(String id, String goalId, String status, int progress) {
        return DomainEntity.builder()
                .id(id)
                .type(EntityType.MILESTONE)
                .userId(USER_ID)
                .goalId(goalId)
                .title(id)
                .status(status)
                .progress(progress)
                .build();
    }
}
