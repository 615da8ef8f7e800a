package me.golemcore.apollo.tools;

import me.golemcore.apollo.domain.model.DomainEntity;
import me.golemcore.apollo.domain.model.EntityType;
import me.golemcore.apollo.domain.model.ToolDefinition;
import me.golemcore.apollo.domain.model.ToolInvocation;
import me.golemcore.apollo.domain.model.ToolResult;
import me.golemcore.apollo.port.outbound.EntityStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CreateMilestoneToolTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));

    private EntityStorePort entityStore;
    private ArgumentCaptor<DomainEntity> inserted;
    private CreateMilestoneTool tool;

    @BeforeEach
    void setUp() {
        entityStore = mock(EntityStorePort.class);
        inserted = ArgumentCaptor.forClass(DomainEntity.class);
        when(entityStore.insertEntity(inserted.capture()))
                .thenAnswer(invocation -> ((DomainEntity) invocation.getArgument(0)).toBuilder().id("ms-1").build());
        tool = new CreateMilestoneTool(entityStore, CLOCK);
    }

    @Test
    void getDefinition_requiresGoalAndTitle() {
        ToolDefinition definition = tool.getDefinition();

        assertEquals("create_milestone", definition.getName());
        assertEquals(List.of("goal_id", "title"), definition.getInputSchema().get("required"));
        assertEquals(EntityType.GOAL, tool.getParameters().get(0).getOwnedEntity());
    }

    @Test
    void execute_appliesDefaults() throws Exception {
        ToolResult result = tool.execute(new ToolInvocation("user-1", "conv-1",
                Map.of("goal_id", "goal-1", "title", "Run 10k"))).get();

        assertTrue(result.isSuccess());
        assertEquals("Created milestone 'Run 10k' (id: ms-1)", result.getOutput());
        DomainEntity milestone = inserted.getValue();
        assertEquals(EntityType.MILESTONE, milestone.getType());
        assertEquals("user-1", milestone.getUserId());
        assertEquals("goal-1", milestone.getGoalId());
        assertEquals("not_started", milestone.getStatus());
        assertEquals(Integer.valueOf(0), milestone.getProgress());
        assertNull(milestone.getTargetDate());
    }

    @Test
    void execute_keepsProvidedProgressStatusAndDate() throws Exception {
        tool.execute(new ToolInvocation("user-1", "conv-1", Map.of(
                "goal_id", "goal-1",
                "title", "Run a half marathon",
                "target_date", "2026-06-30",
                "status", "in_progress",
                "progress", 40))).get();

        DomainEntity milestone = inserted.getValue();
        assertEquals(LocalDate.of(2026, 6, 30), milestone.getTargetDate());
        assertEquals("in_progress", milestone.getStatus());
        assertEquals(Integer.valueOf(40), milestone.getProgress());
    }
}
