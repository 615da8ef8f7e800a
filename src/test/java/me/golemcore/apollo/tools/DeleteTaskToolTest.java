package me.golemcore.apollo.tools;

import me.golemcore.apollo.domain.model.DomainEntity;
import me.golemcore.apollo.domain.model.EntityType;
import me.golemcore.apollo.domain.model.ToolFailureKind;
import me.golemcore.apollo.domain.model.ToolInvocation;
import me.golemcore.apollo.domain.model.ToolResult;
import me.golemcore.apollo.port.outbound.EntityStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DeleteTaskToolTest {

    private EntityStorePort entityStore;
    private DeleteTaskTool tool;

    @BeforeEach
    void setUp() {
        entityStore = mock(EntityStorePort.class);
        tool = new DeleteTaskTool(entityStore, Clock.systemUTC());
    }

    @Test
    void execute_deletesExistingTask() throws Exception {
        when(entityStore.getEntity("task-1")).thenReturn(Optional.of(DomainEntity.builder()
                .id("task-1").type(EntityType.TASK).title("Buy milk").status("pending").build()));
        when(entityStore.deleteEntity("task-1")).thenReturn(true);

        ToolResult result = tool.execute(new ToolInvocation("user-1", "conv-1", Map.of("task_id", "task-1"))).get();

        assertTrue(result.isSuccess());
        assertEquals("Deleted task 'Buy milk'", result.getOutput());
    }

    @Test
    void execute_reportsNotFoundWhenTaskVanished() throws Exception {
        when(entityStore.getEntity("task-1")).thenReturn(Optional.empty());

        ToolResult result = tool.execute(new ToolInvocation("user-1", "conv-1", Map.of("task_id", "task-1"))).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.NOT_FOUND, result.getFailureKind());
    }
}
