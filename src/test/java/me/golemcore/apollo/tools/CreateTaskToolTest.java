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
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CreateTaskToolTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));

    private EntityStorePort entityStore;
    private ArgumentCaptor<DomainEntity> inserted;
    private CreateTaskTool tool;

    @BeforeEach
    void setUp() {
        entityStore = mock(EntityStorePort.class);
        inserted = ArgumentCaptor.forClass(DomainEntity.class);
        when(entityStore.insertEntity(inserted.capture()))
                .thenAnswer(invocation -> ((DomainEntity) invocation.getArgument(0)).toBuilder().id("task-1").build());
        tool = new CreateTaskTool(entityStore, CLOCK);
    }

    @Test
    void getDefinition_requiresTitleOnly() {
        ToolDefinition definition = tool.getDefinition();

        assertEquals("create_task", definition.getName());
        assertEquals(List.of("title"), definition.getInputSchema().get("required"));
    }

    @Test
    void execute_appliesDefaults() throws Exception {
        ToolResult result = tool.execute(new ToolInvocation("user-1", "conv-1", Map.of("title", "Buy milk"))).get();

        assertTrue(result.isSuccess());
        assertEquals("Created task 'Buy milk' (id: task-1)", result.getOutput());
        DomainEntity task = inserted.getValue();
        assertEquals(EntityType.TASK, task.getType());
        assertEquals("user-1", task.getUserId());
        assertEquals("pending", task.getStatus());
        assertEquals(DomainEntity.PRIORITY_MEDIUM, task.getPriority());
        assertNull(task.getCompletedAt());
    }

    @Test
    void execute_marksCompletedTaskWithTimestamp() throws Exception {
        tool.execute(new ToolInvocation("user-1", "conv-1",
                Map.of("title", "File taxes", "status", "completed", "priority", "high"))).get();

        DomainEntity task = inserted.getValue();
        assertEquals("completed", task.getStatus());
        assertEquals("high", task.getPriority());
        assertEquals(CLOCK.instant(), task.getCompletedAt());
    }
}
