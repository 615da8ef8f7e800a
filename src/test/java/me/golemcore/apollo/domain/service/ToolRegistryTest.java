package me.golemcore.apollo.domain.service;

import me.golemcore.apollo.domain.component.ToolComponent;
import me.golemcore.apollo.domain.model.ToolDefinition;
import me.golemcore.apollo.domain.model.ToolInvocation;
import me.golemcore.apollo.domain.model.ToolParameter;
import me.golemcore.apollo.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    @Test
    void shouldRegisterToolsInOrderAndExportDefinitions() {
        ToolRegistry registry = new ToolRegistry(List.of(
                new StubTool("create_task", List.of(ToolParameter.string("title", "Title").required(true).build())),
                new StubTool("list_goals", List.of())));

        List<ToolDefinition> definitions = registry.getDefinitions();

        assertEquals(2, definitions.size());
        assertEquals("create_task", definitions.get(0).getName());
        assertEquals(List.of("title"), definitions.get(0).getInputSchema().get("required"));
        assertEquals("list_goals", definitions.get(1).getName());
    }

    @Test
    void shouldSkipDisabledTools() {
        StubTool disabled = new StubTool("create_task", List.of());
        disabled.enabled = false;

        ToolRegistry registry = new ToolRegistry(List.of(disabled));

        assertTrue(registry.getToolNames().isEmpty());
    }

    @Test
    void shouldRejectDuplicateNames() {
        List<ToolComponent> tools = List.of(new StubTool("create_task", List.of()),
                new StubTool("create_task", List.of()));

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> new ToolRegistry(tools));

        assertEquals("Duplicate tool name: create_task", error.getMessage());
    }

    @Test
    void shouldRejectMalformedName() {
        List<ToolComponent> tools = List.of(new StubTool("create task", List.of()));

        assertThrows(IllegalStateException.class, () -> new ToolRegistry(tools));
    }

    @Test
    void shouldRejectMissingParameterSchema() {
        List<ToolComponent> tools = List.of(new StubTool("create_task", null));

        assertThrows(IllegalStateException.class, () -> new ToolRegistry(tools));
    }

    @Test
    void shouldRejectIdentityParameter() {
        List<ToolComponent> tools = List.of(new StubTool("create_task",
                List.of(ToolParameter.string("user_id", "Owner").build())));

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> new ToolRegistry(tools));

        assertTrue(error.getMessage().contains("identity parameter"));
    }

    @Test
    void shouldRejectObjectParameterWithoutProperties() {
        List<ToolComponent> tools = List.of(new StubTool("update_task",
                List.of(ToolParameter.object("updates", "Changes").build())));

        assertThrows(IllegalStateException.class, () -> new ToolRegistry(tools));
    }

    @Test
    void shouldResolveSanitizedNames() {
        ToolRegistry registry = new ToolRegistry(List.of(new StubTool("create_task", List.of())));

        assertTrue(registry.resolve("create_task<|channel|>commentary").isPresent());
        assertTrue(registry.resolve("delete_everything").isEmpty());
        assertTrue(registry.resolve(null).isEmpty());
    }

    @Test
    void shouldSanitizeNames() {
        assertEquals("create_task", ToolRegistry.sanitizeName("create_task"));
        assertEquals("create_task", ToolRegistry.sanitizeName("create_task<|channel|>json"));
        assertEquals("", ToolRegistry.sanitizeName(" create_task"));
        assertNull(ToolRegistry.sanitizeName(null));
    }

    private static final class StubTool implements ToolComponent {

        private final String name;
        private final List<ToolParameter> parameters;
        private boolean enabled = true;

        private StubTool(String name, List<ToolParameter> parameters) {
            this.name = name;
            this.parameters = parameters;
        }

        @Override
        public String getToolName() {
            return name;
        }

        @Override
        public String getDescription() {
            return "Stub tool " + name;
        }

        @Override
        public List<ToolParameter> getParameters() {
            return parameters;
        }

        @Override
        public ToolDefinition getDefinition() {
            return parameters == null ? null : ToolComponent.super.getDefinition();
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
            return CompletableFuture.completedFuture(ToolResult.success("ok"));
        }
    }
}
