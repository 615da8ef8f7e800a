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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.apollo.domain.component.ToolComponent;
import me.golemcore.apollo.domain.model.ToolDefinition;
import me.golemcore.apollo.domain.model.ToolParameter;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable catalog of the tools available to the model, built once from the
 * enabled {@link ToolComponent} beans.
 *
 * <p>
 * Registration fails fast on duplicate or malformed names, on tools without a
 * parameter schema and on definitions whose exported schema does not match the
 * declared parameters. Only {@link ToolDefinition}s leave the registry towards
 * the model.
 */
@Component
@Slf4j
public class ToolRegistry {

    private static final Pattern TOOL_NAME = Pattern.compile("[a-zA-Z0-9_-]{1,64}");

    private final Map<String, ToolComponent> tools;

    public ToolRegistry(List<ToolComponent> components) {
        Map<String, ToolComponent> registered = new LinkedHashMap<>();
        for (ToolComponent tool : components) {
            if (!tool.isEnabled()) {
                log.info("[Tools] Skipping disabled tool: {}", tool.getToolName());
                continue;
            }
            validate(tool);
            if (registered.putIfAbsent(tool.getToolName(), tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getToolName());
            }
        }
        this.tools = Collections.unmodifiableMap(registered);
        log.info("[Tools] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    public Optional<ToolComponent> find(String name) {
        return name != null ? Optional.ofNullable(tools.get(name)) : Optional.empty();
    }

    /**
     * Looks up a tool by the name a model asked for, after
     * {@link #sanitizeName(String) sanitizing} it.
     */
    public Optional<ToolComponent> resolve(String requestedName) {
        return find(sanitizeName(requestedName));
    }

    /**
     * Drops everything from the first character outside {@code [a-zA-Z0-9_-]}.
     * Some models leak special tokens like {@code <|channel|>} into tool call
     * names.
     */
    public static String sanitizeName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    /**
     * Returns the model-facing definitions in registration order.
     */
    public List<ToolDefinition> getDefinitions() {
        return tools.values().stream().map(ToolComponent::getDefinition).toList();
    }

    public Set<String> getToolNames() {
        return tools.keySet();
    }

    private static void validate(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || !TOOL_NAME.matcher(name).matches()) {
            throw new IllegalStateException("Invalid tool name: " + name);
        }
        if (tool.getDescription() == null || tool.getDescription().isBlank()) {
            throw new IllegalStateException("Tool " + name + " has no description");
        }
        List<ToolParameter> parameters = tool.getParameters();
        if (parameters == null) {
            throw new IllegalStateException("Tool " + name + " has no parameter schema");
        }
        validateParameters(name, parameters);

        ToolDefinition definition = tool.getDefinition();
        if (definition == null || !name.equals(definition.getName()) || definition.getInputSchema() == null) {
            throw new IllegalStateException("Tool " + name + " exports no matching definition");
        }
        Object properties = definition.getInputSchema().get("properties");
        Set<String> declared = new HashSet<>();
        parameters.forEach(parameter -> declared.add(parameter.getName()));
        if (!(properties instanceof Map<?, ?> schemaProperties) || !schemaProperties.keySet().equals(declared)) {
            throw new IllegalStateException("Tool " + name + " schema does not match its declared parameters");
        }
    }

    private static void validateParameters(String toolName, List<ToolParameter> parameters) {
        Set<String> names = new HashSet<>();
        for (ToolParameter parameter : parameters) {
            if (parameter.getName() == null || parameter.getName().isBlank() || parameter.getType() == null) {
                throw new IllegalStateException("Tool " + toolName + " declares an incomplete parameter");
            }
            if (!names.add(parameter.getName())) {
                throw new IllegalStateException(
                        "Tool " + toolName + " declares parameter twice: " + parameter.getName());
            }
            if (ToolCallExecutionService.IDENTITY_KEYS.contains(parameter.getName())) {
                throw new IllegalStateException(
                        "Tool " + toolName + " must not accept identity parameter: " + parameter.getName());
            }
            if (parameter.getType() == ToolParameter.ParameterType.OBJECT) {
                if (parameter.getProperties().isEmpty()) {
                    throw new IllegalStateException(
                            "Tool " + toolName + " object parameter has no properties: " + parameter.getName());
                }
                validateParameters(toolName, parameter.getProperties());
            }
        }
    }
}
