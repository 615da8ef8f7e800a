package me.golemcore.apollo.domain.component;

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

import me.golemcore.apollo.domain.model.ToolDefinition;
import me.golemcore.apollo.domain.model.ToolInvocation;
import me.golemcore.apollo.domain.model.ToolParameter;
import me.golemcore.apollo.domain.model.ToolResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Component interface for a side-effecting operation the model may request.
 *
 * <p>
 * A tool declares typed {@link ToolParameter}s; the exported
 * {@link ToolDefinition} is derived from them and is the only part of the tool
 * the model ever sees. Arguments reach {@link #execute(ToolInvocation)} only
 * after the executor has stripped identity fields, dropped undeclared keys,
 * validated values and verified ownership of referenced entities.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    String getToolName();

    /**
     * Natural-language description telling the model when to call the tool.
     */
    String getDescription();

    /**
     * Returns the declared parameters. Undeclared arguments never reach the tool.
     */
    List<ToolParameter> getParameters();

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    default ToolDefinition getDefinition() {
        return ToolDefinition.of(getToolName(), getDescription(), getParameters());
    }

    /**
     * Executes the tool for an authenticated caller with validated arguments.
     *
     * @param invocation
     *            the caller identity and allow-listed arguments
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(ToolInvocation invocation);
}
