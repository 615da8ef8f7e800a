package me.golemcore.apollo.domain.model;

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

import java.util.Map;

/**
 * A tool call after validation, bound to the authenticated caller. The user id
 * comes from the turn, never from the model-supplied arguments.
 *
 * @param userId
 *            authenticated user the call runs on behalf of
 * @param conversationId
 *            conversation of the turn that issued the call
 * @param arguments
 *            validated, allow-listed arguments
 */
public record ToolInvocation(String userId, String conversationId, Map<String, Object> arguments) {

    public String getString(String name) {
        Object value = arguments.get(name);
        return value != null ? value.toString() : null;
    }

    public Integer getInteger(String name) {
        Object value = arguments.get(name);
        return value instanceof Number number ? number.intValue() : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getObject(String name) {
        Object value = arguments.get(name);
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }

    public boolean has(String name) {
        return arguments.containsKey(name);
    }
}
