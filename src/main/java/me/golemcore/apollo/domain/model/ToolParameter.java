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

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed declaration of a single tool argument. The declaration is both the
 * source of the JSON Schema shown to the model and the allow-list the executor
 * validates incoming arguments against.
 */
@Data
@Builder
public class ToolParameter {

    private String name;
    private ParameterType type;
    private String description;
    private boolean required;

    @Singular("enumValue")
    private List<String> enumValues;

    private Integer minLength;
    private Integer maxLength;
    private Integer minimum;
    private Integer maximum;

    /**
     * Nested parameters for {@link ParameterType#OBJECT}. Keys outside this list
     * are dropped.
     */
    @Singular
    private List<ToolParameter> properties;

    /**
     * When set, the argument is the id of an existing entity of this type that
     * must belong to the calling user.
     */
    private EntityType ownedEntity;

    public static ToolParameterBuilder string(String name, String description) {
        return ToolParameter.builder().name(name).type(ParameterType.STRING).description(description);
    }

    public static ToolParameterBuilder integer(String name, String description) {
        return ToolParameter.builder().name(name).type(ParameterType.INTEGER).description(description);
    }

    public static ToolParameterBuilder date(String name, String description) {
        return ToolParameter.builder().name(name).type(ParameterType.DATE).description(description);
    }

    public static ToolParameterBuilder entityId(String name, EntityType entityType, String description) {
        return ToolParameter.builder()
                .name(name)
                .type(ParameterType.STRING)
                .description(description)
                .ownedEntity(entityType);
    }

    public static ToolParameterBuilder object(String name, String description) {
        return ToolParameter.builder().name(name).type(ParameterType.OBJECT).description(description);
    }

    /**
     * Renders this parameter as a JSON Schema property.
     */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type.getJsonType());
        if (description != null) {
            schema.put("description", description);
        }
        if (type == ParameterType.DATE) {
            schema.put("format", "date");
        }
        if (enumValues != null && !enumValues.isEmpty()) {
            schema.put("enum", enumValues);
        }
        if (minLength != null) {
            schema.put("minLength", minLength);
        }
        if (maxLength != null) {
            schema.put("maxLength", maxLength);
        }
        if (minimum != null) {
            schema.put("minimum", minimum);
        }
        if (maximum != null) {
            schema.put("maximum", maximum);
        }
        if (type == ParameterType.OBJECT) {
            schema.put("properties", propertiesSchema(properties));
        }
        return schema;
    }

    static Map<String, Object> propertiesSchema(List<ToolParameter> parameters) {
        Map<String, Object> props = new LinkedHashMap<>();
        if (parameters != null) {
            for (ToolParameter parameter : parameters) {
                props.put(parameter.getName(), parameter.toJsonSchema());
            }
        }
        return props;
    }

    public enum ParameterType {
        STRING("string"), INTEGER("integer"), NUMBER("number"), BOOLEAN("boolean"), DATE("string"), OBJECT("object");

        private final String jsonType;

        ParameterType(String jsonType) {
            this.jsonType = jsonType;
        }

        public String getJsonType() {
            return jsonType;
        }
    }
}
