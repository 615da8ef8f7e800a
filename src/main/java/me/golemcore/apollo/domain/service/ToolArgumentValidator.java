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
import me.golemcore.apollo.domain.exception.ToolArgumentException;
import me.golemcore.apollo.domain.model.ToolParameter;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns model-proposed arguments into an allow-listed, type-checked map.
 *
 * <p>
 * Only declared parameters survive, at every nesting level; everything else,
 * including any identity field the model made up, is dropped. Values are
 * coerced to their declared type and checked against length, range and enum
 * constraints. The first violation raises {@link ToolArgumentException}.
 */
@Component
@Slf4j
public class ToolArgumentValidator {

    public Map<String, Object> validate(String toolName, List<ToolParameter> parameters,
            Map<String, Object> arguments) {
        Map<String, Object> raw = arguments != null ? arguments : Map.of();
        logDropped(toolName, parameters, raw);
        return validateObject("", parameters, raw);
    }

    private Map<String, Object> validateObject(String path, List<ToolParameter> parameters, Map<?, ?> raw) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        for (ToolParameter parameter : parameters) {
            String qualifiedName = path + parameter.getName();
            Object value = raw.get(parameter.getName());
            if (value instanceof String text && text.isBlank()) {
                value = null;
            }
            if (value == null) {
                if (parameter.isRequired()) {
                    throw new ToolArgumentException("Missing required parameter: " + qualifiedName);
                }
                continue;
            }
            sanitized.put(parameter.getName(), coerce(qualifiedName, parameter, value));
        }
        return sanitized;
    }

    private Object coerce(String name, ToolParameter parameter, Object value) {
        return switch (parameter.getType()) {
        case STRING -> checkString(name, parameter, value);
        case INTEGER -> checkRange(name, parameter, toInteger(name, value));
        case NUMBER -> toNumber(name, value);
        case BOOLEAN -> toBoolean(name, value);
        case DATE -> toDate(name, value);
        case OBJECT -> {
            if (!(value instanceof Map<?, ?> nested)) {
                throw new ToolArgumentException("Parameter '" + name + "' must be an object");
            }
            Map<String, Object> validated = validateObject(name + ".", parameter.getProperties(), nested);
            if (parameter.isRequired() && validated.isEmpty()) {
                throw new ToolArgumentException("Parameter '" + name + "' must contain at least one of "
                        + parameter.getProperties().stream().map(ToolParameter::getName).toList());
            }
            yield validated;
        }
        };
    }

    private String checkString(String name, ToolParameter parameter, Object value) {
        if (!(value instanceof String text)) {
            throw new ToolArgumentException("Parameter '" + name + "' must be a string");
        }
        String result = text.strip();
        if (!parameter.getEnumValues().isEmpty()) {
            result = result.toLowerCase(Locale.ROOT);
            if (!parameter.getEnumValues().contains(result)) {
                throw new ToolArgumentException("Parameter '" + name + "' must be one of " + parameter.getEnumValues());
            }
        }
        if (parameter.getMinLength() != null && result.length() < parameter.getMinLength()) {
            throw new ToolArgumentException(
                    "Parameter '" + name + "' must be at least " + parameter.getMinLength() + " characters");
        }
        if (parameter.getMaxLength() != null && result.length() > parameter.getMaxLength()) {
            throw new ToolArgumentException(
                    "Parameter '" + name + "' must be at most " + parameter.getMaxLength() + " characters");
        }
        return result;
    }

    private Integer toInteger(String name, Object value) {
        if (value instanceof Integer integer) {
            return integer;
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (asDouble == Math.rint(asDouble) && Math.abs(asDouble) <= Integer.MAX_VALUE) {
                return (int) asDouble;
            }
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.strip());
            } catch (NumberFormatException e) {
                throw new ToolArgumentException("Parameter '" + name + "' must be an integer");
            }
        }
        throw new ToolArgumentException("Parameter '" + name + "' must be an integer");
    }

    private Integer checkRange(String name, ToolParameter parameter, Integer value) {
        if (parameter.getMinimum() != null && value < parameter.getMinimum()) {
            throw new ToolArgumentException("Parameter '" + name + "' must be >= " + parameter.getMinimum());
        }
        if (parameter.getMaximum() != null && value > parameter.getMaximum()) {
            throw new ToolArgumentException("Parameter '" + name + "' must be <= " + parameter.getMaximum());
        }
        return value;
    }

    private Double toNumber(String name, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.strip());
            } catch (NumberFormatException e) {
                throw new ToolArgumentException("Parameter '" + name + "' must be a number");
            }
        }
        throw new ToolArgumentException("Parameter '" + name + "' must be a number");
    }

    private Boolean toBoolean(String name, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if ("true".equalsIgnoreCase(String.valueOf(value).strip())) {
            return true;
        }
        if ("false".equalsIgnoreCase(String.valueOf(value).strip())) {
            return false;
        }
        throw new ToolArgumentException("Parameter '" + name + "' must be a boolean");
    }

    private String toDate(String name, Object value) {
        if (!(value instanceof String text)) {
            throw new ToolArgumentException("Parameter '" + name + "' must be a date (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(text.strip()).toString();
        } catch (DateTimeParseException e) {
            throw new ToolArgumentException("Parameter '" + name + "' must be a date (YYYY-MM-DD)");
        }
    }

    private void logDropped(String toolName, List<ToolParameter> parameters, Map<String, Object> raw) {
        Set<String> dropped = new TreeSet<>(raw.keySet());
        parameters.forEach(parameter -> dropped.remove(parameter.getName()));
        if (!dropped.isEmpty()) {
            log.debug("[Tools] Dropped undeclared arguments for '{}': {}", toolName, dropped);
        }
    }
}
