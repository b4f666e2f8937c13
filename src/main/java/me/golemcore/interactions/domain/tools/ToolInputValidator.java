package me.golemcore.interactions.domain.tools;

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON Schema check for tool inputs: {@code type}, {@code properties},
 * {@code required}, {@code enum}, {@code items} and
 * {@code additionalProperties: false}. Schemas using {@code $ref} are rejected
 * outright since references are not resolved; any other keyword is ignored.
 */
public final class ToolInputValidator {

    private ToolInputValidator() {
    }

    /**
     * Returns the list of violations, empty when the input is valid. A missing
     * schema accepts any input.
     */
    public static List<String> validate(Map<String, Object> schema, Map<String, Object> input) {
        List<String> errors = new ArrayList<>();
        if (schema == null || schema.isEmpty()) {
            return errors;
        }
        collectReferences(schema, "schema", errors);
        if (!errors.isEmpty()) {
            return errors;
        }
        validateValue(schema, input != null ? input : Map.of(), "input", errors);
        return errors;
    }

    @SuppressWarnings("unchecked")
    private static void validateValue(Map<String, Object> schema, Object value, String path, List<String> errors) {
        Object type = schema.get("type");
        if (type instanceof String typeName && !matchesType(typeName, value)) {
            errors.add(path + " must be of type " + typeName);
            return;
        }

        Object allowed = schema.get("enum");
        if (allowed instanceof Collection<?> values && !values.contains(value)) {
            errors.add(path + " must be one of " + values);
        }

        if (value instanceof Map<?, ?> object) {
            Map<String, Object> properties = schema.get("properties") instanceof Map<?, ?> props
                    ? (Map<String, Object>) props
                    : Map.of();
            if (schema.get("required") instanceof Collection<?> required) {
                for (Object name : required) {
                    if (!object.containsKey(name) || object.get(name) == null) {
                        errors.add(path + "." + name + " is required");
                    }
                }
            }
            for (Map.Entry<?, ?> entry : object.entrySet()) {
                String key = String.valueOf(entry.getKey());
                Object propertySchema = properties.get(key);
                if (propertySchema instanceof Map<?, ?> nested) {
                    if (entry.getValue() != null) {
                        validateValue((Map<String, Object>) nested, entry.getValue(), path + "." + key, errors);
                    }
                } else if (Boolean.FALSE.equals(schema.get("additionalProperties"))) {
                    errors.add(path + "." + key + " is not allowed");
                }
            }
        }

        if (value instanceof List<?> list && schema.get("items") instanceof Map<?, ?> items) {
            for (int i = 0; i < list.size(); i++) {
                validateValue((Map<String, Object>) items, list.get(i), path + "[" + i + "]", errors);
            }
        }
    }

    private static void collectReferences(Object node, String path, List<String> errors) {
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if ("$ref".equals(key)) {
                    errors.add(path + " uses unsupported $ref " + entry.getValue());
                } else {
                    collectReferences(entry.getValue(), path + "." + key, errors);
                }
            }
        } else if (node instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                collectReferences(list.get(i), path + "[" + i + "]", errors);
            }
        }
    }

    private static boolean matchesType(String type, Object value) {
        return switch (type) {
        case "object" -> value instanceof Map<?, ?>;
        case "array" -> value instanceof List<?>;
        case "string" -> value instanceof String;
        case "boolean" -> value instanceof Boolean;
        case "integer" -> value instanceof Integer || value instanceof Long
                || (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue()));
        case "number" -> value instanceof Number;
        case "null" -> value == null;
        default -> true;
        };
    }
}
