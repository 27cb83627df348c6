/*
 * Copyright 2025 Aristo
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
 */
package ru.nts.tools.state.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Контракт вида состояния: обязательные и необязательные поля с примитивными типами.
 * Порядок объявления полей определяет порядок проверки.
 *
 * <pre>
 * StateKind kind = StateKind.builder("ralph")
 *         .required("active", FieldType.BOOLEAN)
 *         .required("storyId", FieldType.STRING)
 *         .optional("note", FieldType.STRING)
 *         .build();
 * </pre>
 */
public final class StateKind {

    private final String name;
    private final Map<String, FieldType> required;
    private final Map<String, FieldType> optional;

    private StateKind(String name, Map<String, FieldType> required, Map<String, FieldType> optional) {
        this.name = name;
        this.required = Collections.unmodifiableMap(new LinkedHashMap<>(required));
        this.optional = Collections.unmodifiableMap(new LinkedHashMap<>(optional));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Map<String, FieldType> getRequired() {
        return required;
    }

    public Map<String, FieldType> getOptional() {
        return optional;
    }

    /**
     * Описание контракта в виде JSON Schema (draft-07) для внешних инструментов.
     * Необязательные поля допускают null.
     */
    public ObjectNode toJsonSchema(ObjectMapper mapper) {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("$schema", "http://json-schema.org/draft-07/schema#");
        schema.put("title", name);
        schema.put("type", "object");

        ObjectNode props = schema.putObject("properties");
        required.forEach((field, type) -> props.putObject(field).put("type", type.jsonType()));
        optional.forEach((field, type) -> {
            ArrayNode types = props.putObject(field).putArray("type");
            types.add(type.jsonType());
            types.add("null");
        });

        ArrayNode req = schema.putArray("required");
        required.keySet().forEach(req::add);
        return schema;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateKind other)) return false;
        return name.equals(other.name) && required.equals(other.required) && optional.equals(other.optional);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, required, optional);
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder {
        private final String name;
        private final Map<String, FieldType> required = new LinkedHashMap<>();
        private final Map<String, FieldType> optional = new LinkedHashMap<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("State kind name must not be blank");
            }
            this.name = name;
        }

        public Builder required(String field, FieldType type) {
            checkUnique(field);
            required.put(field, Objects.requireNonNull(type, "type"));
            return this;
        }

        public Builder optional(String field, FieldType type) {
            checkUnique(field);
            optional.put(field, Objects.requireNonNull(type, "type"));
            return this;
        }

        public StateKind build() {
            return new StateKind(name, required, optional);
        }

        private void checkUnique(String field) {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("Field name must not be blank in kind '" + name + "'");
            }
            if (required.containsKey(field) || optional.containsKey(field)) {
                throw new IllegalArgumentException("Duplicate field '" + field + "' in kind '" + name + "'");
            }
        }
    }
}
