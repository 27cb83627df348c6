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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Примитивные типы полей записи состояния.
 */
public enum FieldType {

    BOOLEAN("boolean") {
        @Override
        public boolean matches(JsonNode node) {
            return node.isBoolean();
        }
    },

    STRING("string") {
        @Override
        public boolean matches(JsonNode node) {
            return node.isTextual();
        }
    },

    /**
     * Любое JSON-число, целое или дробное.
     */
    NUMBER("number") {
        @Override
        public boolean matches(JsonNode node) {
            return node.isNumber();
        }
    };

    private final String jsonType;

    FieldType(String jsonType) {
        this.jsonType = jsonType;
    }

    public abstract boolean matches(JsonNode node);

    /**
     * Имя типа в терминах JSON Schema.
     */
    public String jsonType() {
        return jsonType;
    }

    /**
     * Фактический JSON-тип узла для диагностики.
     */
    public static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) return "missing";
        if (node.isNull()) return "null";
        if (node.isBoolean()) return "boolean";
        if (node.isTextual()) return "string";
        if (node.isNumber()) return "number";
        if (node.isArray()) return "array";
        if (node.isObject()) return "object";
        return node.getNodeType().name().toLowerCase();
    }
}
