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
 * Результат классификации записи: либо валидное состояние, либо первое найденное нарушение.
 */
public record ValidationResult(JsonNode state, Violation violation) {

    public static ValidationResult valid(JsonNode state) {
        return new ValidationResult(state, null);
    }

    public static ValidationResult invalid(Violation violation) {
        return new ValidationResult(null, violation);
    }

    public boolean isValid() {
        return violation == null;
    }

    /**
     * Нарушение контракта.
     *
     * @param kind     имя вида состояния
     * @param field    имя поля, либо {@code <document>} для записи целиком
     * @param expected ожидаемый тип
     * @param observed фактическое значение (или его тип для составных значений)
     */
    public record Violation(String kind, String field, String expected, String observed) {

        public String reason() {
            return "field '" + field + "' expected " + expected + " but was " + observed;
        }
    }
}
