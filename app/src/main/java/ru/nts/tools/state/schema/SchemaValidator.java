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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.state.core.NtsErrorCode;
import ru.nts.tools.state.core.NtsException;

import java.util.Map;

/**
 * Структурная проверка десериализованных записей состояния.
 *
 * Классификатор, а не нормализатор: валидная запись возвращается без изменений.
 * Проверка останавливается на первом нарушении. Исключения наружу не выходят;
 * каждая невалидная запись один раз логируется на уровне WARN с полем, ожидаемым
 * типом и фактическим значением, а вызывающий трактует ее как отсутствующее состояние.
 */
public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    /**
     * Имя "поля" для нарушений, относящихся к документу целиком.
     */
    public static final String DOCUMENT = "<document>";

    private static final int MAX_OBSERVED_LENGTH = 80;

    // Хвост после первого JSON-значения - признак склейки двух записей
    private final ObjectReader reader;

    public SchemaValidator() {
        this(new ObjectMapper());
    }

    public SchemaValidator(ObjectMapper mapper) {
        this.reader = mapper.readerFor(JsonNode.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Проверяет сырой JSON. Ошибка разбора, в том числе любое содержимое после
     * первого JSON-значения, - это нарушение на уровне документа.
     */
    public ValidationResult validate(StateKind kind, String raw) {
        if (raw == null || raw.isBlank()) {
            return reject(kind, DOCUMENT, "object", "empty");
        }
        JsonNode node;
        try {
            node = reader.readValue(raw);
        } catch (JsonProcessingException e) {
            return reject(kind, DOCUMENT, "object", "unparseable JSON (" + e.getOriginalMessage() + ")");
        }
        return validate(kind, node);
    }

    /**
     * Проверяет запись на соответствие контракту вида.
     *
     * 1. Запись должна быть JSON-объектом.
     * 2. Каждое обязательное поле присутствует и имеет объявленный тип.
     * 3. Каждое заданное (не null) необязательное поле имеет объявленный тип.
     */
    public ValidationResult validate(StateKind kind, JsonNode candidate) {
        try {
            if (candidate == null || !candidate.isObject()) {
                return reject(kind, DOCUMENT, "object", FieldType.describe(candidate));
            }

            for (Map.Entry<String, FieldType> field : kind.getRequired().entrySet()) {
                JsonNode value = candidate.get(field.getKey());
                if (value == null || !field.getValue().matches(value)) {
                    return reject(kind, field.getKey(), field.getValue().jsonType(), observed(value));
                }
            }

            for (Map.Entry<String, FieldType> field : kind.getOptional().entrySet()) {
                JsonNode value = candidate.get(field.getKey());
                if (value == null || value.isNull()) {
                    continue;
                }
                if (!field.getValue().matches(value)) {
                    return reject(kind, field.getKey(), field.getValue().jsonType(), observed(value));
                }
            }

            return ValidationResult.valid(candidate);
        } catch (RuntimeException e) {
            // Fail-open: сбой самой проверки тоже означает "состояния нет"
            return reject(kind, DOCUMENT, "object", "validation error " + e);
        }
    }

    private ValidationResult reject(StateKind kind, String field, String expected, String observed) {
        ValidationResult.Violation violation = new ValidationResult.Violation(
                kind != null ? kind.getName() : "unknown", field, expected, observed);
        log.warn(new NtsException(NtsErrorCode.SCHEMA_INVALID, NtsException.context(
                "kind", violation.kind(),
                "field", violation.field(),
                "expected", violation.expected(),
                "observed", violation.observed())).toLogMessage());
        return ValidationResult.invalid(violation);
    }

    /**
     * Фактическое значение для диагностики: скаляры как JSON-литерал, составные - по типу.
     */
    private static String observed(JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return "missing";
        }
        if (value.isContainerNode()) {
            return FieldType.describe(value);
        }
        String literal = value.toString();
        if (literal.length() > MAX_OBSERVED_LENGTH) {
            literal = literal.substring(0, MAX_OBSERVED_LENGTH) + "...";
        }
        return literal;
    }
}
