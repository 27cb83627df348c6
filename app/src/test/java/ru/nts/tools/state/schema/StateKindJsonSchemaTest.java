// Aristo 15.01.2026
package ru.nts.tools.state.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Сверка контрактов видов состояния с их представлением в JSON Schema Draft-07.
 * Независимый валидатор networknt должен классифицировать записи так же, как {@link SchemaValidator}.
 */
class StateKindJsonSchemaTest {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static JsonSchemaFactory schemaFactory;

    private final SchemaValidator validator = new SchemaValidator(mapper);

    private static final StateKind CLAIM = StateKind.builder("claim")
            .required("path", FieldType.STRING)
            .optional("claimedAt", FieldType.NUMBER)
            .build();

    @BeforeAll
    static void setup() {
        schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    }

    static Stream<Arguments> records() {
        return Stream.of(
                Arguments.of(StateKinds.RALPH, "{\"active\":true,\"storyId\":\"S1\",\"activatedAt\":1000}"),
                Arguments.of(StateKinds.RALPH, "{\"active\":\"yes\",\"storyId\":\"S1\",\"activatedAt\":1000}"),
                Arguments.of(StateKinds.RALPH, "{\"storyId\":\"S1\",\"activatedAt\":1000}"),
                Arguments.of(StateKinds.RALPH, "{\"active\":false,\"storyId\":\"S1\",\"activatedAt\":12.5}"),
                Arguments.of(StateKinds.MAESTRO, "{\"active\":true,\"taskType\":\"research\",\"reconComplete\":true,"
                        + "\"interviewComplete\":false,\"planApproved\":false,\"activatedAt\":1}"),
                Arguments.of(StateKinds.MAESTRO, "{\"active\":true,\"taskType\":\"research\",\"reconComplete\":\"no\","
                        + "\"interviewComplete\":false,\"planApproved\":false,\"activatedAt\":1}"),
                Arguments.of(CLAIM, "{\"path\":\"a\"}"),
                Arguments.of(CLAIM, "{\"path\":\"a\",\"claimedAt\":null}"),
                Arguments.of(CLAIM, "{\"path\":\"a\",\"claimedAt\":\"now\"}"),
                Arguments.of(CLAIM, "[]")
        );
    }

    /**
     * Проверяет, что сгенерированная схема - валидный draft-07 объект с описанием обязательных полей.
     */
    @Test
    void schemaDescribesRequiredFields() {
        JsonNode schema = StateKinds.RALPH.toJsonSchema(mapper);

        assertEquals("object", schema.get("type").asText());
        assertEquals("boolean", schema.path("properties").path("active").path("type").asText());
        assertEquals(3, schema.get("required").size());
        assertDoesNotThrow(() -> schemaFactory.getSchema(schema));
    }

    @ParameterizedTest(name = "{0}: {1}")
    @MethodSource("records")
    void validatorAgreesWithJsonSchema(StateKind kind, String raw) throws Exception {
        JsonSchema schema = schemaFactory.getSchema(kind.toJsonSchema(mapper));
        Set<ValidationMessage> errors = schema.validate(mapper.readTree(raw));

        boolean validBySchema = errors.isEmpty();
        boolean validByValidator = validator.validate(kind, raw).isValid();

        assertEquals(validBySchema, validByValidator,
                "Расхождение для " + kind + ": " + raw + " (schema errors: " + errors + ")");
    }
}
