// Aristo 18.01.2026
package ru.nts.tools.state.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты форматирования структурированных ошибок.
 */
class NtsExceptionTest {

    @Test
    @DisplayName("log line carries code, context, resolved hint and cause in that order")
    void logMessageLayout() {
        NtsException e = new NtsException(NtsErrorCode.STATE_WRITE_FAILED,
                NtsException.context("path", "/tmp/claude-ralph-state-s1.json", "locked", false),
                new IOException("disk full"));

        String line = e.toLogMessage();

        assertTrue(line.startsWith("[STATE_WRITE_FAILED] State file not written | "), line);
        assertTrue(line.contains("path=/tmp/claude-ralph-state-s1.json"), line);
        assertTrue(line.contains("hint=Check disk space and permissions of /tmp/claude-ralph-state-s1.json."), line);
        assertTrue(line.endsWith(" | cause=IOException: disk full"), line);
        assertTrue(line.indexOf("locked=") < line.indexOf("hint="), "Контекст идет раньше подсказки");
        assertFalse(line.contains("\n"), "Запись лога однострочная");
    }

    @Test
    void unresolvedPlaceholdersAreMasked() {
        NtsException e = new NtsException(NtsErrorCode.SCHEMA_INVALID, "field", "active");

        String line = e.toLogMessage();

        assertTrue(line.contains("hint=Field 'active' of kind '...' expected ..."), line);
        assertFalse(line.contains("%"), line);
    }

    @Test
    @DisplayName("exception message is the multi-line user report with solution")
    void userMessage() {
        NtsException e = new NtsException(NtsErrorCode.UNKNOWN_STATE_KIND, "kind", "nope");

        String message = e.getMessage();

        assertTrue(message.startsWith("[ERROR: UNKNOWN_STATE_KIND]"), message);
        assertTrue(message.contains("Solution: Kind 'nope' is not registered."), message);
        assertTrue(message.contains("Context: kind=nope"), message);
    }

    @Test
    void nestedStructuredCauseStaysOnOneLine() {
        NtsException inner = new NtsException(NtsErrorCode.INVALID_BASE_NAME, "baseName", "x/../y");
        NtsException outer = new NtsException(NtsErrorCode.STATE_WRITE_FAILED, NtsException.context("baseName", "x/../y"), inner);

        String line = outer.toLogMessage();

        assertTrue(line.contains("cause=NtsException: [INVALID_BASE_NAME]"), line);
        assertFalse(line.contains("\n"), line);
    }

    @Test
    void contextRequiresPairs() {
        assertThrows(IllegalArgumentException.class, () -> NtsException.context("only-key"));
    }
}
