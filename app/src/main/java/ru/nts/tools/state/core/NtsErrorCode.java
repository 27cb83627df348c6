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
package ru.nts.tools.state.core;

import java.util.Map;

/**
 * Structured error codes for the state coordination layer.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Most codes never reach the caller as an exception: the coordinator degrades
 * to "no state" or "best-effort write" and only logs them.
 * <pre>
 * [ERROR: LOCK_TIMEOUT]
 * Message: Lock not acquired within timeout
 * Solution: Another session holds ~/tmp/claude-ralph-state-s1.json.lock. Proceeding unlocked.
 * Context: path=..., timeoutMs=2000
 * </pre>
 */
public enum NtsErrorCode {

    // ============ Lock Errors ============

    LOCK_TIMEOUT("Lock not acquired within timeout",
            "Another session holds %path%.lock. The operation proceeds unlocked."),

    LOCK_FAILED("Lock acquisition aborted",
            "Check permissions of the scratch directory containing %path%."),

    STALE_LOCK_RECLAIMED("Stale lock reclaimed",
            "Lock %path%.lock was older than %staleMs% ms and presumed abandoned."),

    // ============ State Errors ============

    SCHEMA_INVALID("State record failed schema validation",
            "Field '%field%' of kind '%kind%' expected %expected%. The record is treated as absent."),

    STATE_READ_FAILED("State file not readable",
            "Check permissions of %path%. The state is treated as absent."),

    STATE_WRITE_FAILED("State file not written",
            "Check disk space and permissions of %path%. The update was lost."),

    STATE_DELETE_FAILED("State file not deleted",
            "Check permissions of %path%."),

    SCAN_FAILED("Scratch directory scan failed",
            "Check that %dir% exists and is readable."),

    // ============ Configuration Errors ============

    INVALID_BASE_NAME("Invalid state base name",
            "Base name '%baseName%' must be a non-empty token of [A-Za-z0-9_.-] without path separators."),

    CONFIG_INVALID("Invalid state configuration",
            "Setting '%setting%' has an invalid value: %value%."),

    UNKNOWN_STATE_KIND("Unknown state kind",
            "Kind '%kind%' is not registered. Register it with StateKinds.register first.");

    private final String message;
    private final String solution;

    NtsErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, kind, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));
        sb.append(String.format("Solution: %s", resolveSolution(context)));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            appendContext(sb, context);
        }

        return sb.toString();
    }

    /**
     * Интерполяция %placeholder% в solution.
     * Неиспользованные плейсхолдеры заменяются на "...".
     */
    String resolveSolution(Map<String, Object> context) {
        String resolved = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolved = resolved.replace("%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        return resolved.replaceAll("%\\w+%", "...");
    }

    static void appendContext(StringBuilder sb, Map<String, Object> context) {
        boolean first = true;
        for (Map.Entry<String, Object> entry : context.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
    }
}
