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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception class of the state coordination layer.
 * Provides structured error reporting with error codes and context.
 *
 * <p>Only configuration mistakes are thrown to callers. Everything else is
 * built for its {@link #toLogMessage()} and logged by the component that
 * degraded gracefully.
 * <pre>
 * throw new NtsException(NtsErrorCode.CONFIG_INVALID, Map.of("setting", "namespace", "value", ns));
 * </pre>
 */
public class NtsException extends RuntimeException {

    private final NtsErrorCode code;
    private final Map<String, Object> context;

    public NtsException(NtsErrorCode code, Map<String, Object> context) {
        super(code.getMessage());
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : Collections.emptyMap();
    }

    public NtsException(NtsErrorCode code, String key, Object value) {
        super(code.getMessage());
        this.code = code;
        this.context = Map.of(key, String.valueOf(value));
    }

    public NtsException(NtsErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code.getMessage(), cause);
        this.code = code;
        this.context = context != null ? new LinkedHashMap<>(context) : Collections.emptyMap();
    }

    public NtsErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * Returns a formatted user-friendly error message.
     */
    public String toUserMessage() {
        return code.format(context);
    }

    @Override
    public String getMessage() {
        return toUserMessage();
    }

    /**
     * Returns a compact single-line error message for logs:
     * {@code [CODE] message | key=value, ... | hint=solution | cause=Type: message}.
     */
    public String toLogMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(code.name()).append("] ").append(code.getMessage());
        if (!context.isEmpty()) {
            sb.append(" | ");
            NtsErrorCode.appendContext(sb, context);
        }
        sb.append(" | hint=").append(code.resolveSolution(context));
        Throwable cause = getCause();
        if (cause != null) {
            String causeMessage = cause instanceof NtsException
                    ? ((NtsException) cause).toLogMessage()
                    : cause.getMessage();
            sb.append(" | cause=").append(cause.getClass().getSimpleName()).append(": ").append(causeMessage);
        }
        return sb.toString();
    }

    /**
     * Сокращение для построения контекста с сохранением порядка ключей.
     * Аргументы идут парами: ключ, значение.
     */
    public static Map<String, Object> context(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("context() expects key/value pairs");
        }
        Map<String, Object> ctx = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            ctx.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return ctx;
    }
}
