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

import ru.nts.tools.state.core.NtsErrorCode;
import ru.nts.tools.state.core.NtsException;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Реестр видов состояния.
 *
 * Встроенные виды соответствуют записям workflow-хуков:
 * - {@code ralph} - активация Ralph-цикла по конкретной истории;
 * - {@code maestro} - прогресс оркестрации (recon, interview, plan approval).
 */
public final class StateKinds {

    public static final StateKind RALPH = StateKind.builder("ralph")
            .required("active", FieldType.BOOLEAN)
            .required("storyId", FieldType.STRING)
            .required("activatedAt", FieldType.NUMBER)
            .build();

    public static final StateKind MAESTRO = StateKind.builder("maestro")
            .required("active", FieldType.BOOLEAN)
            .required("taskType", FieldType.STRING)
            .required("reconComplete", FieldType.BOOLEAN)
            .required("interviewComplete", FieldType.BOOLEAN)
            .required("planApproved", FieldType.BOOLEAN)
            .required("activatedAt", FieldType.NUMBER)
            .build();

    private static final Map<String, StateKind> registry = new ConcurrentHashMap<>();

    static {
        registry.put(RALPH.getName(), RALPH);
        registry.put(MAESTRO.getName(), MAESTRO);
    }

    private StateKinds() {
    }

    /**
     * Регистрирует вид, определенный вызывающим. Повторная регистрация заменяет контракт.
     */
    public static StateKind register(StateKind kind) {
        registry.put(kind.getName(), kind);
        return kind;
    }

    /**
     * @throws NtsException с кодом {@link NtsErrorCode#UNKNOWN_STATE_KIND}, если вид не зарегистрирован
     */
    public static StateKind forName(String name) {
        StateKind kind = name != null ? registry.get(name) : null;
        if (kind == null) {
            throw new NtsException(NtsErrorCode.UNKNOWN_STATE_KIND, "kind", name);
        }
        return kind;
    }

    public static Set<String> names() {
        return new TreeSet<>(registry.keySet());
    }
}
