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
package ru.nts.tools.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.state.core.ActiveSessionCache;
import ru.nts.tools.state.core.FileUtils;
import ru.nts.tools.state.core.NtsErrorCode;
import ru.nts.tools.state.core.NtsException;
import ru.nts.tools.state.core.StateConfig;
import ru.nts.tools.state.core.StateLock;
import ru.nts.tools.state.core.StatePaths;
import ru.nts.tools.state.schema.SchemaValidator;
import ru.nts.tools.state.schema.StateKind;
import ru.nts.tools.state.schema.ValidationResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Единственная точка входа для внешних потребителей состояния
 * (workflow-трекеры, реестры сессий, таблицы захвата файлов).
 *
 * Композиция: {@link StatePaths} выбирает файл, {@link StateLock} сериализует доступ
 * (best-effort, с ограниченным ожиданием), {@link FileUtils#writeAtomic} пишет,
 * {@link SchemaValidator} классифицирует прочитанное, {@link ActiveSessionCache} ограничивает
 * частоту сканирования директории при опросе активных сессий.
 *
 * Ни одна операция не бросает исключений: чтение деградирует до "состояния нет",
 * запись - до "попытка сделана, ошибка в логе". Потеря необязательного состояния
 * лучше падения вызывающего посреди workflow.
 */
public class StateCoordinator {

    private static final Logger log = LoggerFactory.getLogger(StateCoordinator.class);

    private final StatePaths paths;
    private final StateLock lock;
    private final SchemaValidator validator;
    private final ObjectMapper mapper;
    private final ActiveSessionCache activeSessions;

    public StateCoordinator(StateConfig config) {
        this(config, Clock.systemUTC());
    }

    public StateCoordinator(StateConfig config, Clock clock) {
        this(new StatePaths(config, clock), new StateLock(config, clock), new ObjectMapper(), clock);
    }

    public StateCoordinator(StatePaths paths, StateLock lock, ObjectMapper mapper) {
        this(paths, lock, mapper, Clock.systemUTC());
    }

    private StateCoordinator(StatePaths paths, StateLock lock, ObjectMapper mapper, Clock clock) {
        this.paths = paths;
        this.lock = lock;
        this.mapper = mapper;
        this.validator = new SchemaValidator(mapper);
        this.activeSessions = new ActiveSessionCache(paths, paths.getConfig().getActiveCacheTtl(), clock);
    }

    /**
     * Координатор с конфигурацией из переменных окружения процесса.
     */
    public static StateCoordinator fromEnvironment() {
        return new StateCoordinator(StateConfig.fromEnvironment());
    }

    public StatePaths paths() {
        return paths;
    }

    // ==================== Read ====================

    public JsonNode readState(StateKind kind, String baseName) {
        return readState(kind, baseName, null);
    }

    /**
     * Читает состояние сессии.
     *
     * @return валидная запись, либо null, если файла нет, он нечитаем или не проходит схему
     */
    public JsonNode readState(StateKind kind, String baseName, String sessionId) {
        Path path;
        try {
            path = paths.resolveWithMigration(baseName, paths.resolveSessionId(sessionId));
        } catch (RuntimeException e) {
            log.warn(new NtsException(NtsErrorCode.STATE_READ_FAILED,
                    NtsException.context("baseName", baseName, "session", sessionId), e).toLogMessage());
            return null;
        }

        boolean locked = lock.acquire(path, paths.getConfig().getReadTimeout().toMillis());
        try {
            if (!Files.exists(path)) {
                return null;
            }
            String raw = FileUtils.safeReadString(path);
            ValidationResult result = validator.validate(kind, raw);
            return result.isValid() ? result.state() : null;
        } catch (NoSuchFileException e) {
            // Удален внешним участником между проверкой и чтением
            return null;
        } catch (IOException | RuntimeException e) {
            log.warn(new NtsException(NtsErrorCode.STATE_READ_FAILED,
                    NtsException.context("path", path, "kind", kind), e).toLogMessage());
            return null;
        } finally {
            if (locked) {
                lock.release(path);
            }
        }
    }

    // ==================== Write ====================

    public void writeState(StateKind kind, String baseName, Object content) {
        writeState(kind, baseName, null, content);
    }

    /**
     * Полностью заменяет состояние сессии.
     *
     * Запись всегда идет в сессионный файл, никогда в legacy. Если блокировку получить
     * не удалось, запись выполняется без нее: доступность важнее строгого исключения.
     *
     * @param content JSON-узел или любой сериализуемый Jackson объект
     */
    public void writeState(StateKind kind, String baseName, String sessionId, Object content) {
        Path path;
        String json;
        try {
            path = paths.sessionPath(baseName, paths.resolveSessionId(sessionId));
            json = mapper.writeValueAsString(content);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn(new NtsException(NtsErrorCode.STATE_WRITE_FAILED,
                    NtsException.context("baseName", baseName, "kind", kind, "session", sessionId), e).toLogMessage());
            return;
        }

        boolean locked = lock.acquire(path, paths.getConfig().getWriteTimeout().toMillis());
        try {
            FileUtils.writeAtomic(path, json);
        } catch (IOException | RuntimeException e) {
            log.warn(new NtsException(NtsErrorCode.STATE_WRITE_FAILED,
                    NtsException.context("path", path, "kind", kind, "locked", locked), e).toLogMessage());
        } finally {
            if (locked) {
                lock.release(path);
            }
            activeSessions.invalidate(baseName);
        }
    }

    // ==================== Clear ====================

    public boolean clearState(String baseName) {
        return clearState(baseName, null);
    }

    /**
     * Явное удаление сессионного файла по запросу вызывающего (конец workflow).
     * Legacy-файлы не затрагиваются.
     *
     * @return true, если файл существовал и был удален
     */
    public boolean clearState(String baseName, String sessionId) {
        Path path;
        try {
            path = paths.sessionPath(baseName, paths.resolveSessionId(sessionId));
        } catch (RuntimeException e) {
            log.warn(new NtsException(NtsErrorCode.STATE_DELETE_FAILED,
                    NtsException.context("baseName", baseName, "session", sessionId), e).toLogMessage());
            return false;
        }

        boolean locked = lock.acquire(path, paths.getConfig().getWriteTimeout().toMillis());
        try {
            return FileUtils.safeDelete(path);
        } catch (IOException | RuntimeException e) {
            log.warn(new NtsException(NtsErrorCode.STATE_DELETE_FAILED,
                    NtsException.context("path", path), e).toLogMessage());
            return false;
        } finally {
            if (locked) {
                lock.release(path);
            }
            activeSessions.invalidate(baseName);
        }
    }

    // ==================== Session registry ====================

    public List<String> listActiveSessions(String baseName) {
        return listActiveSessions(baseName, paths.getConfig().getActiveTtl());
    }

    /**
     * Сессии, чьи файлы {@code baseName} изменялись в пределах {@code ttl}.
     *
     * Результат сканирования переиспользуется в течение {@link StateConfig#getActiveCacheTtl()}:
     * собственные записи, удаления и очистка сбрасывают кеш сразу, изменения других процессов
     * становятся видны не позже истечения этого интервала.
     */
    public List<String> listActiveSessions(String baseName, Duration ttl) {
        return activeSessions.get(baseName, ttl);
    }

    public int sweepStale(String baseName) {
        return sweepStale(baseName, paths.getConfig().getSweepMaxAge());
    }

    /**
     * Удаляет сессионные файлы старше {@code maxAge}.
     *
     * @return количество удаленных файлов
     */
    public int sweepStale(String baseName, Duration maxAge) {
        int removed = paths.sweepStale(baseName, maxAge);
        if (removed > 0) {
            activeSessions.invalidate(baseName);
        }
        return removed;
    }
}
