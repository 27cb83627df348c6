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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Вычисление путей к файлам состояния.
 *
 * Формат имен:
 * - сессионный файл: {@code <dir>/<namespace>-<baseName>-<sessionId>.<ext>}
 * - legacy (до изоляции сессий): {@code <dir>/<namespace>-<baseName>.<ext>}
 *
 * Legacy-файл предпочитается новому сессионному, пока он "свежий" (изменялся в пределах
 * окна миграции). Так сессии, запущенные до введения изоляции, не теряют свое состояние.
 *
 * Ошибки перечисления директории никогда не прерывают вызывающего:
 * результатом становится пустой список или ноль.
 */
public class StatePaths {

    private static final Logger log = LoggerFactory.getLogger(StatePaths.class);

    /**
     * Максимальная длина идентификатора сессии в имени файла.
     */
    public static final int MAX_SESSION_ID_LENGTH = 64;

    /**
     * Используется, если после санитизации от идентификатора ничего не осталось.
     */
    public static final String DEFAULT_SESSION_ID = "default";

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9_-]");
    private static final Pattern BASE_NAME = Pattern.compile("[A-Za-z0-9_.-]+");

    private final StateConfig config;
    private final Clock clock;

    // Идентификатор по умолчанию вычисляется один раз на время жизни экземпляра
    private volatile String defaultSessionId;

    public StatePaths(StateConfig config) {
        this(config, Clock.systemUTC());
    }

    public StatePaths(StateConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public StateConfig getConfig() {
        return config;
    }

    // ==================== Session ID ====================

    /**
     * Идентификатор сессии текущего процесса: переопределение из окружения,
     * либо {@code <host>-<pid>}. Стабилен в пределах жизни процесса.
     */
    public String resolveSessionId() {
        String id = defaultSessionId;
        if (id == null) {
            synchronized (this) {
                id = defaultSessionId;
                if (id == null) {
                    id = config.getSessionOverride() != null ? config.getSessionOverride() : hostPidId();
                    defaultSessionId = id;
                }
            }
        }
        return id;
    }

    /**
     * Возвращает {@code override}, если он задан, иначе идентификатор процесса по умолчанию.
     */
    public String resolveSessionId(String override) {
        if (override != null && !override.isBlank()) {
            return override;
        }
        return resolveSessionId();
    }

    /**
     * Приводит идентификатор к безопасному для файловой системы виду:
     * все символы вне {@code [A-Za-z0-9_-]} заменяются на '_', длина ограничена.
     */
    public static String sanitize(String sessionId) {
        if (sessionId == null) {
            return DEFAULT_SESSION_ID;
        }
        String safe = UNSAFE_CHARS.matcher(sessionId).replaceAll("_");
        if (safe.length() > MAX_SESSION_ID_LENGTH) {
            safe = safe.substring(0, MAX_SESSION_ID_LENGTH);
        }
        return safe.isEmpty() ? DEFAULT_SESSION_ID : safe;
    }

    /**
     * Проверяет имя вида состояния: один компонент имени файла, без разделителей пути.
     *
     * @throws NtsException с кодом {@link NtsErrorCode#INVALID_BASE_NAME}
     */
    public static String requireBaseName(String baseName) {
        if (baseName == null || !BASE_NAME.matcher(baseName).matches()) {
            throw new NtsException(NtsErrorCode.INVALID_BASE_NAME, "baseName", baseName);
        }
        return baseName;
    }

    private static String hostPidId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            log.debug("Host name unavailable, using 'localhost': {}", e.getMessage());
            host = "localhost";
        }
        return sanitize(host) + "-" + ProcessHandle.current().pid();
    }

    // ==================== Paths ====================

    /**
     * Путь сессионного файла состояния. Чистая функция, без I/O.
     */
    public Path sessionPath(String baseName, String sessionId) {
        return config.getStateDir().resolve(sessionPrefix(baseName) + sanitize(sessionId) + extensionSuffix());
    }

    /**
     * Путь legacy-файла состояния (без компоненты сессии).
     */
    public Path legacyPath(String baseName) {
        return config.getStateDir().resolve(config.getNamespace() + "-" + requireBaseName(baseName) + extensionSuffix());
    }

    /**
     * Выбирает файл для последующего чтения.
     *
     * 1. Сессионный файл существует - он.
     * 2. Legacy-файл существует и изменялся в пределах окна миграции - legacy.
     * 3. Иначе - сессионный путь (новые сессии всегда изолированы).
     *
     * Никогда не пишет на диск.
     */
    public Path resolveWithMigration(String baseName, String sessionId) {
        Path session = sessionPath(baseName, sessionId);
        if (Files.exists(session)) {
            return session;
        }
        Path legacy = legacyPath(baseName);
        try {
            if (Files.isRegularFile(legacy)
                    && ageOf(legacy).compareTo(config.getLegacyGrace()) <= 0) {
                log.debug("Using legacy state file {} for session {}", legacy.getFileName(), sessionId);
                return legacy;
            }
        } catch (IOException e) {
            log.debug("Legacy state file {} not usable: {}", legacy, e.getMessage());
        }
        return session;
    }

    // ==================== Directory scans ====================

    /**
     * Удаляет сессионные файлы {@code baseName}, не изменявшиеся дольше {@code maxAge}.
     *
     * @return количество фактически удаленных файлов
     */
    public int sweepStale(String baseName, Duration maxAge) {
        return sweepStale(baseName, maxAge, false);
    }

    /**
     * Очистка устаревших сессионных файлов.
     *
     * @param dryRun если true - только подсчет без удаления
     * @return количество удаленных (или подлежащих удалению) файлов
     */
    public int sweepStale(String baseName, Duration maxAge, boolean dryRun) {
        int removed = 0;
        for (Path file : scanSessionFiles(baseName)) {
            try {
                if (ageOf(file).compareTo(maxAge) <= 0) {
                    continue;
                }
                if (dryRun) {
                    removed++;
                } else if (Files.deleteIfExists(file)) {
                    removed++;
                }
            } catch (IOException e) {
                log.debug("Skipping {} during sweep: {}", file.getFileName(), e.getMessage());
            }
        }
        if (removed > 0) {
            log.info("{} {} stale '{}' state file(s) older than {}",
                    dryRun ? "Would remove" : "Removed", removed, baseName, maxAge);
        }
        return removed;
    }

    /**
     * Идентификаторы сессий, чьи файлы {@code baseName} изменялись в пределах {@code ttl}.
     * Используется для обнаружения параллельно работающих сессий.
     */
    public List<String> listActive(String baseName, Duration ttl) {
        List<String> active = new ArrayList<>();
        for (Path file : scanSessionFiles(baseName)) {
            try {
                if (ageOf(file).compareTo(ttl) <= 0) {
                    active.add(sessionIdOf(baseName, file));
                }
            } catch (IOException e) {
                log.debug("Skipping {} during listing: {}", file.getFileName(), e.getMessage());
            }
        }
        Collections.sort(active);
        return active;
    }

    /**
     * Перечисляет сессионные файлы {@code baseName}. Lock и временные файлы, а также собственный
     * legacy-файл {@code baseName} исключаются.
     *
     * Сопоставление идет по префиксу {@code <ns>-<baseName>-}, поэтому для {@code ralph} под него
     * попадают и файлы вида {@code ralph-state}, включая его legacy-файл {@code <ns>-ralph-state.<ext>}
     * (он выглядит как сессия {@code state}). Формат имен не позволяет их различить: имена видов
     * не должны быть префиксами друг друга.
     */
    List<Path> scanSessionFiles(String baseName) {
        Path dir = config.getStateDir();
        try {
            requireBaseName(baseName);
        } catch (NtsException e) {
            log.warn(e.toLogMessage());
            return List.of();
        }
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        String prefix = sessionPrefix(baseName);
        String suffix = extensionSuffix();
        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                // .lock и .tmp отсекаются проверкой суффикса
                if (name.startsWith(prefix) && name.endsWith(suffix)
                        && name.length() > prefix.length() + suffix.length()
                        && Files.isRegularFile(file)) {
                    matches.add(file);
                }
            }
        } catch (IOException | RuntimeException e) {
            log.debug(new NtsException(NtsErrorCode.SCAN_FAILED, NtsException.context("dir", dir), e).toLogMessage());
            return List.of();
        }
        return matches;
    }

    String sessionIdOf(String baseName, Path file) {
        String name = file.getFileName().toString();
        return name.substring(sessionPrefix(baseName).length(), name.length() - extensionSuffix().length());
    }

    /**
     * Возраст файла по времени последней модификации относительно часов экземпляра.
     */
    Duration ageOf(Path file) throws IOException {
        long modified = Files.getLastModifiedTime(file).toMillis();
        return Duration.ofMillis(Math.max(0, clock.millis() - modified));
    }

    private String sessionPrefix(String baseName) {
        return config.getNamespace() + "-" + requireBaseName(baseName) + "-";
    }

    private String extensionSuffix() {
        return "." + config.getExtension();
    }
}
