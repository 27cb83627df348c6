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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Неизменяемая конфигурация слоя координации состояния.
 *
 * Источники:
 * - переменные окружения (читаются один раз при старте процесса через {@link #fromEnvironment()});
 * - {@link Builder} для тестов и встраивания.
 *
 * Переменные окружения:
 * - {@code NTS_STATE_DIR} - scratch-директория (по умолчанию {@code java.io.tmpdir});
 * - {@code NTS_STATE_NAMESPACE} - префикс продукта в именах файлов (по умолчанию {@code claude});
 * - {@code NTS_SESSION_ID} - явное переопределение идентификатора сессии.
 */
public final class StateConfig {

    public static final String ENV_STATE_DIR = "NTS_STATE_DIR";
    public static final String ENV_NAMESPACE = "NTS_STATE_NAMESPACE";
    public static final String ENV_SESSION_ID = "NTS_SESSION_ID";

    public static final String DEFAULT_NAMESPACE = "claude";
    public static final String DEFAULT_EXTENSION = "json";
    public static final Duration DEFAULT_LEGACY_GRACE = Duration.ofHours(1);
    public static final Duration DEFAULT_STALE_LOCK = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofMillis(50);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMillis(200);
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofMillis(2000);
    public static final Duration DEFAULT_ACTIVE_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_SWEEP_MAX_AGE = Duration.ofHours(24);
    public static final Duration DEFAULT_ACTIVE_CACHE_TTL = Duration.ofSeconds(2);

    private static final Pattern SAFE_TOKEN = Pattern.compile("[A-Za-z0-9_.-]+");

    private final Path stateDir;
    private final String namespace;
    private final String extension;
    private final String sessionOverride;
    private final Duration legacyGrace;
    private final Duration staleLockThreshold;
    private final Duration retryInterval;
    private final Duration readTimeout;
    private final Duration writeTimeout;
    private final Duration activeTtl;
    private final Duration sweepMaxAge;
    private final Duration activeCacheTtl;

    private StateConfig(Builder b) {
        this.stateDir = Objects.requireNonNull(b.stateDir, "stateDir").toAbsolutePath().normalize();
        this.namespace = requireToken("namespace", b.namespace);
        this.extension = requireToken("extension", b.extension);
        this.sessionOverride = b.sessionOverride == null || b.sessionOverride.isBlank() ? null : b.sessionOverride;
        this.legacyGrace = requirePositive("legacyGrace", b.legacyGrace);
        this.staleLockThreshold = requirePositive("staleLockThreshold", b.staleLockThreshold);
        this.retryInterval = requirePositive("retryInterval", b.retryInterval);
        this.readTimeout = requirePositive("readTimeout", b.readTimeout);
        this.writeTimeout = requirePositive("writeTimeout", b.writeTimeout);
        this.activeTtl = requirePositive("activeTtl", b.activeTtl);
        this.sweepMaxAge = requirePositive("sweepMaxAge", b.sweepMaxAge);
        this.activeCacheTtl = requirePositive("activeCacheTtl", b.activeCacheTtl);

        // Чтения менее критичны к сериализации, чем записи
        if (readTimeout.compareTo(writeTimeout) >= 0) {
            throw new NtsException(NtsErrorCode.CONFIG_INVALID, NtsException.context(
                    "setting", "readTimeout", "value", readTimeout + " (must be shorter than writeTimeout " + writeTimeout + ")"));
        }
    }

    /**
     * Создает конфигурацию из переменных окружения процесса.
     */
    public static StateConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Создает конфигурацию из произвольного источника переменных (для тестов).
     */
    public static StateConfig fromEnvironment(Function<String, String> env) {
        Builder b = builder();
        String dir = env.apply(ENV_STATE_DIR);
        if (dir != null && !dir.isBlank()) {
            b.stateDir(Paths.get(dir));
        }
        String ns = env.apply(ENV_NAMESPACE);
        if (ns != null && !ns.isBlank()) {
            b.namespace(ns.trim());
        }
        b.sessionOverride(env.apply(ENV_SESSION_ID));
        return b.build();
    }

    public static StateConfig fromEnvironment(Map<String, String> env) {
        return fromEnvironment(env::get);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .stateDir(stateDir)
                .namespace(namespace)
                .extension(extension)
                .sessionOverride(sessionOverride)
                .legacyGrace(legacyGrace)
                .staleLockThreshold(staleLockThreshold)
                .retryInterval(retryInterval)
                .readTimeout(readTimeout)
                .writeTimeout(writeTimeout)
                .activeTtl(activeTtl)
                .sweepMaxAge(sweepMaxAge)
                .activeCacheTtl(activeCacheTtl);
    }

    public Path getStateDir() {
        return stateDir;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Явный идентификатор сессии из окружения, либо null.
     */
    public String getSessionOverride() {
        return sessionOverride;
    }

    public Duration getLegacyGrace() {
        return legacyGrace;
    }

    public Duration getStaleLockThreshold() {
        return staleLockThreshold;
    }

    public Duration getRetryInterval() {
        return retryInterval;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public Duration getWriteTimeout() {
        return writeTimeout;
    }

    public Duration getActiveTtl() {
        return activeTtl;
    }

    public Duration getSweepMaxAge() {
        return sweepMaxAge;
    }

    /**
     * Как долго координатор переиспользует результат сканирования активных сессий.
     */
    public Duration getActiveCacheTtl() {
        return activeCacheTtl;
    }

    @Override
    public String toString() {
        return "StateConfig[dir=" + stateDir + ", ns=" + namespace + ", ext=" + extension
                + ", session=" + (sessionOverride != null ? sessionOverride : "<auto>") + "]";
    }

    private static String requireToken(String setting, String value) {
        if (value == null || !SAFE_TOKEN.matcher(value).matches()) {
            throw new NtsException(NtsErrorCode.CONFIG_INVALID, NtsException.context("setting", setting, "value", value));
        }
        return value;
    }

    private static Duration requirePositive(String setting, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new NtsException(NtsErrorCode.CONFIG_INVALID, NtsException.context("setting", setting, "value", value));
        }
        return value;
    }

    public static final class Builder {
        private Path stateDir = Paths.get(System.getProperty("java.io.tmpdir"));
        private String namespace = DEFAULT_NAMESPACE;
        private String extension = DEFAULT_EXTENSION;
        private String sessionOverride;
        private Duration legacyGrace = DEFAULT_LEGACY_GRACE;
        private Duration staleLockThreshold = DEFAULT_STALE_LOCK;
        private Duration retryInterval = DEFAULT_RETRY_INTERVAL;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;
        private Duration writeTimeout = DEFAULT_WRITE_TIMEOUT;
        private Duration activeTtl = DEFAULT_ACTIVE_TTL;
        private Duration sweepMaxAge = DEFAULT_SWEEP_MAX_AGE;
        private Duration activeCacheTtl = DEFAULT_ACTIVE_CACHE_TTL;

        private Builder() {
        }

        public Builder stateDir(Path stateDir) {
            this.stateDir = stateDir;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder extension(String extension) {
            this.extension = extension;
            return this;
        }

        public Builder sessionOverride(String sessionOverride) {
            this.sessionOverride = sessionOverride;
            return this;
        }

        public Builder legacyGrace(Duration legacyGrace) {
            this.legacyGrace = legacyGrace;
            return this;
        }

        public Builder staleLockThreshold(Duration staleLockThreshold) {
            this.staleLockThreshold = staleLockThreshold;
            return this;
        }

        public Builder retryInterval(Duration retryInterval) {
            this.retryInterval = retryInterval;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder writeTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
            return this;
        }

        public Builder activeTtl(Duration activeTtl) {
            this.activeTtl = activeTtl;
            return this;
        }

        public Builder sweepMaxAge(Duration sweepMaxAge) {
            this.sweepMaxAge = sweepMaxAge;
            return this;
        }

        public Builder activeCacheTtl(Duration activeCacheTtl) {
            this.activeCacheTtl = activeCacheTtl;
            return this;
        }

        public StateConfig build() {
            return new StateConfig(this);
        }
    }
}
