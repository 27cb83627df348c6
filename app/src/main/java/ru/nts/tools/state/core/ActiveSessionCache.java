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

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Кеш списка активных сессий с фиксированным временем жизни записи.
 *
 * Сканирование scratch-директории дешево, но не бесплатно, а опрос активных соседей
 * выполняется хуками на каждый вызов инструмента. Время берется из внедренных часов,
 * поэтому истечение записи в тестах моделируется без реальных пауз.
 */
public class ActiveSessionCache {

    private final StatePaths paths;
    private final Clock clock;
    private final Duration cacheTtl;
    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();

    public ActiveSessionCache(StatePaths paths, Duration cacheTtl) {
        this(paths, cacheTtl, Clock.systemUTC());
    }

    public ActiveSessionCache(StatePaths paths, Duration cacheTtl, Clock clock) {
        this.paths = paths;
        this.cacheTtl = cacheTtl;
        this.clock = clock;
    }

    /**
     * Активные сессии {@code baseName}; повторное сканирование не чаще раза в {@code cacheTtl}.
     */
    public List<String> get(String baseName, Duration activeTtl) {
        Key key = new Key(baseName, activeTtl);
        long now = clock.millis();
        Entry entry = entries.get(key);
        if (entry != null && now - entry.loadedAt() < cacheTtl.toMillis()) {
            return entry.sessions();
        }
        List<String> fresh = List.copyOf(paths.listActive(baseName, activeTtl));
        entries.put(key, new Entry(fresh, now));
        return fresh;
    }

    public List<String> get(String baseName) {
        return get(baseName, paths.getConfig().getActiveTtl());
    }

    public void invalidate(String baseName) {
        entries.keySet().removeIf(k -> Objects.equals(k.baseName(), baseName));
    }

    public void invalidateAll() {
        entries.clear();
    }

    private record Key(String baseName, Duration activeTtl) {}

    private record Entry(List<String> sessions, long loadedAt) {}
}
