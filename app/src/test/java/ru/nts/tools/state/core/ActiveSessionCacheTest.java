// Aristo 14.01.2026
package ru.nts.tools.state.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.state.support.MutableClock;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты кеша активных сессий: истечение записей моделируется тестовыми часами.
 */
class ActiveSessionCacheTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private StatePaths paths;
    private ActiveSessionCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atSystemNow();
        paths = new StatePaths(StateConfig.builder().stateDir(tempDir).build(), clock);
        cache = new ActiveSessionCache(paths, Duration.ofSeconds(30), clock);
    }

    private void createSession(String sessionId) throws Exception {
        Path file = Files.writeString(paths.sessionPath("ralph-state", sessionId), "{}");
        Files.setLastModifiedTime(file, FileTime.from(clock.instant()));
    }

    @Test
    void servesCachedValueUntilExpiry() throws Exception {
        createSession("s1");
        assertEquals(List.of("s1"), cache.get("ralph-state"));

        createSession("s2");
        clock.advance(Duration.ofSeconds(29));
        assertEquals(List.of("s1"), cache.get("ralph-state"), "Запись кеша еще жива");

        clock.advance(Duration.ofSeconds(2));
        assertEquals(List.of("s1", "s2"), cache.get("ralph-state"), "После истечения кеш перечитывает директорию");
    }

    @Test
    void invalidateForcesRescan() throws Exception {
        createSession("s1");
        assertEquals(List.of("s1"), cache.get("ralph-state"));

        createSession("s2");
        cache.invalidate("ralph-state");
        assertEquals(List.of("s1", "s2"), cache.get("ralph-state"));

        createSession("s3");
        cache.invalidateAll();
        assertEquals(3, cache.get("ralph-state").size());
    }

    @Test
    void entriesAreKeyedByTtl() throws Exception {
        createSession("s1");
        Path file = paths.sessionPath("ralph-state", "old");
        Files.writeString(file, "{}");
        Files.setLastModifiedTime(file, FileTime.from(clock.instant().minus(Duration.ofMinutes(10))));

        assertEquals(List.of("s1"), cache.get("ralph-state", Duration.ofMinutes(5)));
        assertEquals(List.of("old", "s1"), cache.get("ralph-state", Duration.ofMinutes(15)));
    }

    @Test
    void cachedListIsImmutable() throws Exception {
        createSession("s1");
        assertThrows(UnsupportedOperationException.class, () -> cache.get("ralph-state").add("x"));
    }
}
