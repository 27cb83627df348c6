// Aristo 15.01.2026
package ru.nts.tools.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.state.core.StateConfig;
import ru.nts.tools.state.core.StatePaths;
import ru.nts.tools.state.schema.StateKinds;

/**
 * Точка входа дочерних JVM для межпроцессных тестов.
 *
 * Режимы:
 * - {@code write <sessionId> <storyChar> <iterations>} - многократно пишет одну и ту же запись;
 * - {@code path <baseName>} - печатает путь сессионного файла текущего процесса.
 *
 * Конфигурация берется из окружения (NTS_STATE_DIR, NTS_SESSION_ID), как у настоящих хуков.
 */
public final class ConcurrentStateWriter {

    static final String BASE_NAME = "ralph-state";
    static final int STORY_LENGTH = 200_000;

    private ConcurrentStateWriter() {
    }

    static ObjectNode record(ObjectMapper mapper, char storyChar) {
        ObjectNode node = mapper.createObjectNode();
        node.put("active", true);
        node.put("storyId", String.valueOf(storyChar).repeat(STORY_LENGTH));
        node.put("activatedAt", 1000);
        return node;
    }

    public static void main(String[] args) {
        StateConfig config = StateConfig.fromEnvironment();
        switch (args[0]) {
            case "write" -> {
                StateCoordinator coordinator = new StateCoordinator(config);
                ObjectNode record = record(new ObjectMapper(), args[2].charAt(0));
                int iterations = Integer.parseInt(args[3]);
                for (int i = 0; i < iterations; i++) {
                    coordinator.writeState(StateKinds.RALPH, BASE_NAME, args[1], record);
                }
            }
            case "path" -> {
                StatePaths paths = new StatePaths(config);
                System.out.println(paths.sessionPath(args[1], paths.resolveSessionId()));
            }
            default -> throw new IllegalArgumentException("Unknown mode: " + args[0]);
        }
    }
}
