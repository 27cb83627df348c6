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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Утилиты для безопасной работы с файлами состояния.
 * Реализует атомарную перезапись через временный файл в той же директории
 * и Retry Pattern для обхода кратковременных блокировок при переименовании (Windows).
 */
public final class FileUtils {

    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF = 50; // ms

    /**
     * Суффикс временных файлов. Сканеры директории обязаны их игнорировать.
     */
    public static final String TEMP_SUFFIX = ".tmp";

    private static final long PID = ProcessHandle.current().pid();
    private static final AtomicLong TEMP_SEQUENCE = new AtomicLong();

    private FileUtils() {
    }

    /**
     * Выполняет IO-операцию с механизмом повторов.
     */
    public static <T> T executeWithRetry(IORunnable<T> action) throws IOException {
        FileSystemException lastException = null;
        for (int i = 0; i < MAX_RETRIES; i++) {
            try {
                return action.run();
            } catch (NoSuchFileException e) {
                // Отсутствие файла повтором не лечится
                throw e;
            } catch (FileSystemException e) {
                lastException = e;
                long backoff = INITIAL_BACKOFF * (1L << i);
                try {
                    TimeUnit.MILLISECONDS.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    IOException interrupted = new IOException("Retry interrupted", ie);
                    interrupted.addSuppressed(e);
                    throw interrupted;
                }
            }
        }
        throw lastException;
    }

    /**
     * Гарантирует существование родительской директории для указанного пути.
     */
    public static void ensureParentExists(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Атомарная запись контента в файл.
     *
     * Контент пишется во временный файл рядом с целевым (имя содержит PID процесса),
     * сбрасывается на диск и переименовывается поверх цели. Читатель в любой момент
     * видит либо прежнее полное содержимое, либо новое полное содержимое.
     * При ошибке временный файл удаляется, а исключение пробрасывается вызывающему.
     *
     * @param path    целевой файл
     * @param content новое содержимое (UTF-8)
     * @throws IOException если запись или переименование не удались
     */
    public static void writeAtomic(Path path, String content) throws IOException {
        ensureParentExists(path);
        Path tempFile = tempFileFor(path);
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);

        try {
            try (FileChannel channel = FileChannel.open(tempFile,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            executeWithRetry(() -> {
                moveReplacing(tempFile, path);
                return null;
            });
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /**
     * Чтение всего файла как UTF-8 строки с механизмом повторов.
     */
    public static String safeReadString(Path path) throws IOException {
        return executeWithRetry(() -> Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Безопасное удаление файла. Возвращает true, если файл существовал.
     */
    public static boolean safeDelete(Path path) throws IOException {
        return executeWithRetry(() -> Files.deleteIfExists(path));
    }

    /**
     * Имя временного файла: {@code <target>.<pid>.<seq>.tmp}.
     * PID разводит конкурирующие процессы, счетчик - потоки одного процесса.
     */
    static Path tempFileFor(Path path) {
        return path.resolveSibling(path.getFileName() + "." + PID + "." + TEMP_SEQUENCE.incrementAndGet() + TEMP_SUFFIX);
    }

    private static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @FunctionalInterface
    public interface IORunnable<T> {
        T run() throws IOException;
    }
}
