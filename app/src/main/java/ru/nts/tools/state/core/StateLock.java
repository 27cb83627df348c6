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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Advisory межпроцессная блокировка файла состояния.
 *
 * Блокировка - это соседний файл {@code <state>.lock}, созданный эксклюзивно (CREATE_NEW).
 * Содержимое: {@code <pid>\n<epochMillis>}. Возраст блокировки определяется только
 * временем модификации файла; живость процесса-владельца не проверяется.
 *
 * Жизненный цикл для пары (вызывающий, путь):
 * Idle -> Attempting -> Held -> Released, либо Attempting -> Idle по таймауту.
 * Устаревшая блокировка удаляется и попытка повторяется немедленно, без ожидания.
 *
 * Защищает только от кооперирующих процессов, использующих этот же протокол.
 */
public class StateLock {

    private static final Logger log = LoggerFactory.getLogger(StateLock.class);

    public static final String LOCK_SUFFIX = ".lock";

    private static final long PID = ProcessHandle.current().pid();

    private final Duration staleThreshold;
    private final Duration retryInterval;
    private final Clock clock;

    public StateLock(StateConfig config) {
        this(config.getStaleLockThreshold(), config.getRetryInterval(), Clock.systemUTC());
    }

    public StateLock(StateConfig config, Clock clock) {
        this(config.getStaleLockThreshold(), config.getRetryInterval(), clock);
    }

    public StateLock(Duration staleThreshold, Duration retryInterval, Clock clock) {
        this.staleThreshold = staleThreshold;
        this.retryInterval = retryInterval;
        this.clock = clock;
    }

    /**
     * Путь файла блокировки для файла состояния.
     */
    public static Path lockPath(Path statePath) {
        return statePath.resolveSibling(statePath.getFileName() + LOCK_SUFFIX);
    }

    /**
     * Пытается захватить блокировку в пределах {@code timeoutMs}.
     *
     * @return true - блокировка удерживается вызывающим; false - таймаут или ошибка,
     *         вызывающий сам решает, продолжать ли без блокировки
     */
    public boolean acquire(Path statePath, long timeoutMs) {
        Path lock = lockPath(statePath);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0, timeoutMs));

        try {
            FileUtils.ensureParentExists(lock);
        } catch (IOException e) {
            log.warn(failure(NtsErrorCode.LOCK_FAILED, statePath, e));
            return false;
        }

        while (true) {
            try {
                createLockFile(lock);
                log.debug("Lock acquired: {}", lock);
                return true;
            } catch (FileAlreadyExistsException e) {
                // Занято - разбираемся ниже
            } catch (IOException e) {
                log.warn(failure(NtsErrorCode.LOCK_FAILED, statePath, e));
                return false;
            }

            try {
                long age = clock.millis() - Files.getLastModifiedTime(lock).toMillis();
                if (age > staleThreshold.toMillis()) {
                    if (Files.deleteIfExists(lock)) {
                        log.info(new NtsException(NtsErrorCode.STALE_LOCK_RECLAIMED, NtsException.context(
                                "path", statePath, "ageMs", age, "staleMs", staleThreshold.toMillis())).toLogMessage());
                    }
                    // Немедленный повтор: брошенная блокировка не должна съедать бюджет ожидания
                    continue;
                }
            } catch (NoSuchFileException e) {
                // Владелец освободил блокировку между попытками
                continue;
            } catch (IOException e) {
                log.warn(failure(NtsErrorCode.LOCK_FAILED, statePath, e));
                return false;
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn(new NtsException(NtsErrorCode.LOCK_TIMEOUT,
                        NtsException.context("path", statePath, "timeoutMs", timeoutMs)).toLogMessage());
                return false;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, retryInterval.toNanos()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Lock wait interrupted: {}", lock);
                return false;
            }
        }
    }

    /**
     * Освобождает блокировку. Никогда не бросает исключений: обычно вызывается из finally.
     */
    public void release(Path statePath) {
        Path lock = lockPath(statePath);
        try {
            Files.deleteIfExists(lock);
            log.debug("Lock released: {}", lock);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to release lock {}: {}", lock, e.toString());
        }
    }

    private void createLockFile(Path lock) throws IOException {
        byte[] owner = (PID + "\n" + clock.millis()).getBytes(StandardCharsets.UTF_8);
        // Создание и запись разделены: удаляем только файл, созданный нами
        FileChannel channel = FileChannel.open(lock, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        try (channel) {
            ByteBuffer buffer = ByteBuffer.wrap(owner);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(lock);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private static String failure(NtsErrorCode code, Path statePath, IOException cause) {
        return new NtsException(code, NtsException.context("path", statePath), cause).toLogMessage();
    }
}
