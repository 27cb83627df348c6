// Aristo 14.01.2026
package ru.nts.tools.state.support;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Перехват логов пакета ru.nts.tools.state для проверки диагностики.
 * Использование: try (LogCapture logs = LogCapture.start()) { ... }
 */
public class LogCapture implements AutoCloseable {

    private static final String ROOT_PACKAGE = "ru.nts.tools.state";

    private final Logger logger;
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    private LogCapture() {
        this.logger = (Logger) LoggerFactory.getLogger(ROOT_PACKAGE);
        appender.start();
        logger.addAppender(appender);
    }

    public static LogCapture start() {
        return new LogCapture();
    }

    public List<String> messages(Level level) {
        return appender.list.stream()
                .filter(e -> e.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
    }

    public List<String> warnings() {
        return messages(Level.WARN);
    }

    @Override
    public void close() {
        logger.detachAppender(appender);
        appender.stop();
    }
}
