package com.slicereport.logging;

import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides a shared logger configuration for the report pipeline.
 */
public final class AppLogger {
    private static final String LEVEL_PROPERTY = "slicereport.log.level";
    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger("com.slicereport.SliceReport");
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
                if (record.getThrown() != null) {
                    line += "  caused by " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.out, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (Exception ignored) {
            // fall back to platform default when UTF-8 is unavailable
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(resolveLevel());
        return logger;
    }

    private static Level resolveLevel() {
        String configured = System.getProperty(LEVEL_PROPERTY);
        if (configured == null || configured.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(configured.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return Level.INFO;
        }
    }
}
