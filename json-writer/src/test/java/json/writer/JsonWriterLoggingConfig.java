package json.writer;

import org.junit.jupiter.api.BeforeAll;

import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Configures JUL for json-writer tests.
///
/// The level comes from `json.writer.test.logLevel`, else from
/// `java.util.logging.ConsoleHandler.level`, else `INFO`. It is applied to the
/// `json.writer` logger and lowers the root handlers' thresholds as needed, so
/// `-Djson.writer.test.logLevel=FINER` shows the writer's state resets.
public class JsonWriterLoggingConfig {

    static final String LOG_LEVEL_PROPERTY = "json.writer.test.logLevel";

    @BeforeAll
    static void configureWriterLogging() {
        final Level level = configuredLevel();
        final var writerLogger = Logger.getLogger("json.writer");
        if (writerLogger.getLevel() == null || writerLogger.getLevel().intValue() > level.intValue()) {
            writerLogger.setLevel(level);
        }
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            final Level handlerLevel = handler.getLevel();
            if (handlerLevel == null || handlerLevel.intValue() > level.intValue()) {
                handler.setLevel(level);
            }
        }
    }

    private static Level configuredLevel() {
        String value = System.getProperty(LOG_LEVEL_PROPERTY);
        if (value == null) {
            value = System.getProperty("java.util.logging.ConsoleHandler.level");
        }
        if (value == null) {
            return Level.INFO;
        }
        final String name = value.trim().toUpperCase(Locale.ROOT);
        try {
            return Level.parse(name);
        } catch (IllegalArgumentException ex) {
            Logger.getLogger(JsonWriterLoggingConfig.class.getName())
                    .warning(() -> "Unrecognized test log level: " + name + ". Using INFO");
            return Level.INFO;
        }
    }
}
