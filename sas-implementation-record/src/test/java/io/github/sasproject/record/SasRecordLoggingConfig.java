package io.github.sasproject.record;

import org.junit.jupiter.api.BeforeAll;

import java.util.Arrays;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Applies `-Djava.util.logging.ConsoleHandler.level=FINE` (or any JUL level) to the root logger for a test run
public class SasRecordLoggingConfig {
    static final String LEVEL_PROPERTY = "java.util.logging.ConsoleHandler.level";

    @BeforeAll
    static void enableJulDebug() {
        Level target = requestedLevel();
        Logger root = Logger.getLogger("");
        if (finerThanCurrent(root.getLevel(), target)) {
            root.setLevel(target);
        }
        Arrays.stream(root.getHandlers())
            .filter(handler -> finerThanCurrent(handler.getLevel(), target))
            .forEach(handler -> handler.setLevel(target));
    }

    private static Level requestedLevel() {
        String value = System.getProperty(LEVEL_PROPERTY);
        if (value == null || value.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            Logger.getLogger(SasRecordLoggingConfig.class.getName()).warning(() -> "Unrecognised JUL level '" + value + "', using INFO");
            return Level.INFO;
        }
    }

    private static boolean finerThanCurrent(Level current, Level target) {
        return current == null || current.intValue() > target.intValue();
    }
}
