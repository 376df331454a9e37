package work.lcod.printer.api;

import java.util.Locale;

/**
 * Diagnostic thresholds for the command line front end.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * True when messages at {@code level} pass this threshold.
     */
    public boolean enables(LogLevel level) {
        return level.ordinal() >= ordinal();
    }
}
