package work.lcod.printer.document;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Document syntaxes accepted by {@link DocumentValues}.
 */
public enum DocumentFormat {
    JSON,
    YAML,
    TOML;

    public static DocumentFormat from(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("YML".equals(normalized)) {
            return YAML;
        }
        try {
            return DocumentFormat.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported document format: " + value);
        }
    }

    /**
     * Guesses the format from the file extension, defaulting to JSON.
     */
    public static DocumentFormat detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return JSON;
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return YAML;
        }
        if (name.endsWith(".toml")) {
            return TOML;
        }
        return JSON;
    }
}
