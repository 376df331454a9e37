package work.lcod.printer.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link PrintOptions} from the {@code [print]} table of a TOML document.
 *
 * <pre>
 * [print]
 * force = true
 * max-depth = 4
 * max-attrs = "unbounded"
 * </pre>
 */
public final class PrintOptionsLoader {
    static final String TABLE = "print";
    static final String UNBOUNDED_KEYWORD = "unbounded";

    private PrintOptionsLoader() {}

    public static PrintOptions load(Path path) throws IOException {
        return load(path, PrintOptions.defaults());
    }

    public static PrintOptions load(Path path, PrintOptions base) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new NoSuchFileException(String.valueOf(path), null, "Print options file not found");
        }
        return parse(Files.readString(path), base);
    }

    public static PrintOptions parse(String toml, PrintOptions base) {
        return fromToml(Toml.parse(toml), base);
    }

    public static PrintOptions fromToml(TomlParseResult result, PrintOptions base) {
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid TOML: " + result.errors().get(0).getMessage());
        }
        TomlTable table = result.getTable(TABLE);
        if (table == null || table.isEmpty()) {
            return base;
        }
        var builder = base.toBuilder();
        for (String key : table.keySet()) {
            Object raw = table.get(List.of(key));
            String option = TABLE + "." + key;
            switch (key) {
                case "force" -> builder.force(readBoolean(option, raw));
                case "ansi-colors" -> builder.ansiColors(readBoolean(option, raw));
                case "track-repeated" -> builder.trackRepeated(readBoolean(option, raw));
                case "derivation-paths" -> builder.derivationPaths(readBoolean(option, raw));
                case "max-depth" -> builder.maxDepth(readCount(option, raw));
                case "max-attrs" -> builder.maxAttrs(readCount(option, raw));
                case "max-list-items" -> builder.maxListItems(readCount(option, raw));
                case "max-string-length" -> builder.maxStringLength(readCount(option, raw));
                default -> throw new IllegalArgumentException("Unknown print option: " + option);
            }
        }
        return builder.build();
    }

    private static boolean readBoolean(String key, Object raw) {
        if (raw instanceof Boolean bool) {
            return bool;
        }
        throw new IllegalArgumentException(key + " must be a boolean");
    }

    /**
     * Accepts a non-negative integer or the string {@code "unbounded"}.
     */
    public static int parseCount(String key, String raw) {
        String trimmed = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (UNBOUNDED_KEYWORD.equals(trimmed)) {
            return PrintOptions.UNBOUNDED;
        }
        try {
            return readCount(key, Long.parseLong(trimmed));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a count or \"" + UNBOUNDED_KEYWORD + "\": " + raw);
        }
    }

    private static int readCount(String key, Object raw) {
        if (raw instanceof String text) {
            if (UNBOUNDED_KEYWORD.equalsIgnoreCase(text.trim())) {
                return PrintOptions.UNBOUNDED;
            }
            throw new IllegalArgumentException(key + " must be a count or \"" + UNBOUNDED_KEYWORD + "\": " + text);
        }
        if (raw instanceof Long number) {
            if (number < 0) {
                throw new IllegalArgumentException(key + " must not be negative: " + number);
            }
            return number >= PrintOptions.UNBOUNDED ? PrintOptions.UNBOUNDED : number.intValue();
        }
        throw new IllegalArgumentException(key + " must be a count or \"" + UNBOUNDED_KEYWORD + "\"");
    }
}
