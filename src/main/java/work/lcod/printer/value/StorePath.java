package work.lcod.printer.value;

import java.util.Objects;

/**
 * A store entry, identified by its base name relative to the store directory.
 */
public record StorePath(String baseName) {
    public StorePath {
        Objects.requireNonNull(baseName, "baseName");
        if (baseName.isBlank() || baseName.indexOf('/') >= 0) {
            throw new IllegalArgumentException("Invalid store path name: " + baseName);
        }
    }
}
