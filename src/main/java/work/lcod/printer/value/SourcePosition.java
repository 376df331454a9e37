package work.lcod.printer.value;

import java.util.Objects;

public record SourcePosition(String origin, int line, int column) {
    public SourcePosition {
        Objects.requireNonNull(origin, "origin");
    }
}
