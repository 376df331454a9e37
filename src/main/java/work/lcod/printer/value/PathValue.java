package work.lcod.printer.value;

import java.util.Objects;

/**
 * A filesystem path literal. {@link #display()} is printed verbatim.
 */
public record PathValue(String display) implements Value {
    public PathValue {
        Objects.requireNonNull(display, "display");
    }

    public static PathValue of(String display) {
        return new PathValue(display);
    }
}
