package work.lcod.printer.value;

import java.util.Objects;

/**
 * Describes a builtin operation for display purposes.
 */
public record PrimOpInfo(String name, int arity) {
    public PrimOpInfo {
        Objects.requireNonNull(name, "name");
        if (arity < 0) {
            throw new IllegalArgumentException("arity must not be negative");
        }
    }

    public String display() {
        return "primop " + name;
    }
}
