package work.lcod.printer.value;

import java.util.Objects;
import java.util.Optional;

/**
 * User-defined function, optionally named by the binding it was declared in.
 */
public record Lambda(Optional<Symbol> name, Optional<SourcePosition> position) implements FunctionValue {
    public Lambda {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(position, "position");
    }

    public static Lambda anonymous() {
        return new Lambda(Optional.empty(), Optional.empty());
    }

    public static Lambda at(SourcePosition position) {
        return new Lambda(Optional.empty(), Optional.of(position));
    }

    public static Lambda named(Symbol name, SourcePosition position) {
        return new Lambda(Optional.of(name), Optional.ofNullable(position));
    }
}
