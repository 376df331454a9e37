package work.lcod.printer.value;

import java.util.Objects;
import java.util.Optional;

/**
 * A builtin that received fewer arguments than its arity.
 */
public record PartialPrimOp(Optional<PrimOpInfo> info, int suppliedArgs) implements FunctionValue {
    public PartialPrimOp {
        Objects.requireNonNull(info, "info");
        if (suppliedArgs < 1) {
            throw new IllegalArgumentException("a partial application needs at least one argument");
        }
    }

    public static PartialPrimOp of(PrimOpInfo info, int suppliedArgs) {
        return new PartialPrimOp(Optional.of(info), suppliedArgs);
    }
}
