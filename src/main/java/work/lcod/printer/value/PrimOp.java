package work.lcod.printer.value;

import java.util.Objects;
import java.util.Optional;

public record PrimOp(Optional<PrimOpInfo> info) implements FunctionValue {
    public PrimOp {
        Objects.requireNonNull(info, "info");
    }

    public static PrimOp of(PrimOpInfo info) {
        return new PrimOp(Optional.of(info));
    }

    public static PrimOp unnamed() {
        return new PrimOp(Optional.empty());
    }
}
