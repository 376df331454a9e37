package work.lcod.printer.value;

/**
 * Marker for callable values: {@link Lambda}, {@link PrimOp} and {@link PartialPrimOp}.
 */
public sealed interface FunctionValue extends Value permits Lambda, PrimOp, PartialPrimOp {
}
