package work.lcod.printer.runtime;

import work.lcod.printer.value.AttrSet;
import work.lcod.printer.value.SourcePosition;
import work.lcod.printer.value.StorePath;
import work.lcod.printer.value.Symbol;
import work.lcod.printer.value.Value;

/**
 * Capabilities the printer borrows from the evaluator that owns the value graph.
 */
public interface Evaluator {
    /**
     * Evaluates {@code value} to its head form. Evaluation failures are returned, not thrown;
     * cancellation and programming errors still propagate.
     */
    Forced force(Value value);

    String resolveSymbol(Symbol symbol);

    String formatPosition(SourcePosition position);

    String storePathDisplay(StorePath path);

    /**
     * @throws EvaluationException when the value cannot be forced or is not a store path
     */
    StorePath coerceToStorePath(Value value);

    boolean isDerivation(AttrSet attrs);

    /**
     * Name of the attribute holding a derivation's store path.
     */
    Symbol drvPathSymbol();

    /**
     * @throws PrintCancelledException if cancellation was requested
     */
    void pollCancellation();
}
