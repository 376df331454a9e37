package work.lcod.printer.value;

import java.io.IOException;

/**
 * Opaque value contributed by an embedder. The printer hands rendering over entirely.
 */
public non-sealed interface ExternalValue extends Value {
    void describe(Appendable out) throws IOException;
}
