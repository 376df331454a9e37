package work.lcod.printer.value;

/**
 * Handle of an interned name. Resolve it through the {@link SymbolTable} that issued it.
 */
public record Symbol(int id) {
}
