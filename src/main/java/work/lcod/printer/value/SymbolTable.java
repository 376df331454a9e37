package work.lcod.printer.value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interns attribute and binding names so attribute sets can be keyed by {@link Symbol}.
 */
public final class SymbolTable {
    private final Map<String, Symbol> byName = new HashMap<>();
    private final List<String> names = new ArrayList<>();

    public synchronized Symbol intern(String name) {
        Objects.requireNonNull(name, "name");
        var existing = byName.get(name);
        if (existing != null) {
            return existing;
        }
        var symbol = new Symbol(names.size());
        names.add(name);
        byName.put(name, symbol);
        return symbol;
    }

    public synchronized String resolve(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        if (symbol.id() < 0 || symbol.id() >= names.size()) {
            throw new IllegalArgumentException("Unknown symbol: " + symbol.id());
        }
        return names.get(symbol.id());
    }

    public synchronized int size() {
        return names.size();
    }
}
