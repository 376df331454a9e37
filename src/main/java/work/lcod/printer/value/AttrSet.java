package work.lcod.printer.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Attribute set keyed by interned names. Storage order carries no meaning; printers impose their own.
 *
 * <p>Equality is identity: two sets with the same bindings are still distinct nodes of the graph.
 */
public final class AttrSet implements Value {
    private static final AttrSet EMPTY = new AttrSet(Map.of());

    private final Map<Symbol, Value> attrs;

    private AttrSet(Map<Symbol, Value> attrs) {
        this.attrs = attrs;
    }

    public static AttrSet empty() {
        return EMPTY;
    }

    public static Builder builder(SymbolTable symbols) {
        return new Builder(symbols);
    }

    public Value get(Symbol name) {
        return attrs.get(name);
    }

    public int size() {
        return attrs.size();
    }

    public boolean isEmpty() {
        return attrs.isEmpty();
    }

    public Map<Symbol, Value> entries() {
        return attrs;
    }

    @Override
    public String toString() {
        return "AttrSet(" + attrs.size() + " attributes)";
    }

    public static final class Builder {
        private final SymbolTable symbols;
        private final Map<Symbol, Value> attrs = new LinkedHashMap<>();

        private Builder(SymbolTable symbols) {
            this.symbols = Objects.requireNonNull(symbols, "symbols");
        }

        public Builder put(String name, Value value) {
            return put(symbols.intern(name), value);
        }

        public Builder put(Symbol name, Value value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            attrs.put(name, value);
            return this;
        }

        public AttrSet build() {
            return new AttrSet(Collections.unmodifiableMap(new LinkedHashMap<>(attrs)));
        }
    }
}
