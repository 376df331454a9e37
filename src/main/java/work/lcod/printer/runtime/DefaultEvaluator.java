package work.lcod.printer.runtime;

import java.util.Objects;
import work.lcod.printer.value.AttrSet;
import work.lcod.printer.value.BoolValue;
import work.lcod.printer.value.ExternalValue;
import work.lcod.printer.value.FloatValue;
import work.lcod.printer.value.FunctionValue;
import work.lcod.printer.value.IntValue;
import work.lcod.printer.value.ListValue;
import work.lcod.printer.value.NullValue;
import work.lcod.printer.value.PathValue;
import work.lcod.printer.value.SourcePosition;
import work.lcod.printer.value.StorePath;
import work.lcod.printer.value.StringValue;
import work.lcod.printer.value.Symbol;
import work.lcod.printer.value.SymbolTable;
import work.lcod.printer.value.Thunk;
import work.lcod.printer.value.Value;

/**
 * Self-contained {@link Evaluator} over in-memory values: thunks run their own computations,
 * derivations are attribute sets whose {@code type} is {@code "derivation"}.
 */
public final class DefaultEvaluator implements Evaluator {
    public static final String DEFAULT_STORE_DIR = "/nix/store";

    private final SymbolTable symbols;
    private final String storeDir;
    private final CancellationToken cancellationToken;
    private final Symbol typeSymbol;
    private final Symbol drvPathSymbol;

    public DefaultEvaluator(SymbolTable symbols) {
        this(symbols, DEFAULT_STORE_DIR, new CancellationToken());
    }

    public DefaultEvaluator(SymbolTable symbols, String storeDir, CancellationToken token) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        Objects.requireNonNull(storeDir, "storeDir");
        this.storeDir = storeDir.endsWith("/") ? storeDir.substring(0, storeDir.length() - 1) : storeDir;
        this.cancellationToken = token == null ? new CancellationToken() : token;
        this.typeSymbol = symbols.intern("type");
        this.drvPathSymbol = symbols.intern("drvPath");
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    @Override
    public Forced force(Value value) {
        try {
            return Forced.of(forceValue(value));
        } catch (EvaluationException ex) {
            return Forced.failed(ex);
        }
    }

    /**
     * Follows thunks until a concrete value is reached.
     *
     * @throws EvaluationException when a computation fails or a thunk depends on itself
     */
    public Value forceValue(Value value) {
        Objects.requireNonNull(value, "value");
        Value current = value;
        while (current instanceof Thunk thunk) {
            switch (thunk.state()) {
                case RESOLVED -> current = thunk.value();
                case BLACKHOLE -> throw new EvaluationException("infinite recursion encountered");
                case PENDING -> current = runComputation(thunk);
                default -> throw new PrinterFaultException("Unknown thunk state: " + thunk.state());
            }
        }
        return current;
    }

    private Value runComputation(Thunk thunk) {
        cancellationToken.ensureNotCancelled();
        var computation = thunk.enter();
        Value result;
        try {
            Value produced = computation.compute();
            if (produced == null) {
                throw new EvaluationException("computation produced no value");
            }
            result = forceValue(produced);
        } catch (RuntimeException ex) {
            thunk.abandon();
            throw ex;
        }
        thunk.complete(result);
        return result;
    }

    @Override
    public String resolveSymbol(Symbol symbol) {
        return symbols.resolve(symbol);
    }

    @Override
    public String formatPosition(SourcePosition position) {
        return position.origin() + ":" + position.line() + ":" + position.column();
    }

    @Override
    public String storePathDisplay(StorePath path) {
        return storeDir + "/" + path.baseName();
    }

    @Override
    public StorePath coerceToStorePath(Value value) {
        Value forced = forceValue(value);
        String raw;
        if (forced instanceof StringValue string) {
            raw = string.value();
        } else if (forced instanceof PathValue path) {
            raw = path.display();
        } else {
            throw new EvaluationException("cannot coerce " + typeName(forced) + " to a store path");
        }
        String prefix = storeDir + "/";
        if (!raw.startsWith(prefix) || raw.length() == prefix.length()) {
            throw new EvaluationException("path '" + raw + "' is not in the store");
        }
        String rest = raw.substring(prefix.length());
        int slash = rest.indexOf('/');
        String baseName = slash < 0 ? rest : rest.substring(0, slash);
        if (baseName.isBlank()) {
            throw new EvaluationException("path '" + raw + "' is not a valid store path");
        }
        return new StorePath(baseName);
    }

    @Override
    public boolean isDerivation(AttrSet attrs) {
        Value type = attrs.get(typeSymbol);
        if (type == null) {
            return false;
        }
        var forced = force(type);
        return !forced.isFailure()
            && forced.value() instanceof StringValue string
            && "derivation".equals(string.value());
    }

    @Override
    public Symbol drvPathSymbol() {
        return drvPathSymbol;
    }

    @Override
    public void pollCancellation() {
        cancellationToken.ensureNotCancelled();
    }

    static String typeName(Value value) {
        if (value instanceof IntValue) {
            return "an integer";
        }
        if (value instanceof FloatValue) {
            return "a float";
        }
        if (value instanceof BoolValue) {
            return "a Boolean";
        }
        if (value instanceof StringValue) {
            return "a string";
        }
        if (value instanceof PathValue) {
            return "a path";
        }
        if (value instanceof NullValue) {
            return "null";
        }
        if (value instanceof AttrSet) {
            return "a set";
        }
        if (value instanceof ListValue) {
            return "a list";
        }
        if (value instanceof FunctionValue) {
            return "a function";
        }
        if (value instanceof ExternalValue) {
            return "an external value";
        }
        return "a thunk";
    }
}
