package work.lcod.printer.runtime;

import work.lcod.printer.value.Value;

/**
 * Outcome of forcing a value: either the concrete value or the evaluation error it raised.
 */
public record Forced(Value value, EvaluationException error) {
    public Forced {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value and error must be set");
        }
    }

    public static Forced of(Value value) {
        return new Forced(value, null);
    }

    public static Forced failed(EvaluationException error) {
        return new Forced(null, error);
    }

    public boolean isFailure() {
        return error != null;
    }
}
