package work.lcod.printer.value;

import java.util.Objects;

/**
 * A suspended computation.
 *
 * <p>A thunk starts {@link State#PENDING}. While an evaluator runs its computation it is a
 * {@link State#BLACKHOLE}; reaching it again in that state means the value depends on itself.
 * A finished computation leaves the thunk {@link State#RESOLVED}, pointing at the result.
 */
public final class Thunk implements Value {
    public enum State {
        PENDING,
        BLACKHOLE,
        RESOLVED
    }

    @FunctionalInterface
    public interface Computation {
        Value compute();
    }

    private final Computation computation;
    private State state;
    private Value value;

    private Thunk(Computation computation, State state, Value value) {
        this.computation = computation;
        this.state = state;
        this.value = value;
    }

    public static Thunk of(Computation computation) {
        return new Thunk(Objects.requireNonNull(computation, "computation"), State.PENDING, null);
    }

    public static Thunk resolved(Value value) {
        return new Thunk(null, State.RESOLVED, Objects.requireNonNull(value, "value"));
    }

    public synchronized State state() {
        return state;
    }

    public synchronized Value value() {
        if (state != State.RESOLVED) {
            throw new IllegalStateException("Thunk is not resolved (" + state + ")");
        }
        return value;
    }

    /**
     * Moves a pending thunk to {@link State#BLACKHOLE} and hands out its computation.
     */
    public synchronized Computation enter() {
        if (state != State.PENDING) {
            throw new IllegalStateException("Thunk is not pending (" + state + ")");
        }
        state = State.BLACKHOLE;
        return computation;
    }

    public synchronized void complete(Value result) {
        if (state != State.BLACKHOLE) {
            throw new IllegalStateException("Thunk is not being forced (" + state + ")");
        }
        this.value = Objects.requireNonNull(result, "result");
        this.state = State.RESOLVED;
    }

    /**
     * Returns a blackholed thunk to {@link State#PENDING} after its computation failed.
     */
    public synchronized void abandon() {
        if (state == State.BLACKHOLE) {
            state = State.PENDING;
        }
    }

    @Override
    public synchronized String toString() {
        return "Thunk(" + state + ")";
    }
}
