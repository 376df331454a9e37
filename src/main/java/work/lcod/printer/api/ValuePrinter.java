package work.lcod.printer.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import work.lcod.printer.runtime.Evaluator;
import work.lcod.printer.runtime.Printer;
import work.lcod.printer.value.Value;

/**
 * Public entry point for rendering values. Stateless: concurrent calls on independent sinks need no
 * coordination.
 */
public final class ValuePrinter {
    private final Evaluator evaluator;

    public ValuePrinter(Evaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    /**
     * Streams {@code value} into {@code sink}, flushing it (when {@link java.io.Flushable}) before
     * every node.
     *
     * @throws UncheckedIOException when the sink fails
     * @throws work.lcod.printer.runtime.PrintCancelledException when cancellation was requested
     */
    public void print(Value value, PrintOptions options, Appendable sink) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(sink, "sink");
        try {
            new Printer(evaluator, options, sink).print(value);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write printed value", ex);
        }
    }

    public String render(Value value, PrintOptions options) {
        var out = new StringBuilder();
        print(value, options, out);
        return out.toString();
    }

    /**
     * Defers rendering until {@link PrintedValue#toString()} is called, e.g. by a message formatter.
     */
    public PrintedValue describe(Value value, PrintOptions options) {
        return new PrintedValue(this, value, options);
    }

    public record PrintedValue(ValuePrinter printer, Value value, PrintOptions options) {
        public PrintedValue {
            Objects.requireNonNull(printer, "printer");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(options, "options");
        }

        @Override
        public String toString() {
            return printer.render(value, options);
        }
    }
}
