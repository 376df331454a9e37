package work.lcod.printer.runtime;

import java.io.Flushable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.printer.api.PrintOptions;
import work.lcod.printer.text.Ansi;
import work.lcod.printer.text.Elision;
import work.lcod.printer.text.FloatFormat;
import work.lcod.printer.text.Identifiers;
import work.lcod.printer.text.LiteralStrings;
import work.lcod.printer.value.AttrSet;
import work.lcod.printer.value.BoolValue;
import work.lcod.printer.value.ExternalValue;
import work.lcod.printer.value.FloatValue;
import work.lcod.printer.value.FunctionValue;
import work.lcod.printer.value.IntValue;
import work.lcod.printer.value.Lambda;
import work.lcod.printer.value.ListValue;
import work.lcod.printer.value.NullValue;
import work.lcod.printer.value.PartialPrimOp;
import work.lcod.printer.value.PathValue;
import work.lcod.printer.value.PrimOp;
import work.lcod.printer.value.PrimOpInfo;
import work.lcod.printer.value.StringValue;
import work.lcod.printer.value.Thunk;
import work.lcod.printer.value.Value;

/**
 * Recursive renderer behind {@link work.lcod.printer.api.ValuePrinter}. Each {@link #print(Value)}
 * call walks the graph with its own {@link TraversalContext}.
 */
public final class Printer {
    private final Evaluator evaluator;
    private final PrintOptions options;
    private final Appendable out;

    public Printer(Evaluator evaluator, PrintOptions options, Appendable out) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.options = Objects.requireNonNull(options, "options");
        this.out = Objects.requireNonNull(out, "out");
    }

    public void print(Value value) throws IOException {
        Objects.requireNonNull(value, "value");
        print(value, 0, TraversalContext.create(options.trackRepeated()));
    }

    private void print(Value value, int depth, TraversalContext ctx) throws IOException {
        flush();
        evaluator.pollCancellation();

        Value v = followResolved(value);
        if (options.force() && !isBlackhole(v)) {
            var forced = evaluator.force(v);
            if (forced.isFailure()) {
                printError(forced.error());
                return;
            }
            v = forced.value();
        }

        if (v instanceof IntValue i) {
            styled(Ansi.Style.SCALAR, Long.toString(i.value()));
        } else if (v instanceof FloatValue f) {
            styled(Ansi.Style.SCALAR, FloatFormat.format(f.value()));
        } else if (v instanceof BoolValue b) {
            styled(Ansi.Style.SCALAR, b.value() ? "true" : "false");
        } else if (v instanceof StringValue s) {
            LiteralStrings.printLiteralString(out, s.value(), options.maxStringLength(), options.ansiColors());
        } else if (v instanceof PathValue p) {
            // Printed verbatim, without escaping.
            styled(Ansi.Style.PATH, p.display());
        } else if (v instanceof NullValue) {
            styled(Ansi.Style.SCALAR, "null");
        } else if (v instanceof AttrSet attrs) {
            printAttrs(attrs, depth, ctx);
        } else if (v instanceof ListValue list) {
            printList(list, depth, ctx);
        } else if (v instanceof FunctionValue fn) {
            printFunction(fn);
        } else if (v instanceof Thunk thunk) {
            printThunk(thunk);
        } else if (v instanceof ExternalValue external) {
            external.describe(out);
        } else {
            throw new PrinterFaultException("Cannot print value of type " + v.getClass().getName());
        }
    }

    private static Value followResolved(Value value) {
        Value current = value;
        while (current instanceof Thunk thunk && thunk.state() == Thunk.State.RESOLVED) {
            current = thunk.value();
        }
        return current;
    }

    private static boolean isBlackhole(Value value) {
        return value instanceof Thunk thunk && thunk.state() == Thunk.State.BLACKHOLE;
    }

    private void printAttrs(AttrSet attrs, int depth, TraversalContext ctx) throws IOException {
        // AttrSet.empty() is one shared instance; never report it as repeated.
        if (!attrs.isEmpty() && ctx.isRepeated(attrs)) {
            printRepeated();
            return;
        }

        if (options.force() && options.derivationPaths() && evaluator.isDerivation(attrs)) {
            ctx.markSeen(attrs);
            printDerivation(attrs);
            return;
        }

        if (depth >= options.maxDepth()) {
            out.append("{ ... }");
            return;
        }

        if (!attrs.isEmpty()) {
            ctx.markSeen(attrs);
        }
        out.append("{ ");
        var sorted = sortedAttrs(attrs);
        for (int i = 0; i < sorted.size(); i++) {
            if (ctx.attrsPrinted() >= options.maxAttrs()) {
                printElided(sorted.size() - i, "attribute", "attributes");
                break;
            }
            var attr = sorted.get(i);
            Identifiers.printAttributeName(out, attr.name());
            out.append(" = ");
            print(attr.value(), depth + 1, ctx);
            out.append("; ");
            ctx.attrPrinted();
        }
        out.append("}");
    }

    private List<AttrOrder.NamedAttr> sortedAttrs(AttrSet attrs) {
        var sorted = new ArrayList<AttrOrder.NamedAttr>(attrs.size());
        for (var entry : attrs.entries().entrySet()) {
            sorted.add(new AttrOrder.NamedAttr(evaluator.resolveSymbol(entry.getKey()), entry.getValue()));
        }
        sorted.sort(options.maxAttrs() == PrintOptions.UNBOUNDED ? AttrOrder.LEXICOGRAPHIC : AttrOrder.IMPORTANT_FIRST);
        return sorted;
    }

    private void printDerivation(AttrSet attrs) throws IOException {
        String storePath = null;
        Value drvPath = attrs.get(evaluator.drvPathSymbol());
        if (drvPath != null) {
            try {
                storePath = evaluator.storePathDisplay(evaluator.coerceToStorePath(drvPath));
            } catch (EvaluationException ex) {
                printError(ex);
                return;
            }
        }
        styled(Ansi.Style.PATH, storePath == null ? "«derivation»" : "«derivation " + storePath + "»");
    }

    private void printList(ListValue list, int depth, TraversalContext ctx) throws IOException {
        // Distinct empty lists may share one instance; never report them as repeated.
        if (!list.isEmpty() && ctx.isRepeated(list)) {
            printRepeated();
            return;
        }

        if (depth >= options.maxDepth()) {
            out.append("[ ... ]");
            return;
        }

        if (!list.isEmpty()) {
            ctx.markSeen(list);
        }
        out.append("[ ");
        var items = list.items();
        for (int i = 0; i < items.size(); i++) {
            if (ctx.listItemsPrinted() >= options.maxListItems()) {
                printElided(items.size() - i, "item", "items");
                break;
            }
            var item = items.get(i);
            if (item == null) {
                styled(Ansi.Style.MARKER, "«absent»");
            } else {
                print(item, depth + 1, ctx);
            }
            out.append(" ");
            ctx.listItemPrinted();
        }
        out.append("]");
    }

    private void printFunction(FunctionValue fn) throws IOException {
        var text = new StringBuilder("«");
        if (fn instanceof Lambda lambda) {
            text.append("lambda");
            if (lambda.name().isPresent()) {
                text.append(' ').append(evaluator.resolveSymbol(lambda.name().get()));
            }
            if (lambda.position().isPresent()) {
                text.append(" @ ").append(Ansi.filterEscapes(evaluator.formatPosition(lambda.position().get())));
            }
        } else if (fn instanceof PrimOp primOp) {
            text.append(primOp.info().map(PrimOpInfo::display).orElse("primop"));
        } else if (fn instanceof PartialPrimOp partial) {
            text.append("partially applied ").append(partial.info().map(PrimOpInfo::display).orElse("primop"));
        } else {
            throw new PrinterFaultException("Cannot print function of type " + fn.getClass().getName());
        }
        text.append('»');
        styled(Ansi.Style.FUNCTION, text.toString());
    }

    private void printThunk(Thunk thunk) throws IOException {
        switch (thunk.state()) {
            // Only "potential": the value may still resolve once side effects such as traces complete.
            case BLACKHOLE -> styled(Ansi.Style.ERROR, "«potential infinite recursion»");
            case PENDING -> styled(Ansi.Style.MARKER, "«thunk»");
            default -> throw new PrinterFaultException("Cannot print thunk in state " + thunk.state());
        }
    }

    private void printRepeated() throws IOException {
        styled(Ansi.Style.MARKER, "«repeated»");
    }

    private void printElided(long count, String single, String plural) throws IOException {
        Elision.printElided(out, count, single, plural, options.ansiColors());
    }

    private void printError(EvaluationException error) throws IOException {
        styled(Ansi.Style.ERROR, "«" + error.displayMessage() + "»");
    }

    private void styled(Ansi.Style style, String text) throws IOException {
        if (options.ansiColors()) {
            out.append(style.code()).append(text).append(Ansi.NORMAL);
        } else {
            out.append(text);
        }
    }

    private void flush() throws IOException {
        if (out instanceof Flushable flushable) {
            flushable.flush();
        }
    }
}
