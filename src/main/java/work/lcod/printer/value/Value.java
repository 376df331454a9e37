package work.lcod.printer.value;

/**
 * A node of the evaluator's value graph.
 *
 * <p>The printer recognises a closed set of implementations: {@link IntValue}, {@link FloatValue},
 * {@link BoolValue}, {@link StringValue}, {@link PathValue}, {@link NullValue}, {@link AttrSet},
 * {@link ListValue}, {@link FunctionValue}, {@link Thunk} and {@link ExternalValue}. Opaque values
 * contributed by embedders must go through {@link ExternalValue}.
 */
public sealed interface Value
    permits IntValue, FloatValue, BoolValue, StringValue, PathValue, NullValue, AttrSet, ListValue,
        FunctionValue, Thunk, ExternalValue {
}
