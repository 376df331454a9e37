package work.lcod.printer.value;

public record FloatValue(double value) implements Value {
    public static FloatValue of(double value) {
        return new FloatValue(value);
    }
}
