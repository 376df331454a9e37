package work.lcod.printer.value;

public record IntValue(long value) implements Value {
    public static IntValue of(long value) {
        return new IntValue(value);
    }
}
