package work.lcod.printer.value;

public record NullValue() implements Value {
    public static final NullValue INSTANCE = new NullValue();
}
