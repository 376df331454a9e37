package work.lcod.printer.value;

import java.util.Objects;

public record StringValue(String value) implements Value {
    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    public static StringValue of(String value) {
        return new StringValue(value);
    }
}
