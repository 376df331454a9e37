package work.lcod.printer.value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of values. A {@code null} element is a hole: a slot that holds no value at all.
 *
 * <p>Equality is identity, as for {@link AttrSet}.
 */
public final class ListValue implements Value {
    private final List<Value> items;

    private ListValue(List<Value> items) {
        this.items = items;
    }

    public static ListValue of(Value... items) {
        return new ListValue(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(items))));
    }

    public static ListValue of(List<? extends Value> items) {
        return new ListValue(Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public List<Value> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public String toString() {
        return "ListValue(" + items.size() + " items)";
    }
}
