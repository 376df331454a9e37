package work.lcod.printer.runtime;

import java.util.Comparator;
import work.lcod.printer.value.Value;

/**
 * Orderings applied to attribute sets before printing.
 */
final class AttrOrder {
    private AttrOrder() {}

    record NamedAttr(String name, Value value) {}

    static final Comparator<NamedAttr> LEXICOGRAPHIC = Comparator.comparing(NamedAttr::name);

    /**
     * {@code type} and {@code _type} first so a truncated set still shows what kind of value it is.
     */
    static final Comparator<NamedAttr> IMPORTANT_FIRST = Comparator
        .comparing((NamedAttr attr) -> !isImportant(attr.name()))
        .thenComparing(NamedAttr::name);

    static boolean isImportant(String name) {
        return "type".equals(name) || "_type".equals(name);
    }
}
