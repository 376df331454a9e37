package work.lcod.printer.runtime;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * State of one top-level print call: the containers already visited and the running totals of
 * attributes and list items printed anywhere in the tree.
 */
public final class TraversalContext {
    private final Set<Object> seen;
    private long attrsPrinted;
    private long listItemsPrinted;

    private TraversalContext(Set<Object> seen) {
        this.seen = seen;
    }

    public static TraversalContext create(boolean trackRepeated) {
        return new TraversalContext(trackRepeated ? Collections.newSetFromMap(new IdentityHashMap<>()) : null);
    }

    public boolean tracksRepeated() {
        return seen != null;
    }

    public boolean isRepeated(Object container) {
        return seen != null && seen.contains(container);
    }

    public void markSeen(Object container) {
        if (seen != null) {
            seen.add(container);
        }
    }

    public long attrsPrinted() {
        return attrsPrinted;
    }

    public long listItemsPrinted() {
        return listItemsPrinted;
    }

    void attrPrinted() {
        attrsPrinted++;
    }

    void listItemPrinted() {
        listItemsPrinted++;
    }
}
