package work.lcod.printer.api;

/**
 * Immutable options for one print call.
 *
 * <p>Every count accepts {@link #UNBOUNDED}. {@code maxDepth} defaults to a small bound because
 * the printer recurses on the host stack.
 */
public record PrintOptions(
    boolean force,
    int maxDepth,
    int maxAttrs,
    int maxListItems,
    int maxStringLength,
    boolean ansiColors,
    boolean trackRepeated,
    boolean derivationPaths
) {
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final int DEFAULT_MAX_DEPTH = 10;

    public PrintOptions {
        requireCount(maxDepth, "maxDepth");
        requireCount(maxAttrs, "maxAttrs");
        requireCount(maxListItems, "maxListItems");
        requireCount(maxStringLength, "maxStringLength");
    }

    public static PrintOptions defaults() {
        return builder().build();
    }

    /**
     * Options for values embedded in error messages: colored and tightly bounded.
     */
    public static PrintOptions errorMessages() {
        return builder()
            .ansiColors(true)
            .maxDepth(10)
            .maxAttrs(10)
            .maxListItems(10)
            .maxStringLength(1024)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .force(force)
            .maxDepth(maxDepth)
            .maxAttrs(maxAttrs)
            .maxListItems(maxListItems)
            .maxStringLength(maxStringLength)
            .ansiColors(ansiColors)
            .trackRepeated(trackRepeated)
            .derivationPaths(derivationPaths);
    }

    private static void requireCount(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }

    public static final class Builder {
        private boolean force;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int maxAttrs = UNBOUNDED;
        private int maxListItems = UNBOUNDED;
        private int maxStringLength = UNBOUNDED;
        private boolean ansiColors;
        private boolean trackRepeated = true;
        private boolean derivationPaths;

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxAttrs(int maxAttrs) {
            this.maxAttrs = maxAttrs;
            return this;
        }

        public Builder maxListItems(int maxListItems) {
            this.maxListItems = maxListItems;
            return this;
        }

        public Builder maxStringLength(int maxStringLength) {
            this.maxStringLength = maxStringLength;
            return this;
        }

        public Builder ansiColors(boolean ansiColors) {
            this.ansiColors = ansiColors;
            return this;
        }

        public Builder trackRepeated(boolean trackRepeated) {
            this.trackRepeated = trackRepeated;
            return this;
        }

        public Builder derivationPaths(boolean derivationPaths) {
            this.derivationPaths = derivationPaths;
            return this;
        }

        public PrintOptions build() {
            return new PrintOptions(
                force,
                maxDepth,
                maxAttrs,
                maxListItems,
                maxStringLength,
                ansiColors,
                trackRepeated,
                derivationPaths
            );
        }
    }
}
