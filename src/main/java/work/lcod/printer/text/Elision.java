package work.lcod.printer.text;

import java.io.IOException;

/**
 * Formats the {@code «N things elided»} notices emitted when an output budget runs out.
 */
public final class Elision {
    private Elision() {}

    public static void printElided(Appendable out, long count, String single, String plural, boolean ansiColors)
        throws IOException {
        if (ansiColors) {
            out.append(Ansi.Style.MARKER.code());
        }
        out.append('«').append(pluralize(count, single, plural)).append(" elided»");
        if (ansiColors) {
            out.append(Ansi.NORMAL);
        }
    }

    public static String pluralize(long count, String single, String plural) {
        return count + " " + (count == 1 ? single : plural);
    }
}
