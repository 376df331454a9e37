package work.lcod.printer.text;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Renders string and boolean literals.
 *
 * <p>Escaped characters: {@code "}, {@code \}, newline, carriage return, tab, and a {@code $} that
 * starts {@code ${}. Everything else is emitted as-is, so the output is meant for reading rather
 * than parsing back.
 */
public final class LiteralStrings {
    public static final int NO_LIMIT = Integer.MAX_VALUE;

    private LiteralStrings() {}

    /**
     * Prints {@code string} quoted, keeping at most {@code maxLength} code points. A longer string is
     * closed early and followed by an elision notice counting the code points left out.
     */
    public static void printLiteralString(Appendable out, String string, int maxLength, boolean ansiColors)
        throws IOException {
        if (ansiColors) {
            out.append(Ansi.Style.STRING.code());
        }
        out.append('"');
        int printed = 0;
        int i = 0;
        int n = string.length();
        while (i < n) {
            if (printed >= maxLength) {
                out.append('"');
                if (ansiColors) {
                    out.append(Ansi.NORMAL);
                }
                out.append(' ');
                Elision.printElided(out, string.codePointCount(i, n), "byte", "bytes", ansiColors);
                return;
            }
            int cp = string.codePointAt(i);
            int width = Character.charCount(cp);
            switch (cp) {
                case '"', '\\' -> out.append('\\').append((char) cp);
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '$' -> {
                    if (i + 1 < n && string.charAt(i + 1) == '{') {
                        out.append('\\');
                    }
                    out.append('$');
                }
                default -> out.append(string, i, i + width);
            }
            i += width;
            printed++;
        }
        out.append('"');
        if (ansiColors) {
            out.append(Ansi.NORMAL);
        }
    }

    public static void printLiteralString(Appendable out, String string) throws IOException {
        printLiteralString(out, string, NO_LIMIT, false);
    }

    /**
     * Quotes without any length limit or colors.
     */
    public static String quote(String string) {
        var out = new StringBuilder(string.length() + 2);
        try {
            printLiteralString(out, string);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return out.toString();
    }

    public static void printLiteralBool(Appendable out, boolean value) throws IOException {
        out.append(value ? "true" : "false");
    }
}
