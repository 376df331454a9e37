package work.lcod.printer.text;

/**
 * ANSI SGR sequences and the fixed color assigned to each category of printed output.
 */
public final class Ansi {
    public static final String NORMAL = "\u001b[0m";
    public static final String FAINT = "\u001b[2m";
    public static final String RED = "\u001b[31;1m";
    public static final String GREEN = "\u001b[32;1m";
    public static final String BLUE = "\u001b[34;1m";
    public static final String MAGENTA = "\u001b[35;1m";
    public static final String CYAN = "\u001b[36;1m";

    private static final char ESC = '\u001b';
    private static final char BEL = '\u0007';

    private Ansi() {}

    public enum Style {
        /** Integers, floats, booleans and null. */
        SCALAR(CYAN),
        STRING(MAGENTA),
        /** Paths and derivation shortcuts. */
        PATH(GREEN),
        FUNCTION(BLUE),
        /** Caught evaluation errors and blackholes. */
        ERROR(RED),
        /** Repeated, elided, absent and thunk markers. */
        MARKER(FAINT);

        private final String code;

        Style(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    /**
     * Removes escape sequences and control characters so foreign text can be embedded in a single
     * line of output. Tabs become a single space.
     */
    public static String filterEscapes(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        var out = new StringBuilder(text.length());
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == ESC) {
                i = skipEscape(text, i + 1);
                continue;
            }
            if (c == '\t') {
                out.append(' ');
            } else if (c >= 0x20 && c != 0x7f) {
                out.append(c);
            }
            i++;
        }
        return out.toString();
    }

    private static int skipEscape(String text, int start) {
        int n = text.length();
        if (start >= n) {
            return n;
        }
        char kind = text.charAt(start);
        if (kind == '[') {
            int i = start + 1;
            while (i < n && (text.charAt(i) < 0x40 || text.charAt(i) > 0x7e)) {
                i++;
            }
            return Math.min(i + 1, n);
        }
        if (kind == ']') {
            int i = start + 1;
            while (i < n) {
                char c = text.charAt(i);
                if (c == BEL) {
                    return i + 1;
                }
                if (c == ESC && i + 1 < n && text.charAt(i + 1) == '\\') {
                    return i + 2;
                }
                i++;
            }
            return n;
        }
        return start + 1;
    }
}
