package work.lcod.printer.text;

import java.io.IOException;
import java.util.Set;

/**
 * Decides whether names can be printed bare or must be quoted as string literals.
 */
public final class Identifiers {
    // Keep in sync with the language's tokenizer. "or" is deliberately absent: it is a valid name.
    private static final Set<String> RESERVED_KEYWORDS = Set.of(
        "if", "then", "else", "assert", "with", "let", "in", "rec", "inherit"
    );

    private Identifiers() {}

    public static boolean isReservedKeyword(String name) {
        return RESERVED_KEYWORDS.contains(name);
    }

    public static void printIdentifier(Appendable out, String name) throws IOException {
        if (name.isEmpty()) {
            out.append("\"\"");
            return;
        }
        if (isReservedKeyword(name)) {
            out.append('"').append(name).append('"');
            return;
        }
        char first = name.charAt(0);
        if (!(isAsciiLetter(first) || first == '_')) {
            LiteralStrings.printLiteralString(out, name);
            return;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!isNameChar(name.charAt(i))) {
                LiteralStrings.printLiteralString(out, name);
                return;
            }
        }
        out.append(name);
    }

    /**
     * True when {@code name} can appear unquoted on the left of an attribute binding.
     */
    public static boolean isVarName(String name) {
        if (name.isEmpty() || isReservedKeyword(name)) {
            return false;
        }
        char first = name.charAt(0);
        if ((first >= '0' && first <= '9') || first == '-' || first == '\'') {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!isNameChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static void printAttributeName(Appendable out, String name) throws IOException {
        if (isVarName(name)) {
            out.append(name);
        } else {
            LiteralStrings.printLiteralString(out, name);
        }
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isNameChar(char c) {
        return isAsciiLetter(c) || (c >= '0' && c <= '9') || c == '_' || c == '\'' || c == '-';
    }
}
