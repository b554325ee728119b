package io.github.eutro.ir2coli.codegen;

/**
 * Maps IR names to identifiers that are valid in the generated program.
 */
public final class Names {
    private Names() {
    }

    private static boolean isAsciiAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAsciiAlnum(char c) {
        return isAsciiAlpha(c) || (c >= '0' && c <= '9');
    }

    /**
     * Sanitize a name.
     * <p>
     * A name starting with a letter gets a leading underscore, so that it can
     * never collide with a reserved word. Then {@code .} becomes {@code _},
     * {@code $} becomes {@code __}, and any other character that isn't a letter,
     * digit or underscore becomes {@code ___}.
     * <p>
     * This is deterministic, and idempotent on its own output, but it is not injective:
     * {@code "a.b"} and {@code "a_b"} map to the same identifier.
     *
     * @param name The IR name.
     * @return The identifier.
     */
    public static String printName(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 1);
        if (!name.isEmpty() && isAsciiAlpha(name.charAt(0))) {
            sb.append('_');
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '.') {
                sb.append('_');
            } else if (c == '$') {
                sb.append("__");
            } else if (c != '_' && !isAsciiAlnum(c)) {
                sb.append("___");
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Returns whether a string is a valid C identifier.
     *
     * @param name The string.
     * @return Whether it is an identifier.
     */
    public static boolean isIdentifier(String name) {
        if (name.isEmpty()) return false;
        char first = name.charAt(0);
        if (first != '_' && !isAsciiAlpha(first)) return false;
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c != '_' && !isAsciiAlnum(c)) return false;
        }
        return true;
    }
}
