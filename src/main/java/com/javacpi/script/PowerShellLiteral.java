package com.javacpi.script;

/**
 * Renders argument values as PowerShell literals. Strings become single-quoted
 * literals, which PowerShell never expands, so only the quote characters need escaping.
 */
public final class PowerShellLiteral {

    // PowerShell's tokenizer accepts the typographic single quotes as delimiters too
    private static final String SINGLE_QUOTES = "'‘’‚‛";

    private PowerShellLiteral() {}

    public static String quote(String value) {
        var sb = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (SINGLE_QUOTES.indexOf(c) >= 0) {
                sb.append(c);
            }
            sb.append(c);
        }
        return sb.append('\'').toString();
    }

    public static String of(Object value) {
        if (value instanceof String s) return quote(s);
        if (value instanceof Boolean b) return b ? "$true" : "$false";
        if (value instanceof Long || value instanceof Integer) return value.toString();
        throw new IllegalArgumentException("No PowerShell literal form for " +
                (value == null ? "null" : value.getClass().getSimpleName()));
    }
}
