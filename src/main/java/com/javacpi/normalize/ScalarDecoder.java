package com.javacpi.normalize;

import com.javacpi.shared.error.MalformedOutputException;

public final class ScalarDecoder {

    private ScalarDecoder() {}

    /** Count on the last non-blank line; no output at all counts as zero. */
    public static long count(String text) {
        var line = lastNonBlankLine(text);
        if (line.isEmpty()) return 0;
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new MalformedOutputException("expected an integer count", text, e);
        }
    }

    /** Case-insensitive {@code True}/{@code False} on the last non-blank line. */
    public static boolean bool(String text) {
        var line = lastNonBlankLine(text);
        if (line.equalsIgnoreCase("true")) return true;
        if (line.isEmpty() || line.equalsIgnoreCase("false")) return false;
        throw new MalformedOutputException("expected True or False", text);
    }

    static String lastNonBlankLine(String text) {
        var lines = text.strip().lines().toList();
        return lines.isEmpty() ? "" : lines.get(lines.size() - 1).strip();
    }
}
