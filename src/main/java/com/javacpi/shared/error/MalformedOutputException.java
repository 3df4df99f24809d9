package com.javacpi.shared.error;

public class MalformedOutputException extends ActionException {

    private static final int MAX_ECHO = 500;

    private final String rawText;

    public MalformedOutputException(String reason, String rawText) {
        this(reason, rawText, null);
    }

    public MalformedOutputException(String reason, String rawText, Throwable cause) {
        super("Malformed output (" + reason + "): " + abbreviate(rawText), cause);
        this.rawText = rawText;
    }

    public String rawText() { return rawText; }

    private static String abbreviate(String text) {
        if (text == null) return "<null>";
        var stripped = text.strip();
        return stripped.length() <= MAX_ECHO ? stripped : stripped.substring(0, MAX_ECHO) + "...";
    }

    @Override
    public FailureKind kind() {
        return FailureKind.MALFORMED_OUTPUT;
    }
}
