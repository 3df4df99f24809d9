package com.javacpi.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;

/**
 * Lifecycle state of a virtual machine, keyed by Hyper-V's numeric state code.
 */
public enum VmState {
    RUNNING("Running", 2),
    STOPPED("Stopped", 3),
    SAVED("Saved", 6),
    PAUSED("Paused", 9),
    UNKNOWN("Unknown", -1);

    private final String label;
    private final int code;

    VmState(String label, int code) {
        this.label = label;
        this.code = code;
    }

    public String label() { return label; }

    public int code() { return code; }

    public static VmState fromCode(long code) {
        return Arrays.stream(values())
                .filter(s -> s != UNKNOWN && s.code == code)
                .findFirst()
                .orElse(UNKNOWN);
    }

    /** Accepts a numeric code, or a state name as Hyper-V prints it ("Off" is Stopped). */
    public static VmState fromText(String text) {
        if (text == null || text.isBlank()) return UNKNOWN;
        var value = text.strip();
        try {
            return fromCode(Long.parseLong(value));
        } catch (NumberFormatException e) {
            if (value.equalsIgnoreCase("Off")) return STOPPED;
            return Arrays.stream(values())
                    .filter(s -> s.label.equalsIgnoreCase(value))
                    .findFirst()
                    .orElse(UNKNOWN);
        }
    }

    public static VmState fromNode(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return UNKNOWN;
        if (node.isIntegralNumber()) return fromCode(node.asLong());
        return node.isTextual() ? fromText(node.asText()) : UNKNOWN;
    }
}
