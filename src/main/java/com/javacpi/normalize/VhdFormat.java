package com.javacpi.normalize;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;

/**
 * Virtual disk format, keyed by the numeric {@code VhdType} that {@code Get-VHD} reports.
 */
public enum VhdFormat {
    FIXED_SIZE("FixedSize", 2, "Fixed"),
    DYNAMIC_EXPANDING("DynamicExpanding", 3, "Dynamic"),
    DIFFERENCING("Differencing", 4, "Differencing"),
    UNKNOWN("Unknown", -1, "Unknown");

    private final String label;
    private final int code;
    private final String toolName;

    VhdFormat(String label, int code, String toolName) {
        this.label = label;
        this.code = code;
        this.toolName = toolName;
    }

    public String label() { return label; }

    public int code() { return code; }

    public static VhdFormat fromCode(long code) {
        return Arrays.stream(values())
                .filter(f -> f != UNKNOWN && f.code == code)
                .findFirst()
                .orElse(UNKNOWN);
    }

    public static VhdFormat fromNode(JsonNode node) {
        if (node == null) return UNKNOWN;
        if (node.isIntegralNumber()) return fromCode(node.asLong());
        if (node.isTextual()) {
            var text = node.asText().strip();
            return Arrays.stream(values())
                    .filter(f -> f.toolName.equalsIgnoreCase(text) || f.label.equalsIgnoreCase(text))
                    .findFirst()
                    .orElse(UNKNOWN);
        }
        return UNKNOWN;
    }
}
