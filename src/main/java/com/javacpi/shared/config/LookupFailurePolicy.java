package com.javacpi.shared.config;

/**
 * What a create action does when its "already present?" lookup itself fails.
 */
public enum LookupFailurePolicy {
    /** Surface the lookup failure and skip the create. */
    FAIL("fail"),
    /** Assume the resource is absent and go on with the create. */
    TREAT_AS_ABSENT("treat-as-absent");

    private final String key;

    LookupFailurePolicy(String key) {
        this.key = key;
    }

    public String key() { return key; }

    public static LookupFailurePolicy fromKey(String key) {
        for (var p : values()) {
            if (p.key.equalsIgnoreCase(key) || p.name().equalsIgnoreCase(key)) return p;
        }
        throw new IllegalArgumentException("Unknown lookup failure policy: " + key);
    }
}
