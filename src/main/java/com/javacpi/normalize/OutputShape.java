package com.javacpi.normalize;

public enum OutputShape {
    CSV,
    JSON_OBJECT,
    JSON_ONE_OR_MANY,
    SCALAR_COUNT,
    SCALAR_BOOLEAN,
    SIDE_EFFECT_ONLY,
    /** Several shapes on consecutive lines, decoded by an action-specific function. */
    COMPOSITE
}
