package com.javacpi.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

public enum ParamKind {
    STRING("string"),
    INTEGER("integer"),
    BOOLEAN("boolean");

    private final String schemaType;

    ParamKind(String schemaType) {
        this.schemaType = schemaType;
    }

    public String schemaType() { return schemaType; }

    /**
     * Converts a loosely-typed value to this kind's canonical Java type
     * ({@code String}, {@code Long} or {@code Boolean}). Empty when the value does not fit.
     */
    public Optional<Object> coerce(Object raw) {
        if (raw == null) return Optional.empty();
        return switch (this) {
            case STRING -> raw instanceof CharSequence cs ? Optional.of(cs.toString()) : Optional.empty();
            case BOOLEAN -> raw instanceof Boolean b ? Optional.of(b) : Optional.empty();
            case INTEGER -> toLong(raw);
        };
    }

    private static Optional<Object> toLong(Object raw) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return Optional.of(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            return big.bitLength() <= 63 ? Optional.of(big.longValue()) : Optional.empty();
        }
        if (raw instanceof BigDecimal dec) {
            try {
                return Optional.of(dec.longValueExact());
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            // 2^63 itself is not a long; comparing against Long.MAX_VALUE would round up to it
            if (Double.isFinite(d) && d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63) {
                return Optional.of((long) d);
            }
        }
        return Optional.empty();
    }
}
