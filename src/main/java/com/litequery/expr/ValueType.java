package com.litequery.expr;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    UNKNOWN;

    public static ValueType of(Object value) {
        if (value instanceof CharSequence) {
            return STRING;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Collection<?> || (value != null && value.getClass().isArray())) {
            return ARRAY;
        }
        if (value instanceof Map<?, ?>) {
            return OBJECT;
        }
        return UNKNOWN;
    }

    public static ValueType fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown value type: " + name, e);
        }
    }
}
