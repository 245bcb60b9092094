package dev.dapbridge.server.mcp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Arguments of a tool call after defaults were applied. The typed getters throw
 * {@link IllegalArgumentException} when a value has the wrong JSON type.
 */
public final class ToolArguments {

    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ToolArguments of(Map<String, Object> values) {
        return new ToolArguments(values);
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Object raw(String name) {
        return values.get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /** The string value, or {@code null} when absent. */
    public String string(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException(name + " must be a string");
        }
        return text;
    }

    /** The string value; absent or blank values are rejected. */
    public String requireString(String name) {
        String value = string(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required and must be a non-empty string");
        }
        return value;
    }

    public int integer(String name) {
        Integer value = optionalInteger(name);
        if (value == null) {
            throw new IllegalArgumentException(name + " is required and must be a number");
        }
        return value;
    }

    /** The integer value, or {@code null} when absent. Whole-valued decimals are accepted. */
    public Integer optionalInteger(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException(name + " must be a number");
        }
        double asDouble = number.doubleValue();
        if (asDouble != Math.rint(asDouble) || asDouble > Integer.MAX_VALUE || asDouble < Integer.MIN_VALUE) {
            throw new IllegalArgumentException(name + " must be a whole number, got " + number);
        }
        return number.intValue();
    }

    /** The boolean value, {@code false} when absent. */
    public boolean bool(String name) {
        Object value = values.get(name);
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean flag)) {
            throw new IllegalArgumentException(name + " must be a boolean");
        }
        return flag;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
