package dev.dapbridge.server.mcp;

import java.util.Objects;

/**
 * One input parameter of a tool.
 *
 * @param defaultValue value used when the caller omits the parameter, or {@code null} for none
 */
public record ToolParameter(String name, ParameterType type, boolean required, String description,
                            Object defaultValue) {

    public ToolParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static ToolParameter required(String name, ParameterType type, String description) {
        return new ToolParameter(name, type, true, description, null);
    }

    public static ToolParameter optional(String name, ParameterType type, String description) {
        return new ToolParameter(name, type, false, description, null);
    }

    public static ToolParameter optional(String name, ParameterType type, String description, Object defaultValue) {
        return new ToolParameter(name, type, false, description, defaultValue);
    }
}
