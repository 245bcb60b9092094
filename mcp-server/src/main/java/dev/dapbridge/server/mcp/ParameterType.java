package dev.dapbridge.server.mcp;

/**
 * JSON schema type of a tool parameter. {@link #ANY} accepts every JSON value and is written to the
 * schema without a {@code type} keyword.
 */
public enum ParameterType {

    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array"),
    ANY(null);

    private final String schemaType;

    ParameterType(String schemaType) {
        this.schemaType = schemaType;
    }

    /** The schema {@code type} keyword, or {@code null} for {@link #ANY}. */
    public String schemaType() {
        return schemaType;
    }
}
