package dev.dapbridge.server.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A tool as advertised by {@code tools/list} and invoked by {@code tools/call}.
 */
public record ToolDefinition(String name, String description, List<ToolParameter> parameters, ToolHandler handler) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * Applies defaults to the supplied arguments and checks that every required parameter is present.
     */
    public ToolArguments bind(Map<String, Object> supplied) throws MissingParameterException {
        Map<String, Object> values = new LinkedHashMap<>(supplied);
        for (ToolParameter parameter : parameters) {
            if (!values.containsKey(parameter.name()) && parameter.defaultValue() != null) {
                values.put(parameter.name(), parameter.defaultValue());
            }
        }
        for (ToolParameter parameter : parameters) {
            if (parameter.required() && !values.containsKey(parameter.name())) {
                throw new MissingParameterException(parameter.name());
            }
        }
        return new ToolArguments(values);
    }

    /** JSON schema of the tool input. {@code required} is always present, possibly empty. */
    public ObjectNode inputSchema(ObjectMapper mapper) {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = mapper.createArrayNode();
        for (ToolParameter parameter : parameters) {
            ObjectNode property = properties.putObject(parameter.name());
            if (parameter.type().schemaType() != null) {
                property.put("type", parameter.type().schemaType());
            }
            if (parameter.description() != null) {
                property.put("description", parameter.description());
            }
            if (parameter.defaultValue() != null) {
                property.set("default", mapper.valueToTree(parameter.defaultValue()));
            }
            if (parameter.required()) {
                required.add(parameter.name());
            }
        }
        schema.set("required", required);
        return schema;
    }
}
