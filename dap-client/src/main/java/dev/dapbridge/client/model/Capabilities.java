package dev.dapbridge.client.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Capabilities returned by {@code initialize}. The raw body is kept because debuggers add their own
 * flags; the accessors cover the ones this client looks at.
 */
public record Capabilities(JsonNode raw) {

    public Capabilities {
        if (raw == null) {
            raw = MissingNode.getInstance();
        }
    }

    public boolean supports(String capability) {
        return raw.path(capability).asBoolean(false);
    }

    public boolean supportsConfigurationDoneRequest() {
        return supports("supportsConfigurationDoneRequest");
    }

    public boolean supportsSetVariable() {
        return supports("supportsSetVariable");
    }

    public List<String> exceptionBreakpointFilters() {
        List<String> filters = new ArrayList<>();
        for (JsonNode filter : raw.path("exceptionBreakpointFilters")) {
            filters.add(filter.path("filter").asText());
        }
        return filters;
    }
}
