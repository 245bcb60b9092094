package dev.dapbridge.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A variable; a non-zero {@code variablesReference} means it has children that can be expanded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Variable(String name, String value, String type, int variablesReference, String evaluateName) {

    public boolean hasChildren() {
        return variablesReference > 0;
    }
}
